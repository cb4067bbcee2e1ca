package com.mikov.emailvalidator.dns;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What is known about a domain's DNS after one lookup. Failed lookups carry an
 * {@link DnsErrorCode} and report no DNS.
 *
 * @author zahari.mikov
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DnsLookupResult {

    String domain;
    boolean hasDns;
    boolean hasMx;
    boolean hasValidA;

    @Builder.Default
    List<MailExchange> mxRecords = List.of();

    @JsonProperty("aRecords")
    @Builder.Default
    List<String> aRecords = List.of();

    DnsErrorCode errorCode;
    String errorMessage;
    long responseTimeMs;

    public boolean isError() {
        return errorCode != null;
    }

    /**
     * The lowest-priority-value MX, or {@code null} when the domain has none.
     */
    public MailExchange primaryMx() {
        return mxRecords.isEmpty() ? null : mxRecords.get(0);
    }

    public static DnsLookupResult failure(final String domain, final DnsErrorCode errorCode, final String message) {
        return DnsLookupResult.builder()
                .domain(domain)
                .errorCode(errorCode)
                .errorMessage(message)
                .build();
    }
}
