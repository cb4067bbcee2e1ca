package com.mikov.emailvalidator.dns;

import java.time.Instant;

/**
 * Cache entry for one domain. {@code priority} is in [1,5] and already folded into
 * {@code expiresAt}.
 */
public record DomainDnsRecord(String domain, DnsLookupResult result, Instant expiresAt, int priority) {

    public boolean isExpired(final Instant now) {
        return now.isAfter(expiresAt);
    }
}
