package com.mikov.emailvalidator.dns;

import lombok.Getter;

/**
 * Raised by a {@link DnsResolver} when a lookup cannot be answered.
 */
@Getter
public class DnsLookupException extends Exception {

    private final DnsErrorCode errorCode;

    public DnsLookupException(final DnsErrorCode errorCode, final String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DnsLookupException(final DnsErrorCode errorCode, final String message, final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
