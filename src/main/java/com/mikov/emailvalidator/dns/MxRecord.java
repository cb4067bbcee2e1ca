package com.mikov.emailvalidator.dns;

/**
 * Raw MX answer as returned by a resolver.
 */
public record MxRecord(int priority, String exchange) {
}
