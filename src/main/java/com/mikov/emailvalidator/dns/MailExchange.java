package com.mikov.emailvalidator.dns;

/**
 * Normalized MX record annotated with provider-family flags.
 */
public record MailExchange(int priority,
                           String exchange,
                           boolean googleWorkspace,
                           boolean microsoft365,
                           boolean popular) {
}
