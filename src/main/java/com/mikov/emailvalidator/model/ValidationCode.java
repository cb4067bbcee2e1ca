package com.mikov.emailvalidator.model;

/**
 * Codes attached to validation errors and warnings.
 *
 * @author zahari.mikov
 */
public enum ValidationCode {
    FORMAT,
    LENGTH,
    LOCAL_LENGTH,
    DOMAIN_LENGTH,
    MIN_LENGTH,
    UNICODE_LOCAL,
    CONSECUTIVE_DOTS,
    QUOTED_LOCAL,
    IP_DOMAIN,
    UNICODE_DOMAIN,
    DOMAIN_PARTS,
    LABEL_LENGTH,
    SYNTAX,
    DISPOSABLE,
    ROLE_BASED,
    TYPO,
    DNS,
    MX,
    POPULAR_PROVIDER,
    GOOGLE_WORKSPACE,
    MICROSOFT_365,
    TIMEOUT,
    SYSTEM;

    /**
     * Whether the code describes a problem with the address text itself, as opposed to
     * its domain's DNS or an internal failure.
     */
    public boolean isSyntactic() {
        return switch (this) {
            case FORMAT, LENGTH, LOCAL_LENGTH, DOMAIN_LENGTH, MIN_LENGTH, CONSECUTIVE_DOTS,
                 DOMAIN_PARTS, LABEL_LENGTH, SYNTAX -> true;
            default -> false;
        };
    }
}
