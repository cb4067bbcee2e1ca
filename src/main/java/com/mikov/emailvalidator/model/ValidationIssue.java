package com.mikov.emailvalidator.model;

/**
 * A single error or warning produced while validating an address.
 */
public record ValidationIssue(ValidationCode code, String message) {
}
