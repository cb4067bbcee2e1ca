package com.mikov.emailvalidator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Options controlling which optional checks run for a validation request.
 * A {@code batchTimeoutMs} of zero means the configured per-item timeout applies.
 *
 * @author zahari.mikov
 */
@Value
@Builder(toBuilder = true)
public class ValidationOptions {

    @Builder.Default
    boolean checkDisposable = false;

    @Builder.Default
    boolean checkRoleBased = false;

    @Builder.Default
    boolean checkTypos = false;

    @Builder.Default
    boolean checkDns = false;

    @Builder.Default
    boolean allowNoMx = false;

    @Builder.Default
    Priority priority = Priority.NORMAL;

    @Builder.Default
    long batchTimeoutMs = 0;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }
}
