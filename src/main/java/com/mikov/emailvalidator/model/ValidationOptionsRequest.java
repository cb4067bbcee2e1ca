package com.mikov.emailvalidator.model;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional validation flags as they arrive over the wire. Missing values fall back to
 * the {@link ValidationOptions} defaults.
 */
@Data
@NoArgsConstructor
public class ValidationOptionsRequest {

    private Boolean checkDisposable;
    private Boolean checkRoleBased;
    private Boolean checkTypos;
    private Boolean checkDns;
    private Boolean allowNoMx;
    private String priority;
    private Long batchTimeoutMs;

    public ValidationOptions toOptions() {
        final var builder = ValidationOptions.builder();
        if (checkDisposable != null) {
            builder.checkDisposable(checkDisposable);
        }
        if (checkRoleBased != null) {
            builder.checkRoleBased(checkRoleBased);
        }
        if (checkTypos != null) {
            builder.checkTypos(checkTypos);
        }
        if (checkDns != null) {
            builder.checkDns(checkDns);
        }
        if (allowNoMx != null) {
            builder.allowNoMx(allowNoMx);
        }
        if (priority != null) {
            builder.priority(Priority.fromName(priority));
        }
        if (batchTimeoutMs != null) {
            builder.batchTimeoutMs(batchTimeoutMs);
        }
        return builder.build();
    }
}
