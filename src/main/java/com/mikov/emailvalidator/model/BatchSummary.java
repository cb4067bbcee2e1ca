package com.mikov.emailvalidator.model;

import java.util.List;

public record BatchSummary(int total, int valid, int invalid) {

    public static BatchSummary of(final List<ValidationResult> results) {
        final var valid = (int) results.stream().filter(ValidationResult::isValid).count();
        return new BatchSummary(results.size(), valid, results.size() - valid);
    }
}
