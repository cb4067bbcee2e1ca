package com.mikov.emailvalidator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of validating one email address. Instances are immutable; use {@link Builder}
 * to accumulate errors, warnings and details while the pipeline runs.
 *
 * @author zahari.mikov
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ValidationResult {

    public static final String DETAIL_LOCAL_PART = "localPart";
    public static final String DETAIL_DOMAIN = "domain";
    public static final String DETAIL_DNS = "dns";
    public static final String DETAIL_TYPO = "typo";

    private final String email;
    private final String normalizedEmail;
    private final boolean valid;
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;
    private final Map<String, Object> details;

    private ValidationResult(final Builder builder) {
        this.email = builder.email;
        this.normalizedEmail = builder.normalizedEmail;
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
        this.valid = this.errors.isEmpty();
    }

    public boolean hasError(final ValidationCode code) {
        return errors.stream().anyMatch(issue -> issue.code() == code);
    }

    public boolean hasWarning(final ValidationCode code) {
        return warnings.stream().anyMatch(issue -> issue.code() == code);
    }

    @JsonIgnore
    public Optional<ValidationIssue> getFirstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    /**
     * Creates an invalid result carrying exactly one error.
     */
    public static ValidationResult failure(final String email, final ValidationCode code, final String message) {
        return new Builder(email).addError(code, message).build();
    }

    /**
     * Creates the result reported when the pipeline itself failed unexpectedly.
     */
    public static ValidationResult systemError(final String email) {
        return failure(email, ValidationCode.SYSTEM, "Validation system error");
    }

    public static class Builder {
        private final String email;
        private String normalizedEmail;
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder(final String email) {
            this.email = email;
        }

        public Builder withNormalizedEmail(final String normalizedEmail) {
            this.normalizedEmail = normalizedEmail;
            return this;
        }

        public Builder addError(final ValidationCode code, final String message) {
            this.errors.add(new ValidationIssue(code, message));
            return this;
        }

        public Builder addErrors(final List<ValidationIssue> issues) {
            this.errors.addAll(issues);
            return this;
        }

        public Builder addWarning(final ValidationCode code, final String message) {
            this.warnings.add(new ValidationIssue(code, message));
            return this;
        }

        public Builder addWarnings(final List<ValidationIssue> issues) {
            this.warnings.addAll(issues);
            return this;
        }

        public Builder withDetail(final String key, final Object value) {
            this.details.put(key, value);
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
