package com.mikov.emailvalidator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Caller-facing shape of a single validation: the result fields plus the derived
 * score and risk level.
 *
 * @author zahari.mikov
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmailValidationResponse {

    private final String id;
    private final String email;
    private final String normalizedEmail;
    private final boolean valid;
    private final int score;

    @JsonProperty("risk_level")
    private final RiskLevel riskLevel;

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;
    private final Map<String, Object> details;
    private final String createdAt;

    public static EmailValidationResponseBuilder from(final ValidationResult result) {
        return EmailValidationResponse.builder()
                .email(result.getEmail())
                .normalizedEmail(result.getNormalizedEmail())
                .valid(result.isValid())
                .errors(result.getErrors())
                .warnings(result.getWarnings())
                .details(result.getDetails());
    }
}
