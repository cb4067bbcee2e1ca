package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.model.RiskLevel;
import com.mikov.emailvalidator.model.ValidationResult;

/**
 * Strategy for turning a validation result into a 0-100 trust score.
 * Higher scores mean a more trustworthy address.
 *
 * @author zahari.mikov
 */
public interface RiskScoreCalculator {

    int LOW_RISK_THRESHOLD = 70;
    int MEDIUM_RISK_THRESHOLD = 40;

    /**
     * Calculate the score for a finished validation.
     *
     * @param result the validation outcome, with or without DNS details
     * @return score between 0 and 100
     */
    int calculateScore(final ValidationResult result);

    default RiskLevel riskLevel(final int score) {
        if (score >= LOW_RISK_THRESHOLD) {
            return RiskLevel.LOW;
        } else if (score >= MEDIUM_RISK_THRESHOLD) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }
}
