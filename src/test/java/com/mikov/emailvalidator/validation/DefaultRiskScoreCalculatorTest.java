package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.dns.DnsLookupResult;
import com.mikov.emailvalidator.model.RiskLevel;
import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRiskScoreCalculatorTest {

    private final DefaultRiskScoreCalculator calculator =
            new DefaultRiskScoreCalculator(new NeutralDomainReputationProvider());

    @Test
    void cleanAddressWithoutDnsCheck() {
        final var result = new ValidationResult.Builder("jane@example.com")
                .withNormalizedEmail("jane@example.com")
                .build();

        // 30 syntax + 15 unchecked DNS + 15 + 10 + 8 neutral reputation
        assertEquals(78, calculator.calculateScore(result));
        assertEquals(RiskLevel.LOW, calculator.riskLevel(78));
    }

    @Test
    void fullDnsEarnsMorePoints() {
        final var dns = DnsLookupResult.builder().domain("example.com").hasDns(true).hasMx(true).hasValidA(true).build();
        final var result = new ValidationResult.Builder("jane@example.com")
                .withNormalizedEmail("jane@example.com")
                .withDetail(ValidationResult.DETAIL_DNS, dns)
                .build();

        assertEquals(93, calculator.calculateScore(result));
    }

    @Test
    void warningsLowerTheScore() {
        final var result = new ValidationResult.Builder("admin@mailinator.com")
                .withNormalizedEmail("admin@mailinator.com")
                .addWarning(ValidationCode.DISPOSABLE, "Disposable email address detected")
                .addWarning(ValidationCode.ROLE_BASED, "Role-based email address detected")
                .addWarning(ValidationCode.TYPO, "Did you mean '@gmail.com'?")
                .build();

        assertEquals(43, calculator.calculateScore(result));
        assertEquals(RiskLevel.MEDIUM, calculator.riskLevel(43));
    }

    @Test
    void invalidResultIsCapped() {
        final var result = ValidationResult.failure("not-an-email", ValidationCode.FORMAT, "Invalid email format");

        final var score = calculator.calculateScore(result);

        assertTrue(score <= 30);
        assertEquals(RiskLevel.HIGH, calculator.riskLevel(score));
    }

    @Test
    void reputationIsClampedAndWeighted() {
        final var trusted = new DefaultRiskScoreCalculator(domain -> 250);
        final var result = new ValidationResult.Builder("jane@example.com")
                .withNormalizedEmail("jane@example.com")
                .build();

        assertEquals(85, trusted.calculateScore(result));
    }

    @ParameterizedTest
    @CsvSource({"100, LOW", "70, LOW", "69, MEDIUM", "40, MEDIUM", "39, HIGH", "0, HIGH"})
    void riskLevelThresholds(final int score, final RiskLevel expected) {
        assertEquals(expected, calculator.riskLevel(score));
    }
}
