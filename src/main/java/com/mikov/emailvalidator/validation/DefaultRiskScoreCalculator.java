package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.dns.DnsLookupResult;
import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationResult;
import org.springframework.stereotype.Component;

/**
 * Default implementation of the risk score calculator.
 * Adds up fixed points per passed check, weighted towards syntax and DNS.
 *
 * @author zahari.mikov
 */
@Component
public class DefaultRiskScoreCalculator implements RiskScoreCalculator {

    private static final int SYNTAX_POINTS = 30;
    private static final int MX_POINTS = 20;
    private static final int A_RECORD_POINTS = 10;
    private static final int DNS_MAX_POINTS = 30;
    private static final int DNS_UNCHECKED_POINTS = 15;
    private static final int NOT_DISPOSABLE_POINTS = 15;
    private static final int NOT_ROLE_BASED_POINTS = 10;
    private static final int REPUTATION_POINTS = 15;
    private static final int TYPO_PENALTY = 10;
    private static final int INVALID_CAP = 30;

    private final DomainReputationProvider reputationProvider;

    public DefaultRiskScoreCalculator(final DomainReputationProvider reputationProvider) {
        this.reputationProvider = reputationProvider;
    }

    @Override
    public int calculateScore(final ValidationResult result) {
        var score = 0;

        final var syntaxFailed = result.getErrors().stream().anyMatch(issue -> issue.code().isSyntactic());
        if (!syntaxFailed) {
            score += SYNTAX_POINTS;
        }

        score += dnsPoints(result);

        // Disposable and role-based only show up when the caller asked for them
        if (!result.hasWarning(ValidationCode.DISPOSABLE)) {
            score += NOT_DISPOSABLE_POINTS;
        }
        if (!result.hasWarning(ValidationCode.ROLE_BASED)) {
            score += NOT_ROLE_BASED_POINTS;
        }

        final var domain = domainOf(result);
        if (domain != null) {
            final var reputation = Math.max(0, Math.min(100, reputationProvider.reputationOf(domain)));
            score += Math.round(REPUTATION_POINTS * reputation / 100.0f);
        }

        if (result.hasWarning(ValidationCode.TYPO)) {
            score -= TYPO_PENALTY;
        }

        if (!result.isValid()) {
            score = Math.min(score, INVALID_CAP);
        }
        return Math.min(100, Math.max(0, score));
    }

    private int dnsPoints(final ValidationResult result) {
        final var detail = result.getDetails().get(ValidationResult.DETAIL_DNS);
        if (!(detail instanceof DnsLookupResult dns)) {
            return DNS_UNCHECKED_POINTS;
        }
        var points = 0;
        if (dns.isHasMx()) {
            points += MX_POINTS;
        }
        if (dns.isHasValidA()) {
            points += A_RECORD_POINTS;
        }
        return Math.min(DNS_MAX_POINTS, points);
    }

    private String domainOf(final ValidationResult result) {
        final var email = result.getNormalizedEmail();
        if (email == null) {
            return null;
        }
        final var at = email.lastIndexOf('@');
        return at < 0 || at == email.length() - 1 ? null : email.substring(at + 1);
    }
}
