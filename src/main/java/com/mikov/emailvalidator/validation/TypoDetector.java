package com.mikov.emailvalidator.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Suggests a well-known mailbox domain when an address's domain looks like a misspelling
 * of one (e.g. {@code gmial.com}).
 * <p>
 * A candidate must be within {@value #MAX_LEVENSHTEIN_DISTANCE} edits and at least
 * {@value #MIN_SIMILARITY} similar, measured as one minus distance over the longer length.
 *
 * @author zahari.mikov
 */
@Slf4j
@Component
public class TypoDetector {

    static final int MAX_LEVENSHTEIN_DISTANCE = 2;
    static final double MIN_SIMILARITY = 0.75;

    private static final Set<String> POPULAR_DOMAINS = Set.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "aol.com",
            "icloud.com", "protonmail.com", "mail.com", "zoho.com", "yandex.com",
            "gmx.com", "live.com", "msn.com", "googlemail.com", "me.com",
            "mail.ru", "fastmail.com", "comcast.net", "verizon.net", "att.net"
    );

    /**
     * @param domain the domain to check
     * @return the popular domain the input most likely meant, or empty when the domain is
     *         itself popular or nothing is close enough
     */
    public Optional<String> suggest(final String domain) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        final var normalized = domain.toLowerCase(Locale.ROOT);
        if (POPULAR_DOMAINS.contains(normalized)) {
            return Optional.empty();
        }

        String best = null;
        var bestDistance = Integer.MAX_VALUE;
        for (final var popularDomain : POPULAR_DOMAINS) {
            final var distance = levenshteinDistance(normalized, popularDomain);
            final var similarity = 1.0 - (double) distance / Math.max(normalized.length(), popularDomain.length());
            if (distance <= MAX_LEVENSHTEIN_DISTANCE && similarity >= MIN_SIMILARITY
                    && (distance < bestDistance || (distance == bestDistance && popularDomain.compareTo(best) < 0))) {
                best = popularDomain;
                bestDistance = distance;
            }
        }

        if (best != null) {
            log.debug("Domain {} looks like a typo of {} (distance={})", normalized, best, bestDistance);
        }
        return Optional.ofNullable(best);
    }

    static int levenshteinDistance(final String s1, final String s2) {
        final var dp = new int[s1.length() + 1][s2.length() + 1];

        for (var i = 0; i <= s1.length(); i++) {
            dp[i][0] = i;
        }

        for (var j = 0; j <= s2.length(); j++) {
            dp[0][j] = j;
        }

        for (var i = 1; i <= s1.length(); i++) {
            for (var j = 1; j <= s2.length(); j++) {
                final var cost = (s1.charAt(i - 1) == s2.charAt(j - 1)) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }

        return dp[s1.length()][s2.length()];
    }
}
