package com.mikov.emailvalidator.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypoDetectorTest {

    private final TypoDetector detector = new TypoDetector();

    @ParameterizedTest
    @CsvSource({
            "gmial.com, gmail.com",
            "gmal.com, gmail.com",
            "yaho.com, yahoo.com",
            "hotmial.com, hotmail.com",
            "OUTLOK.COM, outlook.com"
    })
    void suggestsClosePopularDomain(final String domain, final String expected) {
        assertEquals(Optional.of(expected), detector.suggest(domain));
    }

    @ParameterizedTest
    @ValueSource(strings = {"gmail.com", "example.com", "company-intranet.org", ""})
    void noSuggestionForPopularOrUnrelatedDomains(final String domain) {
        assertTrue(detector.suggest(domain).isEmpty());
    }

    @Test
    void levenshteinDistance() {
        assertEquals(0, TypoDetector.levenshteinDistance("gmail.com", "gmail.com"));
        assertEquals(2, TypoDetector.levenshteinDistance("gmial.com", "gmail.com"));
        assertEquals(3, TypoDetector.levenshteinDistance("kitten", "sitting"));
    }
}
