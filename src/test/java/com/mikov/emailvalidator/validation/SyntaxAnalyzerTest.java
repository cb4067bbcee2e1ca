package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationIssue;
import com.mikov.emailvalidator.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxAnalyzerTest {

    private SyntaxAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = TestFixtures.syntaxAnalyzer();
    }

    @Test
    void acceptsPlainAddress() {
        final var analysis = analyzer.analyze("test@example.com");

        assertTrue(analysis.isValid());
        assertTrue(analysis.getWarnings().isEmpty());
        assertEquals("test", analysis.getLocalPart());
        assertEquals("example.com", analysis.getDomain());
        assertEquals(4, analysis.getLocalPartFacts().length());
        assertEquals("com", analysis.getDomainFacts().tld());
        assertEquals(2, analysis.getDomainFacts().labelCount());
    }

    @ParameterizedTest
    @DisplayName("Strings without @ fail with FORMAT only")
    @ValueSource(strings = {"not-an-email", "", "example.com"})
    void missingAtSignIsFormatError(final String input) {
        final var analysis = analyzer.analyze(input);

        assertEquals(List.of(ValidationCode.FORMAT), codes(analysis.getErrors()));
        assertNull(analysis.getLocalPartFacts());
    }

    @Test
    void consecutiveDotsAreRejected() {
        final var analysis = analyzer.analyze("john..doe@example.com");

        assertTrue(codes(analysis.getErrors()).contains(ValidationCode.CONSECUTIVE_DOTS));
    }

    @Test
    void localPartOver64CharactersIsRejected() {
        final var analysis = analyzer.analyze("a".repeat(65) + "@example.com");

        assertTrue(codes(analysis.getErrors()).contains(ValidationCode.LOCAL_LENGTH));
    }

    @Test
    void addressOver254CharactersIsRejected() {
        final var domain = "a".repeat(62) + "." + "b".repeat(62) + "." + "c".repeat(62) + "." + "d".repeat(62) + ".com";
        final var analysis = analyzer.analyze("user@" + domain);

        assertTrue(codes(analysis.getErrors()).contains(ValidationCode.LENGTH));
        assertFalse(codes(analysis.getErrors()).contains(ValidationCode.LABEL_LENGTH));
    }

    @Test
    void labelOver63CharactersIsRejected() {
        final var analysis = analyzer.analyze("user@" + "a".repeat(64) + ".com");

        assertTrue(codes(analysis.getErrors()).contains(ValidationCode.LABEL_LENGTH));
    }

    @Test
    void singleLabelDomainIsRejected() {
        final var analysis = analyzer.analyze("user@localhost");

        assertTrue(codes(analysis.getErrors()).contains(ValidationCode.DOMAIN_PARTS));
    }

    @Test
    void ipLiteralDomainIsAWarning() {
        final var analysis = analyzer.analyze("user@[192.168.1.1]");

        assertTrue(analysis.isValid());
        assertTrue(analysis.getDomainFacts().ip());
        assertTrue(codes(analysis.getWarnings()).contains(ValidationCode.IP_DOMAIN));
    }

    @Test
    void quotedLocalPartIsAWarning() {
        final var analysis = analyzer.analyze("\"john.doe\"@example.com");

        assertTrue(analysis.isValid());
        assertTrue(analysis.getLocalPartFacts().quoted());
        assertTrue(codes(analysis.getWarnings()).contains(ValidationCode.QUOTED_LOCAL));
    }

    @Test
    void unicodeDomainIsFlaggedButPunycodeIsNot() {
        final var unicode = analyzer.analyze("user@bücher.de");
        final var punycode = analyzer.analyze("user@xn--bcher-kva.de");

        assertTrue(codes(unicode.getWarnings()).contains(ValidationCode.UNICODE_DOMAIN));
        assertTrue(punycode.getDomainFacts().punycode());
        assertFalse(codes(punycode.getWarnings()).contains(ValidationCode.UNICODE_DOMAIN));
        assertTrue(punycode.isValid());
    }

    @Test
    void unicodeLocalPartIsFlagged() {
        final var analysis = analyzer.analyze("jürgen@example.com");

        assertTrue(analysis.getLocalPartFacts().containsUnicode());
        assertTrue(codes(analysis.getWarnings()).contains(ValidationCode.UNICODE_LOCAL));
    }

    @Test
    void specialCharactersAreCollected() {
        final var analysis = analyzer.analyze("first.last+tag@example.com");

        assertTrue(analysis.isValid());
        assertEquals(".+", analysis.getLocalPartFacts().specialChars());
    }

    @Test
    void roleAndDisposableFactsAreRecorded() {
        assertTrue(analyzer.analyze("support@example.com").isRoleBased());
        assertTrue(analyzer.analyze("info-eu@example.com").isRoleBased());
        assertFalse(analyzer.analyze("jane@example.com").isRoleBased());
        assertTrue(analyzer.analyze("jane@mailinator.com").isDisposable());
        assertTrue(analyzer.analyze("jane@inbox.yopmail.com").isDisposable());
        assertFalse(analyzer.analyze("jane@example.com").isDisposable());
    }

    private static List<ValidationCode> codes(final List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::code).toList();
    }
}
