package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.dns.DnsErrorCode;
import com.mikov.emailvalidator.dns.DnsLookupException;
import com.mikov.emailvalidator.dns.DnsLookupResult;
import com.mikov.emailvalidator.dns.DnsResolver;
import com.mikov.emailvalidator.dns.DnsResultCache;
import com.mikov.emailvalidator.dns.MxRecord;
import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationOptions;
import com.mikov.emailvalidator.model.ValidationResult;
import com.mikov.emailvalidator.support.MutableClock;
import com.mikov.emailvalidator.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailValidatorTest {

    private DnsResolver resolver;
    private EmailValidator validator;

    @BeforeEach
    void setUp() {
        resolver = mock(DnsResolver.class);
        final DnsResultCache cache = TestFixtures.directCache(resolver, MutableClock.startingNow());
        validator = TestFixtures.emailValidator(cache);
    }

    @Test
    @DisplayName("test@example.com with default options is valid")
    void plainAddressIsValid() {
        final var result = validator.validate("test@example.com", ValidationOptions.defaults());

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertEquals("test@example.com", result.getNormalizedEmail());
        assertTrue(result.getDetails().containsKey(ValidationResult.DETAIL_LOCAL_PART));
        assertTrue(result.getDetails().containsKey(ValidationResult.DETAIL_DOMAIN));
    }

    @Test
    void missingOptionsUseDefaults() {
        assertTrue(validator.validate("test@example.com", null).isValid());
    }

    @ParameterizedTest
    @DisplayName("Input without @ is a FORMAT error and never reaches DNS")
    @ValueSource(strings = {"not-an-email", "plainaddress", "   "})
    void missingAtSignIsFormatErrorWithoutDns(final String input) throws DnsLookupException {
        final var options = ValidationOptions.builder().checkDns(true).build();

        final var result = validator.validateWithDns(input, options).join();

        assertFalse(result.isValid());
        assertEquals(ValidationCode.FORMAT, result.getFirstError().orElseThrow().code());
        assertEquals(1, result.getErrors().size());
        verify(resolver, never()).resolveMx(anyString());
        verify(resolver, never()).resolveA(anyString());
    }

    @Test
    void nullEmailIsFormatError() {
        final var result = validator.validate(null, ValidationOptions.defaults());

        assertFalse(result.isValid());
        assertTrue(result.hasError(ValidationCode.FORMAT));
    }

    @ParameterizedTest
    @DisplayName("Normalization is idempotent")
    @ValueSource(strings = {"  Test@Example.COM ", "user@example.com", "MiXeD.Case+Tag@Sub.Domain.ORG"})
    void normalizeIsIdempotent(final String email) {
        final var once = validator.normalize(email);

        assertEquals(once, validator.normalize(once));
    }

    @Test
    void whitespaceAroundAddressIsTrimmed() {
        final var result = validator.validate("  Jane.Doe@Example.com  ", ValidationOptions.defaults());

        assertTrue(result.isValid());
        assertEquals("jane.doe@example.com", result.getNormalizedEmail());
        assertEquals("  Jane.Doe@Example.com  ", result.getEmail());
    }

    @Test
    void disposableAndRoleChecksOnlyWarn() {
        final var options = ValidationOptions.builder().checkDisposable(true).checkRoleBased(true).build();

        final var result = validator.validate("admin@mailinator.com", options);

        assertTrue(result.isValid());
        assertTrue(result.hasWarning(ValidationCode.DISPOSABLE));
        assertTrue(result.hasWarning(ValidationCode.ROLE_BASED));
    }

    @Test
    void disposableAndRoleChecksAreOptIn() {
        final var result = validator.validate("admin@mailinator.com", ValidationOptions.defaults());

        assertFalse(result.hasWarning(ValidationCode.DISPOSABLE));
        assertFalse(result.hasWarning(ValidationCode.ROLE_BASED));
    }

    @Test
    void typoCheckAddsSuggestion() {
        final var options = ValidationOptions.builder().checkTypos(true).build();

        final var result = validator.validate("jane@gmial.com", options);

        assertTrue(result.isValid());
        assertTrue(result.hasWarning(ValidationCode.TYPO));
        assertEquals("gmail.com", result.getDetails().get(ValidationResult.DETAIL_TYPO));
    }

    @Test
    void syntaxErrorsSkipDns() throws DnsLookupException {
        final var result = validator.validateWithDns("john..doe@example.com", ValidationOptions.defaults()).join();

        assertTrue(result.hasError(ValidationCode.CONSECUTIVE_DOTS));
        verify(resolver, never()).resolveMx(anyString());
    }

    @Test
    @DisplayName("Google MX adds GOOGLE_WORKSPACE warning")
    void googleMxAddsWorkspaceWarning() throws DnsLookupException {
        when(resolver.resolveMx("acme.com")).thenReturn(List.of(new MxRecord(10, "aspmx.l.google.com")));
        when(resolver.resolveA("acme.com")).thenReturn(List.of("10.1.1.1"));

        final var result = validator.validateWithDns("jane@acme.com", ValidationOptions.defaults()).join();

        assertTrue(result.isValid());
        assertTrue(result.hasWarning(ValidationCode.GOOGLE_WORKSPACE));
        assertTrue(result.hasWarning(ValidationCode.POPULAR_PROVIDER));
        assertInstanceOf(DnsLookupResult.class, result.getDetails().get(ValidationResult.DETAIL_DNS));
    }

    @Test
    void microsoftMxAddsMicrosoftWarning() throws DnsLookupException {
        when(resolver.resolveMx("contoso.com"))
                .thenReturn(List.of(new MxRecord(0, "contoso-com.mail.protection.outlook.com.")));
        when(resolver.resolveA("contoso.com")).thenReturn(List.of());

        final var result = validator.validateWithDns("jane@contoso.com", ValidationOptions.defaults()).join();

        assertTrue(result.isValid());
        assertTrue(result.hasWarning(ValidationCode.MICROSOFT_365));
    }

    @Test
    void missingDnsIsAnError() throws DnsLookupException {
        when(resolver.resolveMx("gone.example")).thenReturn(List.of());
        when(resolver.resolveA("gone.example"))
                .thenThrow(new DnsLookupException(DnsErrorCode.DOMAIN_NOT_FOUND, "NXDOMAIN"));

        final var result = validator.validateWithDns("jane@gone.example", ValidationOptions.defaults()).join();

        assertFalse(result.isValid());
        assertTrue(result.hasError(ValidationCode.DNS));
    }

    @Test
    @DisplayName("Resolver timeout fails closed")
    void dnsTimeoutFailsClosed() throws DnsLookupException {
        when(resolver.resolveMx("slow.example"))
                .thenThrow(new DnsLookupException(DnsErrorCode.DNS_TIMEOUT, "timed out"));
        when(resolver.resolveA("slow.example")).thenReturn(List.of());
        final var options = ValidationOptions.builder().allowNoMx(true).build();

        final var result = validator.validateWithDns("jane@slow.example", options).join();

        assertFalse(result.isValid());
        assertTrue(result.hasError(ValidationCode.DNS));
        assertTrue(result.getFirstError().orElseThrow().message().contains("DNS_TIMEOUT"));
    }

    @Test
    void domainWithoutMxNeedsAllowNoMx() throws DnsLookupException {
        when(resolver.resolveMx("web-only.example")).thenReturn(List.of());
        when(resolver.resolveA("web-only.example")).thenReturn(List.of("10.2.2.2"));

        final var strict = validator.validateWithDns("jane@web-only.example", ValidationOptions.defaults()).join();
        final var relaxed = validator.validateWithDns("jane@web-only.example",
                ValidationOptions.builder().allowNoMx(true).build()).join();

        assertTrue(strict.hasError(ValidationCode.MX));
        assertFalse(strict.isValid());
        assertTrue(relaxed.isValid());
    }

    @Test
    @DisplayName("Unexpected failure inside the pipeline becomes a SYSTEM error")
    void unexpectedFailureBecomesSystemError() {
        final var analyzer = mock(SyntaxAnalyzer.class);
        when(analyzer.analyze(any())).thenThrow(new IllegalStateException("boom"));
        final var failing = new EmailValidator(analyzer, new TypoDetector(),
                TestFixtures.directCache(resolver, MutableClock.startingNow()));

        final var single = failing.validate("jane@example.com", ValidationOptions.defaults());
        final var withDns = failing.validateWithDns("jane@example.com", ValidationOptions.defaults()).join();

        assertEquals(List.of(ValidationCode.SYSTEM), single.getErrors().stream().map(i -> i.code()).toList());
        assertTrue(withDns.hasError(ValidationCode.SYSTEM));
        assertEquals("Validation system error", withDns.getFirstError().orElseThrow().message());
    }
}
