package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.dns.DnsLookupResult;
import com.mikov.emailvalidator.dns.DnsResultCache;
import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationOptions;
import com.mikov.emailvalidator.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Validates a single email address.
 * <p>
 * The static pipeline is: cheap format pre-check, normalization, syntax analysis, then the
 * optional disposable, role-based and typo checks, which only ever add warnings.
 * {@link #validateWithDns} additionally resolves the domain through the shared
 * {@link DnsResultCache} once the static checks passed.
 * <p>
 * Unverifiable DNS fails closed: any lookup that did not produce records, whether the
 * domain is missing or the resolver errored, marks the address invalid.
 *
 * @author zahari.mikov
 */
@Service
public class EmailValidator {
    private static final Logger logger = LoggerFactory.getLogger(EmailValidator.class);

    private static final Pattern QUICK_FORMAT = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final SyntaxAnalyzer syntaxAnalyzer;
    private final TypoDetector typoDetector;
    private final DnsResultCache dnsCache;

    public EmailValidator(final SyntaxAnalyzer syntaxAnalyzer, final TypoDetector typoDetector,
                          final DnsResultCache dnsCache) {
        this.syntaxAnalyzer = syntaxAnalyzer;
        this.typoDetector = typoDetector;
        this.dnsCache = dnsCache;
    }

    public ValidationResult validate(final String email, final ValidationOptions options) {
        try {
            final var builder = new ValidationResult.Builder(email);
            runStaticChecks(email, options != null ? options : ValidationOptions.defaults(), builder);
            return builder.build();
        } catch (final RuntimeException e) {
            logger.error("Validation system error for {}", email, e);
            return ValidationResult.systemError(email);
        }
    }

    /**
     * Runs {@link #validate} and, when that passed, checks the domain's DNS. The future
     * never completes exceptionally.
     */
    public CompletableFuture<ValidationResult> validateWithDns(final String email, final ValidationOptions options) {
        final var effectiveOptions = options != null ? options : ValidationOptions.defaults();
        final ValidationResult.Builder builder;
        final String domain;
        try {
            builder = new ValidationResult.Builder(email);
            final var analysis = runStaticChecks(email, effectiveOptions, builder);
            if (builder.hasErrors()) {
                return CompletableFuture.completedFuture(builder.build());
            }
            domain = analysis.getDomain();
        } catch (final RuntimeException e) {
            logger.error("Validation system error for {}", email, e);
            return CompletableFuture.completedFuture(ValidationResult.systemError(email));
        }

        return dnsCache.resolve(domain)
                .thenApply(dns -> applyDnsResult(builder, dns, effectiveOptions))
                .exceptionally(ex -> {
                    logger.error("DNS stage failed for {}", email, ex);
                    return ValidationResult.systemError(email);
                });
    }

    public boolean quickFormatCheck(final String email) {
        return email != null && QUICK_FORMAT.matcher(email).matches();
    }

    public String normalize(final String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the syntax analysis, or {@code null} when the format pre-check rejected the input
     */
    private SyntaxAnalysis runStaticChecks(final String email, final ValidationOptions options,
                                           final ValidationResult.Builder builder) {
        if (email == null || !quickFormatCheck(email.trim())) {
            builder.addError(ValidationCode.FORMAT, "Invalid email format");
            return null;
        }

        final var normalizedEmail = normalize(email);
        builder.withNormalizedEmail(normalizedEmail);

        final var analysis = syntaxAnalyzer.analyze(normalizedEmail);
        if (analysis.getLocalPartFacts() != null) {
            builder.withDetail(ValidationResult.DETAIL_LOCAL_PART, analysis.getLocalPartFacts());
        }
        if (analysis.getDomainFacts() != null) {
            builder.withDetail(ValidationResult.DETAIL_DOMAIN, analysis.getDomainFacts());
        }
        builder.addErrors(analysis.getErrors());
        builder.addWarnings(analysis.getWarnings());

        if (options.isCheckDisposable() && analysis.isDisposable()) {
            builder.addWarning(ValidationCode.DISPOSABLE, "Disposable email address detected");
        }
        if (options.isCheckRoleBased() && analysis.isRoleBased()) {
            builder.addWarning(ValidationCode.ROLE_BASED, "Role-based email address detected");
        }
        if (options.isCheckTypos() && analysis.getDomain() != null) {
            typoDetector.suggest(analysis.getDomain()).ifPresent(suggestion -> {
                builder.addWarning(ValidationCode.TYPO, "Did you mean '@" + suggestion + "'?");
                builder.withDetail(ValidationResult.DETAIL_TYPO, suggestion);
            });
        }
        return analysis;
    }

    private ValidationResult applyDnsResult(final ValidationResult.Builder builder, final DnsLookupResult dns,
                                            final ValidationOptions options) {
        builder.withDetail(ValidationResult.DETAIL_DNS, dns);

        if (!dns.isHasDns()) {
            final var message = dns.isError()
                    ? "Domain has no valid DNS records (" + dns.getErrorCode() + ")"
                    : "Domain has no valid DNS records";
            builder.addError(ValidationCode.DNS, message);
        } else if (!dns.isHasMx() && !options.isAllowNoMx()) {
            builder.addError(ValidationCode.MX, "Domain has no MX records");
        }

        final var primaryMx = dns.primaryMx();
        if (primaryMx != null) {
            if (primaryMx.popular()) {
                builder.addWarning(ValidationCode.POPULAR_PROVIDER, "Email uses popular provider");
            }
            if (primaryMx.googleWorkspace()) {
                builder.addWarning(ValidationCode.GOOGLE_WORKSPACE, "Email uses Google Workspace");
            }
            if (primaryMx.microsoft365()) {
                builder.addWarning(ValidationCode.MICROSOFT_365, "Email uses Microsoft 365");
            }
        }
        return builder.build();
    }
}
