package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decomposes an address into local part and domain and checks lengths, character classes
 * and overall syntax. Rules accumulate issues rather than stopping at the first one; only a
 * missing {@code @} ends the analysis early. Performs no I/O.
 *
 * @author zahari.mikov
 */
@Component
public class SyntaxAnalyzer {

    static final int MAX_TOTAL_LENGTH = 254;
    static final int MAX_LOCAL_PART_LENGTH = 64;
    static final int MAX_DOMAIN_LENGTH = 255;
    static final int MAX_LABEL_LENGTH = 63;
    static final int MIN_TOTAL_LENGTH = 3;

    private static final Pattern RFC_5322_PATTERN = Pattern.compile(
            "^(?:[a-z0-9!#$%&'*+/=?^_`{|}~-]+(?:\\.[a-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
            + "|\"(?:[\\x01-\\x08\\x0b\\x0c\\x0e-\\x1f\\x21\\x23-\\x5b\\x5d-\\x7f]"
            + "|\\\\[\\x01-\\x09\\x0b\\x0c\\x0e-\\x7f])*\")"
            + "@"
            + "(?:(?:[a-z0-9](?:[a-z0-9-]*[a-z0-9])?\\.)+[a-z0-9](?:[a-z0-9-]*[a-z0-9])?"
            + "|\\[(?:(?:(2(5[0-5]|[0-4][0-9])|1[0-9][0-9]|[1-9]?[0-9]))\\.){3}"
            + "(?:(2(5[0-5]|[0-4][0-9])|1[0-9][0-9]|[1-9]?[0-9])"
            + "|[a-z0-9-]*[a-z0-9]:(?:[\\x01-\\x08\\x0b\\x0c\\x0e-\\x1f\\x21-\\x5a\\x53-\\x7f]"
            + "|\\\\[\\x01-\\x09\\x0b\\x0c\\x0e-\\x7f])+)\\])$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BRACKETED_LITERAL = Pattern.compile("^\\[.*]$");
    private static final Pattern DOTTED_IPV4 = Pattern.compile("^(?:[0-9]{1,3}\\.){3}[0-9]{1,3}$");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");

    private final DisposableDomainList disposableDomains;
    private final RoleAccountList roleAccounts;

    public SyntaxAnalyzer(final DisposableDomainList disposableDomains, final RoleAccountList roleAccounts) {
        this.disposableDomains = disposableDomains;
        this.roleAccounts = roleAccounts;
    }

    public SyntaxAnalysis analyze(final String email) {
        if (email == null || email.indexOf('@') < 0) {
            return SyntaxAnalysis.formatFailure(email);
        }

        final var parts = email.split("@", -1);
        final var localPart = parts[0];
        final var domain = parts[1];
        final var labels = List.of(domain.split("\\.", -1));

        final var localFacts = new LocalPartFacts(
                localPart.length(),
                localPart.length() >= 2 && localPart.startsWith("\"") && localPart.endsWith("\""),
                NON_ASCII.matcher(localPart).find(),
                roleAccounts.isRoleAccount(localPart),
                specialCharsOf(localPart));

        final var domainFacts = new DomainFacts(
                domain.length(),
                labels,
                labels.get(labels.size() - 1),
                isIpLiteral(domain),
                labels.stream().anyMatch(label -> label.startsWith("xn--")),
                NON_ASCII.matcher(domain).find(),
                disposableDomains.isDisposable(domain));

        final var errors = new ArrayList<ValidationIssue>();
        final var warnings = new ArrayList<ValidationIssue>();

        checkLengths(email, localPart, domain, errors);
        checkLocalPart(localPart, localFacts, errors, warnings);
        checkDomain(domainFacts, errors, warnings);
        if (!RFC_5322_PATTERN.matcher(email).matches()) {
            errors.add(new ValidationIssue(ValidationCode.SYNTAX, "Email does not comply with RFC 5322"));
        }

        return SyntaxAnalysis.builder()
                .email(email)
                .localPart(localPart)
                .domain(domain)
                .localPartFacts(localFacts)
                .domainFacts(domainFacts)
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .build();
    }

    private void checkLengths(final String email, final String localPart, final String domain,
                              final List<ValidationIssue> errors) {
        if (email.length() > MAX_TOTAL_LENGTH) {
            errors.add(new ValidationIssue(ValidationCode.LENGTH, "Email exceeds maximum length"));
        }
        if (localPart.length() > MAX_LOCAL_PART_LENGTH) {
            errors.add(new ValidationIssue(ValidationCode.LOCAL_LENGTH, "Local part exceeds maximum length"));
        }
        if (domain.length() > MAX_DOMAIN_LENGTH) {
            errors.add(new ValidationIssue(ValidationCode.DOMAIN_LENGTH, "Domain exceeds maximum length"));
        }
        if (email.length() < MIN_TOTAL_LENGTH) {
            errors.add(new ValidationIssue(ValidationCode.MIN_LENGTH, "Email is too short"));
        }
    }

    private void checkLocalPart(final String localPart, final LocalPartFacts facts,
                                final List<ValidationIssue> errors, final List<ValidationIssue> warnings) {
        if (facts.containsUnicode()) {
            warnings.add(new ValidationIssue(ValidationCode.UNICODE_LOCAL, "Local part contains Unicode characters"));
        }
        if (localPart.contains("..")) {
            errors.add(new ValidationIssue(ValidationCode.CONSECUTIVE_DOTS, "Consecutive dots not allowed"));
        }
        if (facts.quoted()) {
            warnings.add(new ValidationIssue(ValidationCode.QUOTED_LOCAL, "Quoted local part detected"));
        }
    }

    private void checkDomain(final DomainFacts facts, final List<ValidationIssue> errors,
                             final List<ValidationIssue> warnings) {
        if (facts.ip()) {
            warnings.add(new ValidationIssue(ValidationCode.IP_DOMAIN, "IP address used as domain"));
        }
        if (facts.containsUnicode() && !facts.punycode()) {
            warnings.add(new ValidationIssue(ValidationCode.UNICODE_DOMAIN, "Domain contains Unicode characters"));
        }
        if (facts.labelCount() < 2) {
            errors.add(new ValidationIssue(ValidationCode.DOMAIN_PARTS, "Invalid domain structure"));
        }
        for (final var label : facts.labels()) {
            if (label.length() > MAX_LABEL_LENGTH) {
                errors.add(new ValidationIssue(ValidationCode.LABEL_LENGTH, "Domain label exceeds maximum length"));
            }
        }
    }

    private static boolean isIpLiteral(final String domain) {
        return BRACKETED_LITERAL.matcher(domain).matches() || DOTTED_IPV4.matcher(domain).matches();
    }

    private static String specialCharsOf(final String localPart) {
        final var matcher = NON_ALPHANUMERIC.matcher(localPart);
        final var builder = new StringBuilder();
        while (matcher.find()) {
            builder.append(matcher.group());
        }
        return builder.toString();
    }
}
