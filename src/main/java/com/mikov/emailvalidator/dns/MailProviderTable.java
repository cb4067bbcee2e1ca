package com.mikov.emailvalidator.dns;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static table recognising well-known mailbox providers from MX host names.
 *
 * @author zahari.mikov
 */
public final class MailProviderTable {

    // Consumer Gmail (gmail-smtp-in.l.google.com) is popular but not Workspace.
    private static final List<Pattern> GOOGLE_MX_PATTERNS = Arrays.asList(
        Pattern.compile("^aspmx\\.l\\.google\\.com$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^alt[0-9]?\\.aspmx\\.l\\.google\\.com$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^aspmx[0-9]\\.googlemail\\.com$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^alt[0-9]\\.aspmx\\.l\\.googlemail\\.com$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(.+\\.)?googlemail\\.com$", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> MICROSOFT_365_SUFFIXES = List.of(
        "protection.outlook.com"
    );

    private static final List<String> POPULAR_PROVIDER_SUFFIXES = List.of(
        "google.com",
        "googlemail.com",
        "outlook.com",
        "yahoo.com",
        "yahoodns.net",
        "protonmail.com",
        "protonmail.ch",
        "zoho.com",
        "zoho.eu",
        "icloud.com"
    );

    private MailProviderTable() {
    }

    public static boolean isGoogleWorkspace(final String exchange) {
        final var host = normalizeHost(exchange);
        return GOOGLE_MX_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(host).matches());
    }

    public static boolean isMicrosoft365(final String exchange) {
        return matchesSuffix(normalizeHost(exchange), MICROSOFT_365_SUFFIXES);
    }

    public static boolean isPopularProvider(final String exchange) {
        return matchesSuffix(normalizeHost(exchange), POPULAR_PROVIDER_SUFFIXES);
    }

    /**
     * Lower-cases each exchange, drops the trailing root dot, annotates provider flags and
     * sorts by MX priority ascending.
     */
    public static List<MailExchange> normalize(final List<MxRecord> records) {
        return records.stream()
                .sorted(Comparator.comparingInt(MxRecord::priority))
                .map(record -> {
                    final var host = normalizeHost(record.exchange());
                    return new MailExchange(record.priority(), host,
                            isGoogleWorkspace(host), isMicrosoft365(host), isPopularProvider(host));
                })
                .toList();
    }

    static String normalizeHost(final String exchange) {
        if (exchange == null) {
            return "";
        }
        final var host = exchange.trim().toLowerCase(Locale.ROOT);
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }

    private static boolean matchesSuffix(final String host, final List<String> suffixes) {
        return suffixes.stream().anyMatch(suffix -> host.equals(suffix) || host.endsWith("." + suffix));
    }
}
