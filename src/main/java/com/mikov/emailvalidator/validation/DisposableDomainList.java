package com.mikov.emailvalidator.validation;

import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Known disposable or temporary mailbox domains, including their sub-domains.
 *
 * @author zahari.mikov
 */
@Component
public class DisposableDomainList extends ResourceBackedList {

    private static final String DISPOSABLE_DOMAINS_FILE = "/disposable_domains.txt";

    private static final Set<String> BUILT_IN = Set.of(
            "mailinator.com", "tempmail.com", "temp-mail.org", "fakeinbox.com",
            "guerrillamail.com", "sharklasers.com", "yopmail.com", "10minutemail.com",
            "trashmail.com", "mailnesia.com", "maildrop.cc", "getairmail.com",
            "getnada.com", "temp-mail.ru", "dispostable.com", "emailondeck.com",
            "throwawaymail.com", "spambog.com", "tempr.email", "tempmail.de"
    );

    public DisposableDomainList() {
        super(DISPOSABLE_DOMAINS_FILE);
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    protected Set<String> fallbackEntries() {
        return BUILT_IN;
    }

    public boolean isDisposable(final String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        var candidate = domain.toLowerCase(Locale.ROOT);
        while (true) {
            if (contains(candidate)) {
                return true;
            }
            final var dot = candidate.indexOf('.');
            if (dot < 0) {
                return false;
            }
            candidate = candidate.substring(dot + 1);
        }
    }
}
