package com.mikov.emailvalidator.validation;

import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Local-part prefixes that address a role or team (info@, support@) rather than a person.
 * A local part is role-based when it equals a prefix or starts with the prefix followed
 * by {@code .}, {@code -} or {@code _}.
 *
 * @author zahari.mikov
 */
@Component
public class RoleAccountList extends ResourceBackedList {

    private static final String ROLE_PREFIXES_FILE = "/role_prefixes.txt";

    private static final Set<String> BUILT_IN = Set.of(
            "admin", "administrator", "webmaster", "hostmaster", "postmaster",
            "info", "contact", "support", "help", "helpdesk", "sales", "marketing",
            "abuse", "noreply", "no-reply", "donotreply", "security", "billing",
            "office", "team", "hr", "jobs", "careers", "press"
    );

    public RoleAccountList() {
        super(ROLE_PREFIXES_FILE);
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    protected Set<String> fallbackEntries() {
        return BUILT_IN;
    }

    public boolean isRoleAccount(final String localPart) {
        if (localPart == null || localPart.isBlank()) {
            return false;
        }
        final var normalized = localPart.toLowerCase(Locale.ROOT);
        if (contains(normalized)) {
            return true;
        }
        for (final var prefix : entries()) {
            if (normalized.startsWith(prefix + ".")
                    || normalized.startsWith(prefix + "-")
                    || normalized.startsWith(prefix + "_")) {
                return true;
            }
        }
        return false;
    }
}
