package com.mikov.emailvalidator.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only set of lower-cased entries loaded from a classpath resource, one entry per
 * line with {@code #} comments. Falls back to a built-in set when the resource is missing
 * or unreadable. {@link #reload()} swaps the whole set, so readers never see a partial list.
 *
 * @author zahari.mikov
 */
public abstract class ResourceBackedList {
    private static final Logger logger = LoggerFactory.getLogger(ResourceBackedList.class);

    private final String resource;
    private volatile Set<String> entries = Set.of();

    protected ResourceBackedList(final String resource) {
        this.resource = resource;
    }

    /**
     * Entries used when the resource cannot be loaded.
     */
    protected abstract Set<String> fallbackEntries();

    public void reload() {
        final var is = getClass().getResourceAsStream(resource);
        if (is == null) {
            logger.warn("List resource {} not found, using {} built-in entries", resource, fallbackEntries().size());
            entries = normalize(fallbackEntries());
            return;
        }
        try (final var reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            entries = reader.lines()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty() && !s.startsWith("#"))
                    .map(s -> s.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
            logger.info("Loaded {} entries from {}", entries.size(), resource);
        } catch (final IOException e) {
            logger.error("Error loading list resource {}, using built-in entries", resource, e);
            entries = normalize(fallbackEntries());
        }
    }

    public boolean contains(final String value) {
        return value != null && entries.contains(value.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return entries.size();
    }

    protected Set<String> entries() {
        return entries;
    }

    private static Set<String> normalize(final Set<String> values) {
        return values.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
