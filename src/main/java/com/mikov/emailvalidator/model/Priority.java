package com.mikov.emailvalidator.model;

import com.mikov.emailvalidator.exception.InvalidPriorityException;
import com.mikov.emailvalidator.util.GoldenRatio;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scheduling priority of a validation request. Higher weight drains first.
 *
 * @author zahari.mikov
 */
@Getter
@RequiredArgsConstructor
public enum Priority {
    CRITICAL(GoldenRatio.PHI * 100),
    HIGH(GoldenRatio.PHI * 50),
    NORMAL(GoldenRatio.PHI * 10),
    LOW(GoldenRatio.PHI);

    private static final List<Priority> BY_WEIGHT_DESC = Arrays.stream(values())
            .sorted(Comparator.comparingDouble(Priority::getWeight).reversed())
            .toList();

    private final double weight;

    public static List<Priority> byWeightDescending() {
        return BY_WEIGHT_DESC;
    }

    /**
     * Parses a priority name, case-insensitively.
     *
     * @param name priority name, e.g. "high"
     * @return the matching priority
     * @throws InvalidPriorityException if the name is blank or unknown
     */
    public static Priority fromName(final String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidPriorityException(String.valueOf(name));
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new InvalidPriorityException(name);
        }
    }
}
