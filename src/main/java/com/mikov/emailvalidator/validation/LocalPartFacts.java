package com.mikov.emailvalidator.validation;

/**
 * Structural facts about the part of an address before the {@code @}.
 */
public record LocalPartFacts(int length,
                             boolean quoted,
                             boolean containsUnicode,
                             boolean roleBased,
                             String specialChars) {
}
