package com.mikov.emailvalidator.validation;

import java.util.List;

/**
 * Structural facts about the part of an address after the {@code @}.
 */
public record DomainFacts(int length,
                          List<String> labels,
                          String tld,
                          boolean ip,
                          boolean punycode,
                          boolean containsUnicode,
                          boolean disposable) {

    public int labelCount() {
        return labels.size();
    }
}
