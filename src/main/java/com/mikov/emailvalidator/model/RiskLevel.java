package com.mikov.emailvalidator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
