package com.mikov.emailvalidator.dns;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStatistics(int size, int capacity, long hits, long misses, long evictions) {

    @JsonProperty("hitRate")
    public double hitRate() {
        final var lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups * 100;
    }
}
