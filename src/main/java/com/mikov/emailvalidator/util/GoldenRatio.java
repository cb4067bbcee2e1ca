package com.mikov.emailvalidator.util;

/**
 * Golden ratio constants shared by the cache TTL, eviction sectioning and batch sizing.
 *
 * @author zahari.mikov
 */
public final class GoldenRatio {

    public static final double PHI = 1.618033988749895;
    public static final double INVERSE = 1 / PHI;

    private GoldenRatio() {
    }
}
