package com.mikov.emailvalidator.batch;

import com.mikov.emailvalidator.util.GoldenRatio;

/**
 * Batch size tiers, each a round number scaled by the inverse golden ratio.
 */
public final class BatchSizing {

    public static final int TINY = tier(5);
    public static final int SMALL = tier(10);
    public static final int MEDIUM = tier(25);
    public static final int LARGE = tier(50);
    public static final int HUGE = tier(100);

    private BatchSizing() {
    }

    /**
     * Picks the smallest tier that fits the pending count, capped at {@link #HUGE}.
     */
    public static int optimalBatchSize(final int pending) {
        if (pending <= TINY) {
            return TINY;
        } else if (pending <= SMALL) {
            return SMALL;
        } else if (pending <= MEDIUM) {
            return MEDIUM;
        } else if (pending <= LARGE) {
            return LARGE;
        }
        return HUGE;
    }

    private static int tier(final int base) {
        return (int) Math.round(base * GoldenRatio.INVERSE);
    }
}
