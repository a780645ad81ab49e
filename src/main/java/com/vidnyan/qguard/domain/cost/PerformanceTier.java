package com.vidnyan.qguard.domain.cost;

import java.util.Locale;

/**
 * Coarse cost bucket. Only selects recommendation text, never affects validity.
 */
public enum PerformanceTier {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Low up to a third of the maximum, high above two thirds.
     */
    public static PerformanceTier of(int score, int maxScore) {
        if (score > maxScore * 2 / 3) {
            return HIGH;
        }
        if (score > maxScore / 3) {
            return MEDIUM;
        }
        return LOW;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
