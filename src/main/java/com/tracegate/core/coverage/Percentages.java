package com.tracegate.core.coverage;

/**
 * One-decimal percentages that never round a partial ratio to 0 or 100.
 */
public final class Percentages {

    private Percentages() {}

    /**
     * Computes {@code part / whole * 100} rounded to one decimal, with one deviation from the
     * plain formula: a ratio strictly between 0 and 1 is clamped to [0.1, 99.9]. So 1 of 10000
     * reads 0.1 rather than 0.0, and 9999 of 10000 reads 99.9 rather than 100.0. Only an
     * empty or a complete ratio yields 0 or 100.
     *
     * @return 0 when {@code whole} or {@code part} is 0, 100 when {@code part >= whole},
     *         otherwise the clamped rounded percentage
     */
    public static double of(long part, long whole) {
        if (whole <= 0 || part <= 0) {
            return 0.0;
        }
        if (part >= whole) {
            return 100.0;
        }
        double rounded = Math.round(part * 1000.0 / whole) / 10.0;
        return Math.min(99.9, Math.max(0.1, rounded));
    }
}
