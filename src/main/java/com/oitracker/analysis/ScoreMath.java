package com.oitracker.analysis;

/**
 * Numeric guards shared by the scorers. Every ratio in the engine goes through
 * {@link #safeDivide} so degenerate chains produce neutral values instead of NaN.
 */
public final class ScoreMath {

    private ScoreMath() {}

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double clampScore(double value) {
        return clamp(value, -100.0, 100.0);
    }

    /** numerator / denominator, or {@code fallback} when the denominator is zero or not finite. */
    public static double safeDivide(double numerator, double denominator, double fallback) {
        if (denominator == 0.0 || !Double.isFinite(denominator) || !Double.isFinite(numerator)) {
            return fallback;
        }
        return numerator / denominator;
    }

    /** Percent change from {@code from} to {@code to}; zero when {@code from} is not positive. */
    public static double pctChange(double from, double to) {
        if (from <= 0.0) {
            return 0.0;
        }
        return (to - from) / from * 100.0;
    }

    public static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
