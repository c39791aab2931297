package com.example.hazardrisk.application.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Shared arithmetic for scores and reports. Rounding is half-even on the exact
 * binary value, so {@code 24.5} rounds to {@code 24} and {@code 0.15} to {@code 0.1}.
 */
final class Scores {

    private Scores() {
    }

    static double round1(double v) {
        return round(v, 1);
    }

    static double round3(double v) {
        return round(v, 3);
    }

    static double round(double v, int scale) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return v;
        }
        return new BigDecimal(v).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Fixed-point text with {@code scale} decimals, rounded like {@link #round(double, int)}.
     */
    static String fixed(double v, int scale) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return String.valueOf(v);
        }
        return new BigDecimal(v).setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    }

    static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) {
            return min;
        }
        return Math.max(min, Math.min(max, v));
    }

    static double ratio(double numerator, double denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return clamp(numerator / denominator, 0.0, 1.0);
    }
}
