package com.example.skygate_backend.util;

public final class SignalMath {
    private static final double EPSILON = 1e-9;

    private SignalMath() {
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double stdDev(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double acc = 0;
        for (double v : values) acc += (v - mean) * (v - mean);
        return Math.sqrt(acc / values.length);
    }

    /** Standard deviation over mean; 0 when the mean is (close to) zero. */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (Math.abs(mean) < EPSILON) return 0.0;
        return stdDev(values) / mean;
    }

    public static double max(double[] values) {
        double max = 0.0;
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
