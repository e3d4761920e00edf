package com.astrostack.service;

import com.astrostack.model.ClippedStats;
import ij.process.FloatProcessor;
import java.util.Arrays;

/**
 * Iterative sigma clipping around the median, population standard deviation.
 */
public class SigmaClipper {

    public static final double DEFAULT_SIGMA = 3.0;
    public static final int DEFAULT_MAX_ITERS = 5;

    private final double sigma;
    private final int maxIters;

    public SigmaClipper() {
        this(DEFAULT_SIGMA, DEFAULT_MAX_ITERS);
    }

    public SigmaClipper(double sigma) {
        this(sigma, DEFAULT_MAX_ITERS);
    }

    public SigmaClipper(double sigma, int maxIters) {
        if (sigma <= 0) throw new IllegalArgumentException("Clip sigma must be positive: " + sigma);
        this.sigma = sigma;
        this.maxIters = maxIters;
    }

    public ClippedStats stats(FloatProcessor ip) {
        return stats((float[]) ip.getPixels());
    }

    public ClippedStats stats(float[] values) {
        double[] d = new double[values.length];
        for (int i = 0; i < values.length; i++) d[i] = values[i];
        return stats(d);
    }

    public ClippedStats stats(double[] values) {
        double[] kept = finite(values);
        for (int iter = 0; iter < maxIters && kept.length > 0; iter++) {
            double median = median(kept);
            double std = stdDev(kept, mean(kept));
            double limit = sigma * std;
            int n = 0;
            double[] next = new double[kept.length];
            for (double v : kept) {
                if (Math.abs(v - median) <= limit) next[n++] = v;
            }
            if (n == kept.length) break;
            kept = Arrays.copyOf(next, n);
        }
        if (kept.length == 0) return new ClippedStats(Double.NaN, Double.NaN, Double.NaN, 0);
        double mean = mean(kept);
        return new ClippedStats(mean, median(kept), stdDev(kept, mean), kept.length);
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        double[] s = values.clone();
        Arrays.sort(s);
        int mid = s.length / 2;
        if (s.length % 2 == 0) return (s[mid - 1] + s[mid]) / 2.0;
        return s[mid];
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    static double stdDev(double[] values, double mean) {
        double sum = 0;
        for (double v : values) sum += (v - mean) * (v - mean);
        return Math.sqrt(sum / values.length);
    }

    private static double[] finite(double[] values) {
        double[] out = new double[values.length];
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v) && !Double.isInfinite(v)) out[n++] = v;
        }
        return n == values.length ? out : Arrays.copyOf(out, n);
    }
}
