package com.astrostack.service;

import ij.process.FloatProcessor;
import java.util.Arrays;
import java.util.List;

public class StackCombiner {

    public static final double DEFAULT_CLIP_SIGMA = 3.0;

    private final double clipSigma;

    public StackCombiner() {
        this(DEFAULT_CLIP_SIGMA);
    }

    public StackCombiner(double clipSigma) {
        this.clipSigma = clipSigma;
    }

    public FloatProcessor combine(List<FloatProcessor> frames) {
        if (frames == null || frames.isEmpty()) throw new IllegalArgumentException("No frames to combine");
        int w = frames.get(0).getWidth(), h = frames.get(0).getHeight();
        for (int i = 1; i < frames.size(); i++) {
            FloatProcessor f = frames.get(i);
            if (f.getWidth() != w || f.getHeight() != h) {
                throw new IllegalArgumentException(String.format("Frame %d is %dx%d, expected %dx%d", i, f.getWidth(), f.getHeight(), w, h));
            }
        }

        int n = frames.size();
        float[][] stack = new float[n][];
        for (int k = 0; k < n; k++) stack[k] = (float[]) frames.get(k).getPixels();

        float[] out = new float[w * h];
        double[] values = new double[n];
        double[] kept = new double[n];
        for (int p = 0; p < out.length; p++) {
            for (int k = 0; k < n; k++) values[k] = stack[k][p];
            out[p] = (float) clippedMedian(values, kept);
        }
        return new FloatProcessor(w, h, out);
    }

    // single clipping pass
    private double clippedMedian(double[] values, double[] kept) {
        double median = SigmaClipper.median(values);
        double limit = clipSigma * SigmaClipper.stdDev(values, SigmaClipper.mean(values));
        int m = 0;
        for (double v : values) {
            if (Math.abs(v - median) <= limit) kept[m++] = v;
        }
        if (m == 0) return median;
        return SigmaClipper.median(Arrays.copyOf(kept, m));
    }
}
