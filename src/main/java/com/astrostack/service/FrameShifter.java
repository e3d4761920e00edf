package com.astrostack.service;

import com.astrostack.model.ShiftRecord;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.Arrays;

public class FrameShifter {

    private static final Logger logger = LoggerFactory.getLogger(FrameShifter.class);

    public static final double DEFAULT_THRESHOLD = 0.5;

    private final double threshold;

    public FrameShifter() {
        this(DEFAULT_THRESHOLD);
    }

    public FrameShifter(double threshold) {
        this.threshold = threshold;
    }

    public FloatProcessor shift(FloatProcessor image, ShiftRecord[] diff) {
        double[] distances = Arrays.stream(diff).filter(ShiftRecord::isMatched).mapToDouble(ShiftRecord::distance).toArray();
        if (distances.length == 0) {
            logger.debug("No matched stars, frame left in place");
            return image;
        }
        double offset = SigmaClipper.median(distances);
        if (offset < threshold) return image;

        double xshift = SigmaClipper.median(Arrays.stream(diff).filter(ShiftRecord::isMatched).mapToDouble(ShiftRecord::dx).toArray());
        double yshift = SigmaClipper.median(Arrays.stream(diff).filter(ShiftRecord::isMatched).mapToDouble(ShiftRecord::dy).toArray());
        // half-to-even
        int dx = (int) Math.rint(xshift);
        int dy = (int) Math.rint(yshift);
        logger.debug("Median offset {} px from {} matches, rolling by dx={} dy={}", offset, distances.length, dx, dy);
        return roll(image, dx, dy);
    }

    /** Circular translation: the pixel at (x, y) moves to ((x + dx) mod w, (y + dy) mod h). */
    public static FloatProcessor roll(FloatProcessor image, int dx, int dy) {
        int w = image.getWidth(), h = image.getHeight();
        float[] in = (float[]) image.getPixels();
        float[] out = new float[in.length];
        int sx = Math.floorMod(dx, w), sy = Math.floorMod(dy, h);
        for (int y = 0; y < h; y++) {
            int ty = (y + sy) % h;
            for (int x = 0; x < w; x++) {
                out[ty * w + (x + sx) % w] = in[y * w + x];
            }
        }
        return new FloatProcessor(w, h, out);
    }
}
