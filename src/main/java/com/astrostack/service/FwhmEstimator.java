package com.astrostack.service;

import com.astrostack.model.ClippedStats;
import com.astrostack.model.FwhmEstimate;
import com.astrostack.model.PipelineSettings;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the seeing of a frame by fitting a 2D Gaussian to its brightest
 * unsaturated star.
 * <p>
 * Candidates are taken brightest first from the interior of the frame. A saturated
 * peak, or a fit that fails or comes out narrower than the plausibility minimum,
 * has its cutout zeroed in a private working copy and the search moves on to the
 * next peak. The first peak is always tried. Saturated peaks do not count against
 * the attempt budget. The search gives up with {@link FwhmEstimate#NONE} when the
 * budget is spent or, after a masking, the brightest remaining peak is below the noise floor.
 */
public class FwhmEstimator {

    private static final Logger logger = LoggerFactory.getLogger(FwhmEstimator.class);

    private static final double INITIAL_SIGMA = 3.0;
    private static final double INITIAL_AMPLITUDE = 10000.0;

    private final int cutoutHalfSize;
    private final int borderMargin;
    private final double saturation;
    private final double minimumFwhm;
    private final int maxAttempts;
    private final double noiseFloor;
    private final SigmaClipper clipper;

    public FwhmEstimator() {
        this(new PipelineSettings());
    }

    public FwhmEstimator(PipelineSettings s) {
        this(s.fwhmCutoutHalfSize, s.fwhmBorderMargin, s.fwhmSaturation, s.fwhmMinimum, s.fwhmMaxAttempts,
                s.fwhmNoiseFloor, s.backgroundClipSigma);
    }

    public FwhmEstimator(int cutoutHalfSize, int borderMargin, double saturation, double minimumFwhm,
                         int maxAttempts, double noiseFloor, double clipSigma) {
        if (cutoutHalfSize < 1) throw new IllegalArgumentException("Cutout half-size must be at least 1: " + cutoutHalfSize);
        this.cutoutHalfSize = cutoutHalfSize;
        this.borderMargin = borderMargin;
        this.saturation = saturation;
        this.minimumFwhm = minimumFwhm;
        this.maxAttempts = maxAttempts;
        this.noiseFloor = noiseFloor;
        this.clipper = new SigmaClipper(clipSigma);
    }

    public FwhmEstimate estimate(FloatProcessor image) {
        int w = image.getWidth(), h = image.getHeight();
        if (w <= 2 * borderMargin || h <= 2 * borderMargin) {
            logger.warn("Frame {}x{} has no interior beyond the {} px margin", w, h, borderMargin);
            return FwhmEstimate.NONE;
        }
        ClippedStats bg = clipper.stats(image);
        FloatProcessor work = (FloatProcessor) image.duplicate();
        float[] px = (float[]) work.getPixels();

        int attempts = 0;
        int peakIndex = brightestInterior(px, w, h);
        while (true) {
            double peak = px[peakIndex];
            int r = peakIndex / w, c = peakIndex % w;

            if (peak >= saturation) {
                logger.debug("Saturated peak {} at ({}, {}), masking", peak, c, r);
            } else {
                if (attempts >= maxAttempts) {
                    logger.warn("No usable star after {} fit attempts", attempts);
                    return FwhmEstimate.NONE;
                }
                attempts++;

                FwhmEstimate est = FwhmEstimate.fromSigma(fitSigma(work, c, r, bg.median()));
                if (est.fwhm() > minimumFwhm) {
                    logger.info("FWHM {} px (sigma {}) from star at ({}, {}) after {} attempt(s)",
                            est.fwhm(), est.sigma(), c, r, attempts);
                    return est;
                }
                logger.debug("Rejected peak {} at ({}, {}): fwhm {}", peak, c, r, est.fwhm());
            }
            mask(work, c, r);

            peakIndex = brightestInterior(px, w, h);
            if (px[peakIndex] < noiseFloor) {
                logger.warn("No usable star: brightest remaining peak {} is below the noise floor {}", px[peakIndex], noiseFloor);
                return FwhmEstimate.NONE;
            }
        }
    }

    /** Mean of the fitted sigmas, or 0 when the fit failed. */
    private double fitSigma(FloatProcessor work, int c, int r, double background) {
        int x0 = Math.max(0, c - cutoutHalfSize), y0 = Math.max(0, r - cutoutHalfSize);
        int x1 = Math.min(work.getWidth(), c + cutoutHalfSize), y1 = Math.min(work.getHeight(), r + cutoutHalfSize);
        FloatProcessor star = cutout(work, x0, y0, x1 - x0, y1 - y0);

        GaussianSurfaceFit fit = new GaussianSurfaceFit(star);
        if (!fit.fit(c - x0, r - y0, INITIAL_SIGMA, INITIAL_AMPLITUDE, background)) {
            logger.debug("Gaussian fit did not converge at ({}, {})", c, r);
            return 0;
        }
        return (fit.sigmaX + fit.sigmaY) / 2.0;
    }

    /** First brightest pixel in row-major order inside the border margin. */
    private int brightestInterior(float[] px, int w, int h) {
        int best = borderMargin * w + borderMargin;
        for (int y = borderMargin; y < h - borderMargin; y++) {
            for (int x = borderMargin; x < w - borderMargin; x++) {
                int i = y * w + x;
                if (px[i] > px[best]) best = i;
            }
        }
        return best;
    }

    private void mask(FloatProcessor work, int c, int r) {
        int x0 = Math.max(0, c - cutoutHalfSize), y0 = Math.max(0, r - cutoutHalfSize);
        int x1 = Math.min(work.getWidth(), c + cutoutHalfSize), y1 = Math.min(work.getHeight(), r + cutoutHalfSize);
        for (int y = y0; y < y1; y++)
            for (int x = x0; x < x1; x++)
                work.setf(x, y, 0f);
    }

    private static FloatProcessor cutout(FloatProcessor ip, int x0, int y0, int cw, int ch) {
        FloatProcessor out = new FloatProcessor(cw, ch);
        for (int y = 0; y < ch; y++)
            for (int x = 0; x < cw; x++)
                out.setf(x, y, ip.getf(x0 + x, y0 + y));
        return out;
    }
}
