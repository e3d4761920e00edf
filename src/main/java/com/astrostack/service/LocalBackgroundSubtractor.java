package com.astrostack.service;

import com.astrostack.model.ClippedStats;
import com.astrostack.model.PipelineSettings;
import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.Arrays;

/**
 * Removes the local sky around each star.
 * <p>
 * The sky of a star is the sigma-clipped median of the input pixels whose centres lie
 * in the annulus {@code inner <= r < outer} around it. Every pixel strictly inside the
 * square window of side {@code windowFwhmFactor * fwhm} centred on the rounded star
 * position becomes its input value minus that sky. Where windows overlap the last star
 * in table order decides the value; subtractions do not accumulate.
 */
public class LocalBackgroundSubtractor {

    private static final Logger logger = LoggerFactory.getLogger(LocalBackgroundSubtractor.class);

    private final double innerRadius;
    private final double outerRadius;
    private final double windowFwhmFactor;
    private final SigmaClipper clipper;

    public LocalBackgroundSubtractor() {
        this(new PipelineSettings());
    }

    public LocalBackgroundSubtractor(PipelineSettings s) {
        this(s.annulusInnerRadius, s.annulusOuterRadius, s.windowFwhmFactor, s.annulusClipSigma);
    }

    public LocalBackgroundSubtractor(double innerRadius, double outerRadius, double windowFwhmFactor, double clipSigma) {
        if (outerRadius <= innerRadius) throw new IllegalArgumentException("Annulus outer radius must exceed inner radius");
        this.innerRadius = innerRadius;
        this.outerRadius = outerRadius;
        this.windowFwhmFactor = windowFwhmFactor;
        this.clipper = new SigmaClipper(clipSigma);
    }

    public FloatProcessor subtract(FloatProcessor image, StarTable stars, double fwhm) {
        if (!(fwhm > 0)) throw new IllegalArgumentException("FWHM must be positive: " + fwhm);
        FloatProcessor out = (FloatProcessor) image.duplicate();
        double half = windowFwhmFactor * fwhm / 2;
        int w = image.getWidth(), h = image.getHeight();

        for (StarRecord s : stars) {
            double sky = annulusSky(image, s.x(), s.y());
            if (Double.isNaN(sky)) {
                logger.debug("Star {} has no annulus pixels inside the image, left as is", s.id());
                continue;
            }
            int px = (int) Math.rint(s.x());
            int py = (int) Math.rint(s.y());
            // strictly inside (p - half, p + half) on both axes
            int r0 = Math.max(0, (int) Math.floor(py - half) + 1), r1 = Math.min(h - 1, (int) Math.ceil(py + half) - 1);
            int c0 = Math.max(0, (int) Math.floor(px - half) + 1), c1 = Math.min(w - 1, (int) Math.ceil(px + half) - 1);
            for (int r = r0; r <= r1; r++)
                for (int c = c0; c <= c1; c++)
                    out.setf(c, r, (float) (image.getf(c, r) - sky));
        }
        return out;
    }

    /** Clipped median of the annulus, or NaN when it falls entirely outside the image. */
    double annulusSky(FloatProcessor image, double xc, double yc) {
        int x0 = Math.max(0, (int) Math.floor(xc - outerRadius));
        int x1 = Math.min(image.getWidth() - 1, (int) Math.ceil(xc + outerRadius));
        int y0 = Math.max(0, (int) Math.floor(yc - outerRadius));
        int y1 = Math.min(image.getHeight() - 1, (int) Math.ceil(yc + outerRadius));
        double in2 = innerRadius * innerRadius, out2 = outerRadius * outerRadius;

        double[] values = new double[Math.max(0, (x1 - x0 + 1) * (y1 - y0 + 1))];
        int n = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double d2 = (x - xc) * (x - xc) + (y - yc) * (y - yc);
                if (d2 >= in2 && d2 < out2) values[n++] = image.getf(x, y);
            }
        }
        if (n == 0) return Double.NaN;
        ClippedStats stats = clipper.stats(Arrays.copyOf(values, n));
        return stats.median();
    }
}
