package com.astrostack.service;

import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link StarDetector} built on ImageJ's particle analysis: every connected blob
 * above the threshold is one candidate, measured by its intensity-weighted centre.
 */
public class ParticleStarDetector implements StarDetector {

    private static final Logger logger = LoggerFactory.getLogger(ParticleStarDetector.class);

    private static final int MEASUREMENTS = Measurements.AREA | Measurements.MEAN | Measurements.MIN_MAX
            | Measurements.CENTER_OF_MASS | Measurements.INTEGRATED_DENSITY | Measurements.ELLIPSE;

    @Override
    public StarTable detect(FloatProcessor image, double fwhm, double threshold, double sky, double peakMax, boolean excludeBorder) {
        // threshold state lives on the processor, keep it off the caller's copy
        FloatProcessor ip = (FloatProcessor) image.duplicate();
        ip.resetMinAndMax();
        double max = ip.getMax();
        if (threshold > max) return StarTable.EMPTY;
        ip.setThreshold(threshold, max, ImageProcessor.NO_LUT_UPDATE);

        int options = ParticleAnalyzer.SHOW_NONE;
        if (excludeBorder) options |= ParticleAnalyzer.EXCLUDE_EDGE_PARTICLES;
        double minArea = Math.max(1, Math.round(Math.PI * (fwhm / 4) * (fwhm / 4)));

        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(options, MEASUREMENTS, rt, minArea, Double.POSITIVE_INFINITY);
        pa.analyze(new ImagePlus("", ip));

        List<StarRecord> stars = new ArrayList<>();
        int saturated = 0;
        for (int i = 0; i < rt.getCounter(); i++) {
            double peak = rt.getValue("Max", i);
            if (peak > peakMax) { saturated++; continue; }

            double area = rt.getValue("Area", i);
            double mean = rt.getValue("Mean", i);
            double flux = rt.getValue("RawIntDen", i) - area * sky;
            // ImageJ puts pixel centres at +0.5
            double x = rt.getValue("XM", i) - 0.5;
            double y = rt.getValue("YM", i) - 0.5;

            double major = rt.getValue("Major", i);
            double minor = rt.getValue("Minor", i);
            double roundness = (major > 0) ? Math.min(1.0, minor / major) : Double.NaN;
            double sharpness = (mean - sky != 0) ? (peak - sky) / (mean - sky) : Double.NaN;

            stars.add(new StarRecord(stars.size() + 1, x, y, peak, flux, sharpness, roundness));
        }
        logger.debug("Particle detection: {} candidates above {}, {} saturated dropped", rt.getCounter(), threshold, saturated);
        return new StarTable(stars);
    }
}
