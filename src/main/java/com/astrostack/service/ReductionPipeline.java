package com.astrostack.service;

import com.astrostack.model.ClippedStats;
import com.astrostack.model.FwhmEstimate;
import com.astrostack.model.PipelineSettings;
import com.astrostack.model.ReductionResult;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.List;

public class ReductionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ReductionPipeline.class);

    private final FwhmEstimator fwhmEstimator;
    private final RegistrationService registration;
    private final StarDetector detector;
    private final SigmaClipper backgroundClipper;
    private final StarSelector selector;
    private final LocalBackgroundSubtractor subtractor;
    private final PipelineSettings settings;

    public ReductionPipeline(PipelineSettings settings) {
        this(settings, new ParticleStarDetector());
    }

    public ReductionPipeline(PipelineSettings settings, StarDetector detector) {
        this.settings = settings;
        this.detector = detector;
        this.fwhmEstimator = new FwhmEstimator(settings);
        this.registration = new RegistrationService(detector, settings);
        this.backgroundClipper = new SigmaClipper(settings.backgroundClipSigma);
        this.selector = new StarSelector(settings);
        this.subtractor = new LocalBackgroundSubtractor(settings);
    }

    public ReductionResult reduce(List<FloatProcessor> frames) {
        if (frames == null || frames.isEmpty()) throw new IllegalArgumentException("No frames to reduce");

        // --- 1. SEEING (taken as constant over the set) ---
        FwhmEstimate fwhm = fwhmEstimator.estimate(frames.get(0));
        if (!fwhm.isValid()) {
            logger.warn("No FWHM estimate on the reference frame, reduction stopped");
            return ReductionResult.failed(ReductionResult.Status.NO_FWHM, fwhm);
        }

        // --- 2. REGISTER & STACK ---
        FloatProcessor combined = registration.combine(frames, fwhm.sigma());
        if (combined == null) {
            return ReductionResult.failed(ReductionResult.Status.NO_DETECTION, fwhm);
        }

        // --- 3. PSF CANDIDATES ---
        ClippedStats bg = backgroundClipper.stats(combined);
        double threshold = bg.median() + settings.detectionThresholdSigmas * bg.stdDev();
        StarTable sources = detector.detect(combined, fwhm.fwhm(), threshold, bg.median(), settings.detectionSaturation, true);
        StarTable stars = selector.select(sources, combined, fwhm.fwhm(), bg.median(), bg.stdDev());
        FloatProcessor flattened = subtractor.subtract(combined, stars, fwhm.fwhm());

        logger.info("Reduced {} frames: fwhm {} px, {} sources, {} PSF candidates",
                frames.size(), String.format("%.2f", fwhm.fwhm()), sources.size(), stars.size());
        return new ReductionResult(ReductionResult.Status.COMPLETE, fwhm, combined, bg, sources, stars, flattened);
    }
}
