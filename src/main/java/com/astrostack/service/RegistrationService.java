package com.astrostack.service;

import com.astrostack.model.ClippedStats;
import com.astrostack.model.FwhmEstimate;
import com.astrostack.model.PipelineSettings;
import com.astrostack.model.ShiftRecord;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.IntFunction;

/**
 * Registers a frame set on its first frame and median-combines it.
 */
public class RegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

    private final StarDetector detector;
    private final StarMatcher matcher;
    private final FrameShifter shifter;
    private final StackCombiner combiner;
    private final SigmaClipper backgroundClipper;
    private final double thresholdSigmas;
    private final double saturation;
    private final int workerThreads;

    public RegistrationService(StarDetector detector) {
        this(detector, new PipelineSettings());
    }

    public RegistrationService(StarDetector detector, PipelineSettings s) {
        this(detector, new StarMatcher(s.matchTolerance), new FrameShifter(s.shiftThreshold),
                new StackCombiner(s.combineClipSigma), new SigmaClipper(s.backgroundClipSigma),
                s.detectionThresholdSigmas, s.detectionSaturation, s.workerThreads);
    }

    public RegistrationService(StarDetector detector, StarMatcher matcher, FrameShifter shifter, StackCombiner combiner,
                               SigmaClipper backgroundClipper, double thresholdSigmas, double saturation, int workerThreads) {
        this.detector = detector;
        this.matcher = matcher;
        this.shifter = shifter;
        this.combiner = combiner;
        this.backgroundClipper = backgroundClipper;
        this.thresholdSigmas = thresholdSigmas;
        this.saturation = saturation;
        this.workerThreads = Math.max(1, workerThreads);
    }

    // null when the reference frame has no stars
    public FloatProcessor combine(List<FloatProcessor> frames, double sigma) {
        if (frames == null || frames.isEmpty()) throw new IllegalArgumentException("No frames to register");

        List<StarTable> tables = forEachFrame(frames.size(), i -> findStars(frames.get(i), sigma));
        StarTable reference = tables.get(0);
        if (reference.isEmpty()) {
            logger.warn("No stars detected on the reference frame, nothing to register");
            return null;
        }

        List<FloatProcessor> aligned = forEachFrame(frames.size(), i -> {
            ShiftRecord[] diff = matcher.match(reference, tables.get(i));
            return shifter.shift(frames.get(i), diff);
        });
        logger.info("Registered {} frames on {} reference stars", frames.size(), reference.size());
        return combiner.combine(aligned);
    }

    public StarTable findStars(FloatProcessor frame, double sigma) {
        ClippedStats bg = backgroundClipper.stats(frame);
        double threshold = bg.median() + thresholdSigmas * bg.stdDev();
        StarTable stars = detector.detect(frame, sigma * FwhmEstimate.SIGMA_TO_FWHM, threshold, bg.median(), saturation, true);
        logger.debug("{} stars above {} (sky {}, std {})", stars.size(), threshold, bg.median(), bg.stdDev());
        return stars;
    }

    private <T> List<T> forEachFrame(int n, IntFunction<T> task) {
        List<T> results = new ArrayList<>(n);
        if (workerThreads == 1 || n == 1) {
            for (int i = 0; i < n; i++) results.add(task.apply(i));
            return results;
        }

        ExecutorService exec = Executors.newFixedThreadPool(Math.min(workerThreads, n));
        try {
            List<Future<T>> futures = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                final int index = i;
                futures.add(exec.submit(() -> task.apply(index)));
            }
            for (Future<T> f : futures) results.add(f.get());
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Registration interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("Frame processing failed", cause);
        } finally {
            exec.shutdownNow();
        }
    }
}
