package com.astrostack.service;

import com.astrostack.model.FwhmEstimate;
import com.astrostack.model.PipelineSettings;
import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Detection is mostly stubbed with fixed tables so matching, shifting and combining
 * are tested on their own; one test runs the ImageJ particle detector end to end.
 */
public class RegistrationServiceTest {

    private static final double[][] STARS = {{30, 40}, {80, 25}, {55, 70}, {100, 90}, {20, 100}};

    private Map<FloatProcessor, StarTable> tables;
    private StarDetector stub;

    @Before
    public void setUp() {
        tables = new IdentityHashMap<>();
        stub = (image, fwhm, threshold, sky, peakMax, excludeBorder) -> tables.getOrDefault(image, StarTable.EMPTY);
    }

    private static StarTable starsShiftedBy(double dx, double dy) {
        List<StarRecord> list = new ArrayList<>();
        for (int i = 0; i < STARS.length; i++) {
            list.add(new StarRecord(i + 1, STARS[i][0] + dx, STARS[i][1] + dy, 5000, 1000 + i));
        }
        return new StarTable(list);
    }

    @Test
    public void testIdenticalFramesGiveSameImage() {
        FloatProcessor frame = SyntheticImages.textured(128, 128, 5L);
        List<FloatProcessor> frames = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            FloatProcessor copy = (FloatProcessor) frame.duplicate();
            tables.put(copy, starsShiftedBy(0, 0));
            frames.add(copy);
        }

        FloatProcessor out = new RegistrationService(stub).combine(frames, 2.0);
        assertArrayEquals((float[]) frame.getPixels(), (float[]) out.getPixels(), 0f);
    }

    @Test
    public void testShiftedFrameIsRealigned() {
        FloatProcessor reference = SyntheticImages.textured(128, 128, 6L);
        FloatProcessor moved = FrameShifter.roll(reference, 2, -3);
        FloatProcessor second = (FloatProcessor) reference.duplicate();
        tables.put(reference, starsShiftedBy(0, 0));
        tables.put(second, starsShiftedBy(0.2, -0.1));
        tables.put(moved, starsShiftedBy(2.1, -2.9));

        FloatProcessor out = new RegistrationService(stub).combine(Arrays.asList(reference, moved, second), 2.0);
        assertArrayEquals((float[]) reference.getPixels(), (float[]) out.getPixels(), 0f);
    }

    @Test
    public void testWorkerPoolGivesSameResult() {
        FloatProcessor reference = SyntheticImages.textured(96, 96, 8L);
        List<FloatProcessor> frames = new ArrayList<>();
        frames.add(reference);
        tables.put(reference, starsShiftedBy(0, 0));
        for (int i = 1; i <= 4; i++) {
            FloatProcessor moved = FrameShifter.roll(reference, i, -i);
            tables.put(moved, starsShiftedBy(i, -i));
            frames.add(moved);
        }
        PipelineSettings settings = new PipelineSettings();
        settings.workerThreads = 3;

        FloatProcessor out = new RegistrationService(stub, settings).combine(frames, 2.0);
        assertArrayEquals((float[]) reference.getPixels(), (float[]) out.getPixels(), 0f);
    }

    @Test
    public void testParticleDetectionOnWorkerPool() {
        double[][] truth = {{50, 60}, {140, 45}, {100, 120}, {60, 160}, {160, 150}};
        FloatProcessor reference = SyntheticImages.noisy(200, 200, 100f, 5.0, 11L);
        for (double[] p : truth) SyntheticImages.addStar(reference, p[0], p[1], 2.0, 5000);
        List<FloatProcessor> frames = Arrays.asList(
            reference, FrameShifter.roll(reference, 3, -2), FrameShifter.roll(reference, -4, 1));
        PipelineSettings settings = new PipelineSettings();
        settings.workerThreads = 4;
        RegistrationService service = new RegistrationService(new ParticleStarDetector(), settings);

        StarTable found = service.findStars(reference, 2.0);
        assertEquals(truth.length, found.size());
        for (double[] p : truth) {
            assertTrue(found.stream().anyMatch(s -> Math.abs(s.x() - p[0]) < 0.1 && Math.abs(s.y() - p[1]) < 0.1));
        }

        FloatProcessor out = service.combine(frames, 2.0);
        assertArrayEquals((float[]) reference.getPixels(), (float[]) out.getPixels(), 0f);
    }

    @Test
    public void testNoReferenceStarsGivesNull() {
        FloatProcessor a = SyntheticImages.textured(64, 64, 1L);
        FloatProcessor b = SyntheticImages.textured(64, 64, 2L);
        tables.put(b, starsShiftedBy(0, 0));
        assertNull(new RegistrationService(stub).combine(Arrays.asList(a, b), 2.0));
    }

    @Test
    public void testFrameWithoutStarsIsNotShifted() {
        FloatProcessor reference = SyntheticImages.textured(64, 64, 3L);
        FloatProcessor copy = (FloatProcessor) reference.duplicate();
        FloatProcessor blank = SyntheticImages.flat(64, 64, 0f);
        tables.put(reference, starsShiftedBy(0, 0));
        tables.put(copy, starsShiftedBy(0, 0));

        FloatProcessor out = new RegistrationService(stub).combine(Arrays.asList(reference, blank, copy), 2.0);
        assertArrayEquals((float[]) reference.getPixels(), (float[]) out.getPixels(), 0f);
    }

    @Test
    public void testDetectionParameters() {
        final double[] seen = new double[4];
        final boolean[] border = new boolean[1];
        StarDetector recording = (image, fwhm, threshold, sky, peakMax, excludeBorder) -> {
            seen[0] = fwhm; seen[1] = threshold; seen[2] = sky; seen[3] = peakMax;
            border[0] = excludeBorder;
            return StarTable.EMPTY;
        };
        new RegistrationService(recording).findStars(SyntheticImages.flat(50, 50, 300f), 2.0);

        assertEquals(2.0 * FwhmEstimate.SIGMA_TO_FWHM, seen[0], 1e-9);
        assertEquals(300.0, seen[1], 1e-9);
        assertEquals(300.0, seen[2], 1e-9);
        assertEquals(100000.0, seen[3], 0);
        assertTrue(border[0]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoFrames() {
        new RegistrationService(stub).combine(new ArrayList<>(), 2.0);
    }
}
