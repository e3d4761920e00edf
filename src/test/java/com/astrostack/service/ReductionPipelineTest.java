package com.astrostack.service;

import com.astrostack.model.PipelineSettings;
import com.astrostack.model.ReductionResult;
import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

// 5x5 synthetic star fields, detection stubbed
public class ReductionPipelineTest {

    private static final int SIZE = 400;
    private static final int[] GRID = {80, 140, 200, 260, 320};

    private PipelineSettings settings;
    private StarTable grid;
    private List<Double> detectionSkies;

    @Before
    public void setUp() {
        settings = new PipelineSettings();
        settings.fwhmCutoutHalfSize = 20;
        detectionSkies = new ArrayList<>();

        List<StarRecord> list = new ArrayList<>();
        for (int j = 0; j < GRID.length; j++) {
            for (int i = 0; i < GRID.length; i++) {
                int n = list.size();
                list.add(new StarRecord(n + 1, GRID[i], GRID[j], 5100, n + 1));
            }
        }
        grid = new StarTable(list);
    }

    private static FloatProcessor field() {
        FloatProcessor image = SyntheticImages.flat(SIZE, SIZE, 100f);
        for (int y : GRID)
            for (int x : GRID)
                SyntheticImages.addStar(image, x, y, 2.0, 5000);
        return image;
    }

    private StarDetector returning(StarTable table) {
        return (image, fwhm, threshold, sky, peakMax, excludeBorder) -> {
            detectionSkies.add(sky);
            return table;
        };
    }

    @Test
    public void testCompleteReduction() {
        List<FloatProcessor> frames = Arrays.asList(field(), field(), field());
        ReductionResult res = new ReductionPipeline(settings, returning(grid)).reduce(frames);

        assertEquals(ReductionResult.Status.COMPLETE, res.status);
        assertEquals(4.71, res.fwhm.fwhm(), 0.1);
        assertEquals(100, res.background.median(), 1e-3);
        assertEquals(25, res.sources.size());
        // 25 isolated stars, the five brightest and five faintest trimmed
        assertEquals(15, res.selectedStars.size());
        assertEquals(20, res.selectedStars.get(0).flux(), 0);
        assertEquals(6, res.selectedStars.get(14).flux(), 0);
        // three frame detections and one on the combined image
        assertEquals(4, detectionSkies.size());

        assertArrayEquals((float[]) frames.get(0).getPixels(), (float[]) res.combined.getPixels(), 0f);
        for (StarRecord s : res.selectedStars) {
            int x = (int) s.x(), y = (int) s.y();
            assertEquals(5000f, res.flattened.getf(x, y), 0.01f);
            assertEquals(0f, res.flattened.getf(x + 11, y), 0.01f);
            assertEquals(0f, res.flattened.getf(x, y - 11), 0.01f);
        }
        // trimmed stars are left as they were
        StarRecord brightest = grid.get(24);
        assertEquals(5100f, res.flattened.getf((int) brightest.x(), (int) brightest.y()), 0.01f);
        assertEquals(100f, res.flattened.getf(10, 10), 0f);
    }

    @Test
    public void testNoFwhmWhenOnlySaturatedStars() {
        FloatProcessor burnt = SyntheticImages.addStar(SyntheticImages.flat(SIZE, SIZE, 100f), 200, 200, 3.0, 80000);
        List<FloatProcessor> frames = Arrays.asList(burnt, (FloatProcessor) burnt.duplicate());
        ReductionResult res = new ReductionPipeline(settings, returning(grid)).reduce(frames);

        assertEquals(ReductionResult.Status.NO_FWHM, res.status);
        assertFalse(res.fwhm.isValid());
        assertNull(res.combined);
        assertTrue(res.selectedStars.isEmpty());
        assertTrue(detectionSkies.isEmpty());
    }

    @Test
    public void testNoDetectionOnReference() {
        List<FloatProcessor> frames = Arrays.asList(field(), field());
        ReductionResult res = new ReductionPipeline(settings, returning(StarTable.EMPTY)).reduce(frames);

        assertEquals(ReductionResult.Status.NO_DETECTION, res.status);
        assertTrue(res.fwhm.isValid());
        assertNull(res.combined);
        assertNull(res.flattened);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoFrames() {
        new ReductionPipeline(settings, returning(grid)).reduce(new ArrayList<>());
    }
}
