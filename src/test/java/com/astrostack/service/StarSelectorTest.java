package com.astrostack.service;

import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import static org.junit.Assert.*;

public class StarSelectorTest {

    private static final double FWHM = 3.0;
    private final StarSelector selector = new StarSelector();

    private static StarRecord star(int id, double x, double y, double peak, double flux) {
        return new StarRecord(id, x, y, peak, flux, 0.5, 0.9);
    }

    /** n isolated bright stars on a 100 px grid, flux = id. */
    private static List<StarRecord> grid(int n) {
        List<StarRecord> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            list.add(star(i + 1, 100 + 100 * (i % 8), 100 + 100 * (i / 8), 20000, i + 1));
        }
        return list;
    }

    @Test
    public void testEdgeProximity() {
        FloatProcessor image = new FloatProcessor(200, 200);
        StarTable sources = new StarTable(Arrays.asList(
            star(1, 49, 100, 5000, 10),
            star(2, 50, 100, 5000, 10),
            star(3, 149, 100, 5000, 10),
            star(4, 150, 100, 5000, 10),
            star(5, 100, 49.4, 5000, 10),
            star(6, 100, 150.1, 5000, 10)));

        StarTable inside = selector.withinBorders(sources, image.getWidth(), image.getHeight());
        assertEquals(2, inside.size());
        assertEquals(2, inside.get(0).id());
        assertEquals(3, inside.get(1).id());
    }

    @Test
    public void testCrowdedPairsRejectedTogether() {
        FloatProcessor image = new FloatProcessor(400, 400);
        StarTable sources = new StarTable(Arrays.asList(
            star(1, 100, 100, 5000, 10),
            star(2, 110, 100, 5000, 20),
            star(3, 250, 250, 5000, 30),
            star(4, 250, 265, 5000, 40)));

        StarTable out = selector.select(sources, image, FWHM, 100, 10);
        assertEquals(0, out.size());

        StarTable spaced = new StarTable(Arrays.asList(
            star(1, 100, 100, 5000, 10),
            star(3, 250, 250, 5000, 30),
            star(4, 250, 265.5, 5000, 40)));
        out = selector.select(spaced, image, FWHM, 100, 10);
        assertEquals(3, out.size());
    }

    @Test
    public void testLowSignificanceRejected() {
        FloatProcessor image = new FloatProcessor(400, 400);
        StarTable sources = new StarTable(Arrays.asList(
            star(1, 100, 100, 1400, 10),
            star(2, 200, 200, 1600, 20),
            star(3, 300, 300, 1500, 30)));

        StarTable out = selector.select(sources, image, FWHM, 1000, 50);
        assertEquals(1, out.size());
        assertEquals(2, out.get(0).id());
    }

    @Test
    public void testBrightestAndFaintestTrimmed() {
        FloatProcessor image = new FloatProcessor(1000, 1000);
        StarTable out = selector.select(new StarTable(grid(15)), image, FWHM, 100, 10);

        assertEquals(5, out.size());
        double[] fluxes = out.stream().mapToDouble(StarRecord::flux).toArray();
        assertArrayEquals(new double[] {10, 9, 8, 7, 6}, fluxes, 0);
    }

    @Test
    public void testNoTrimForTenOrFewer() {
        FloatProcessor image = new FloatProcessor(1000, 1000);
        StarTable out = selector.select(new StarTable(grid(10)), image, FWHM, 100, 10);

        assertEquals(10, out.size());
        assertEquals(10, out.get(0).flux(), 0);
        assertEquals(1, out.get(9).flux(), 0);
    }

    @Test
    public void testSizesNeverGrowAndNoStarNearBorder() {
        FloatProcessor image = new FloatProcessor(600, 500);
        List<StarRecord> list = new ArrayList<>();
        java.util.Random rnd = new java.util.Random(42);
        for (int i = 0; i < 80; i++) {
            list.add(star(i + 1, rnd.nextDouble() * 600, rnd.nextDouble() * 500, 900 + rnd.nextInt(3000), rnd.nextDouble() * 1e5));
        }
        StarTable sources = new StarTable(list);

        StarTable inside = selector.withinBorders(sources, 600, 500);
        StarTable out = selector.select(sources, image, FWHM, 1000, 50);

        assertTrue(inside.size() <= sources.size());
        assertTrue(out.size() <= inside.size());
        for (StarRecord s : out) {
            assertTrue(s.x() > 49.5 && s.x() < 600 - 1 - 49.5);
            assertTrue(s.y() > 49.5 && s.y() < 500 - 1 - 49.5);
            assertTrue(s.peak() > 1500);
        }
    }

    @Test
    public void testOutputCarriesOnlySelectionColumns() {
        FloatProcessor image = new FloatProcessor(400, 400);
        StarTable sources = new StarTable(Arrays.asList(star(7, 200, 200, 5000, 123)));
        StarRecord s = selector.select(sources, image, FWHM, 100, 10).get(0);

        assertEquals(7, s.id());
        assertEquals(123, s.flux(), 0);
        assertEquals(5000, s.peak(), 0);
        assertTrue(Double.isNaN(s.roundness()));
        assertEquals(0.9, sources.get(0).roundness(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroFwhm() {
        selector.select(StarTable.EMPTY, new FloatProcessor(10, 10), 0, 0, 0);
    }
}
