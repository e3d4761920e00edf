package com.astrostack.service;

import com.astrostack.model.PipelineSettings;
import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Picks PSF candidates out of a detection table.
 * <p>
 * Stars closer than half a cutout to any border are dropped first. Of the rest, every
 * star with a neighbour within {@code crowdingFwhmFactor * fwhm} and every star peaking
 * at or below {@code background + significanceSigmas * backgroundStd} is dropped. The
 * survivors are ordered brightest first and, when more than twice {@code trimCount}
 * remain, the {@code trimCount} brightest and faintest are cut as well.
 * <p>
 * The background level and spread are used as given by the caller.
 */
public class StarSelector {

    private static final Logger logger = LoggerFactory.getLogger(StarSelector.class);

    private final double cutoutSize;
    private final double crowdingFwhmFactor;
    private final double significanceSigmas;
    private final int trimCount;

    public StarSelector() {
        this(new PipelineSettings());
    }

    public StarSelector(PipelineSettings s) {
        this(s.selectionCutoutSize, s.crowdingFwhmFactor, s.significanceSigmas, s.trimCount);
    }

    public StarSelector(double cutoutSize, double crowdingFwhmFactor, double significanceSigmas, int trimCount) {
        this.cutoutSize = cutoutSize;
        this.crowdingFwhmFactor = crowdingFwhmFactor;
        this.significanceSigmas = significanceSigmas;
        this.trimCount = trimCount;
    }

    /**
     * @return a new table of the selected stars, brightest first, carrying id, position, peak and flux only
     */
    public StarTable select(StarTable sources, FloatProcessor image, double fwhm, double background, double backgroundStd) {
        if (!(fwhm > 0)) throw new IllegalArgumentException("FWHM must be positive: " + fwhm);

        StarTable inside = withinBorders(sources, image.getWidth(), image.getHeight());
        BitSet rejected = crowded(inside, fwhm);
        int crowded = rejected.cardinality();
        rejected.or(faint(inside, background, backgroundStd));

        List<StarRecord> kept = new ArrayList<>();
        for (int i = 0; i < inside.size(); i++) {
            if (!rejected.get(i)) {
                StarRecord s = inside.get(i);
                kept.add(new StarRecord(s.id(), s.x(), s.y(), s.peak(), s.flux()));
            }
        }
        StarTable sorted = new StarTable(kept).sortedByFluxDescending();
        StarTable result = trim(sorted);
        logger.debug("Star selection: {} sources, {} inside borders, {} crowded, {} after significance cut, {} kept",
                sources.size(), inside.size(), crowded, sorted.size(), result.size());
        return result;
    }

    StarTable withinBorders(StarTable sources, int width, int height) {
        double hsize = (cutoutSize - 1) / 2;
        List<StarRecord> inside = new ArrayList<>();
        for (StarRecord s : sources) {
            if (s.x() > hsize && s.x() < (width - 1 - hsize) && s.y() > hsize && s.y() < (height - 1 - hsize)) {
                inside.add(s);
            }
        }
        return new StarTable(inside);
    }

    /** Both members of every pair closer than the crowding radius. */
    BitSet crowded(StarTable stars, double fwhm) {
        double limit = crowdingFwhmFactor * fwhm;
        BitSet out = new BitSet(stars.size());
        for (int i = 0; i < stars.size(); i++) {
            for (int j = i + 1; j < stars.size(); j++) {
                if (stars.get(i).distanceTo(stars.get(j)) <= limit) {
                    out.set(i);
                    out.set(j);
                }
            }
        }
        return out;
    }

    BitSet faint(StarTable stars, double background, double backgroundStd) {
        double minPeak = background + significanceSigmas * backgroundStd;
        BitSet out = new BitSet(stars.size());
        for (int i = 0; i < stars.size(); i++) {
            if (stars.get(i).peak() <= minPeak) out.set(i);
        }
        return out;
    }

    private StarTable trim(StarTable sorted) {
        if (sorted.size() <= 2 * trimCount) return sorted;
        return new StarTable(sorted.asList().subList(trimCount, sorted.size() - trimCount));
    }
}
