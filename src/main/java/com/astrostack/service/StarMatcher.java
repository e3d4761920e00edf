package com.astrostack.service;

import com.astrostack.model.ShiftRecord;
import com.astrostack.model.StarRecord;
import com.astrostack.model.StarTable;

public class StarMatcher {

    public static final double DEFAULT_TOLERANCE = 20.0;

    private final double tolerance;

    public StarMatcher() {
        this(DEFAULT_TOLERANCE);
    }

    public StarMatcher(double tolerance) {
        this.tolerance = tolerance;
    }

    public ShiftRecord[] match(StarTable reference, StarTable target) {
        ShiftRecord[] diff = new ShiftRecord[reference.size()];
        for (int i = 0; i < reference.size(); i++) {
            StarRecord ref = reference.get(i);
            StarRecord nearest = null;
            double best = Double.POSITIVE_INFINITY;
            // ties keep the lowest target index
            for (StarRecord t : target) {
                double d = ref.distanceTo(t);
                if (d < best) { best = d; nearest = t; }
            }
            diff[i] = (nearest != null && best < tolerance)
                    ? new ShiftRecord(best, ref.x() - nearest.x(), ref.y() - nearest.y())
                    : ShiftRecord.UNMATCHED;
        }
        return diff;
    }
}
