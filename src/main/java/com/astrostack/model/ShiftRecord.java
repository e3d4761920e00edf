package com.astrostack.model;

/**
 * Offset of one reference star to its nearest neighbour in another frame.
 * dx and dy are reference minus target.
 */
public record ShiftRecord(double distance, double dx, double dy) {

    public static final ShiftRecord UNMATCHED = new ShiftRecord(Double.NaN, Double.NaN, Double.NaN);

    public boolean isMatched() {
        return !Double.isNaN(distance);
    }
}
