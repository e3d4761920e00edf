package com.astrostack.model;

/**
 * One detected point source. Coordinates are in pixels, with pixel centres on
 * integer positions. Shape descriptors are NaN when the detector does not supply them.
 */
public record StarRecord(int id, double x, double y, double peak, double flux, double sharpness, double roundness) {

    public StarRecord(int id, double x, double y, double peak, double flux) {
        this(id, x, y, peak, flux, Double.NaN, Double.NaN);
    }

    public double distanceTo(StarRecord other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
