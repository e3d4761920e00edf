package com.astrostack.model;

/** Sky position in degrees. */
public record CelestialPoint(double ra, double dec) {
}
