package com.astrostack.model;

public record ClippedStats(double mean, double median, double stdDev, int count) {
}
