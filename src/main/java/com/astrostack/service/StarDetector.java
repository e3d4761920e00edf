package com.astrostack.service;

import com.astrostack.model.StarTable;
import ij.process.FloatProcessor;

/**
 * Finds point sources in an image.
 */
public interface StarDetector {

    /**
     * @param image         frame to search, left unmodified
     * @param fwhm          expected stellar full width at half maximum in pixels
     * @param threshold     minimum pixel value belonging to a source
     * @param sky           background level subtracted from the measured fluxes
     * @param peakMax       detections peaking above this value are dropped as saturated
     * @param excludeBorder drop detections touching the image border
     * @return the detections, possibly empty, never null
     */
    StarTable detect(FloatProcessor image, double fwhm, double threshold, double sky, double peakMax, boolean excludeBorder);
}
