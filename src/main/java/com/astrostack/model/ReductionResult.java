package com.astrostack.model;

import ij.process.FloatProcessor;

public class ReductionResult {
    public enum Status { COMPLETE, NO_FWHM, NO_DETECTION }

    public final Status status;
    public final FwhmEstimate fwhm;
    public final FloatProcessor combined;      // null unless registration succeeded
    public final ClippedStats background;      // of the combined image
    public final StarTable sources;            // everything detected on the combined image
    public final StarTable selectedStars;      // PSF candidates
    public final FloatProcessor flattened;     // combined image with local backgrounds removed

    public ReductionResult(Status status, FwhmEstimate fwhm, FloatProcessor combined, ClippedStats background,
                           StarTable sources, StarTable selectedStars, FloatProcessor flattened) {
        this.status = status;
        this.fwhm = fwhm;
        this.combined = combined;
        this.background = background;
        this.sources = sources;
        this.selectedStars = selectedStars;
        this.flattened = flattened;
    }

    public static ReductionResult failed(Status status, FwhmEstimate fwhm) {
        return new ReductionResult(status, fwhm, null, null, StarTable.EMPTY, StarTable.EMPTY, null);
    }
}
