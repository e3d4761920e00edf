package com.astrostack.model;

public record FwhmEstimate(double fwhm, double sigma) {

    /** Gaussian sigma to full width at half maximum, 2*sqrt(2*ln 2). */
    public static final double SIGMA_TO_FWHM = 2.0 * Math.sqrt(2.0 * Math.log(2.0));

    public static final FwhmEstimate NONE = new FwhmEstimate(0, 0);

    public static FwhmEstimate fromSigma(double sigma) {
        return new FwhmEstimate(sigma * SIGMA_TO_FWHM, sigma);
    }

    public boolean isValid() {
        return fwhm > 0;
    }
}
