package com.astrostack.model;

public class PipelineSettings {

    // FWHM estimation
    public int fwhmCutoutHalfSize = 100;
    public int fwhmBorderMargin = 100;
    public double fwhmSaturation = 50000;
    public double fwhmMinimum = 2.0;
    public int fwhmMaxAttempts = 100;
    public double fwhmNoiseFloor = 1000;

    // Detection
    public double backgroundClipSigma = 2.0;
    public double detectionThresholdSigmas = 10;
    public double detectionSaturation = 100000;

    // Registration
    public double matchTolerance = 20;
    public double shiftThreshold = 0.5;
    public double combineClipSigma = 3.0;
    public int workerThreads = 1;

    // Star selection
    public double selectionCutoutSize = 100;
    public double crowdingFwhmFactor = 5;
    public double significanceSigmas = 10;
    public int trimCount = 5;

    // Local background
    public double annulusInnerRadius = 20;
    public double annulusOuterRadius = 30;
    public double windowFwhmFactor = 5;
    public double annulusClipSigma = 3.0;

    public static PipelineSettings fromPreferences() {
        PipelineSettings s = new PipelineSettings();
        s.fwhmCutoutHalfSize = AppConfig.getFwhmCutoutHalfSize();
        s.fwhmSaturation = AppConfig.getFwhmSaturation();
        s.detectionSaturation = AppConfig.getDetectionSaturation();
        s.matchTolerance = AppConfig.getMatchTolerance();
        s.shiftThreshold = AppConfig.getShiftThreshold();
        s.workerThreads = Math.max(1, AppConfig.getWorkerThreads());
        return s;
    }
}
