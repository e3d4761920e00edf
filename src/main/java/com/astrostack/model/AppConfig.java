package com.astrostack.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_FWHM_CUTOUT = "fwhm_cutout_half_size";
    private static final String KEY_FWHM_SATURATION = "fwhm_saturation";
    private static final String KEY_DETECT_SATURATION = "detection_saturation";
    private static final String KEY_MATCH_TOL = "match_tolerance";
    private static final String KEY_SHIFT_TH = "shift_threshold";
    private static final String KEY_THREADS = "worker_threads";
    private static final String KEY_LAST_DIR = "last_directory";

    // Plate solving (ASTAP)
    private static final String KEY_ASTAP_PATH = "astap_path";
    private static final String KEY_ASTAP_DB = "astap_db_path";

    // --- PIPELINE ---
    public static int getFwhmCutoutHalfSize() { return prefs.getInt(KEY_FWHM_CUTOUT, 100); }
    public static void setFwhmCutoutHalfSize(int v) { prefs.putInt(KEY_FWHM_CUTOUT, v); }

    public static double getFwhmSaturation() { return prefs.getDouble(KEY_FWHM_SATURATION, 50000.0); }
    public static void setFwhmSaturation(double v) { prefs.putDouble(KEY_FWHM_SATURATION, v); }

    public static double getDetectionSaturation() { return prefs.getDouble(KEY_DETECT_SATURATION, 100000.0); }
    public static void setDetectionSaturation(double v) { prefs.putDouble(KEY_DETECT_SATURATION, v); }

    public static double getMatchTolerance() { return prefs.getDouble(KEY_MATCH_TOL, 20.0); }
    public static void setMatchTolerance(double v) { prefs.putDouble(KEY_MATCH_TOL, v); }

    public static double getShiftThreshold() { return prefs.getDouble(KEY_SHIFT_TH, 0.5); }
    public static void setShiftThreshold(double v) { prefs.putDouble(KEY_SHIFT_TH, v); }

    public static int getWorkerThreads() { return prefs.getInt(KEY_THREADS, 1); }
    public static void setWorkerThreads(int v) { prefs.putInt(KEY_THREADS, v); }

    public static String getLastDirectory() { return prefs.get(KEY_LAST_DIR, ""); }
    public static void setLastDirectory(String v) { prefs.put(KEY_LAST_DIR, v); }

    // --- ASTAP ---
    public static String getAstapPath() {
        return prefs.get(KEY_ASTAP_PATH, "");
    }
    public static void setAstapPath(String v) { prefs.put(KEY_ASTAP_PATH, v); }

    public static String getAstapDbPath() {
        return prefs.get(KEY_ASTAP_DB, ""); // no default, the user must choose
    }
    public static void setAstapDbPath(String v) { prefs.put(KEY_ASTAP_DB, v); }
}
