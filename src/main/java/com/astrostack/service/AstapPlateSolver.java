package com.astrostack.service;

import com.astrostack.model.CelestialPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;

public class AstapPlateSolver {

    private static final Logger logger = LoggerFactory.getLogger(AstapPlateSolver.class);

    private final String astapPath;
    private final String dbPath;
    private final long timeoutSeconds;

    public AstapPlateSolver(String astapPath, String dbPath, long timeoutSeconds) {
        this.astapPath = astapPath;
        this.dbPath = dbPath;
        this.timeoutSeconds = timeoutSeconds;
    }

    public boolean isConfigured() {
        return astapPath != null && !astapPath.isEmpty() && dbPath != null && !dbPath.isEmpty();
    }

    public CelestialPoint solve(File fitsFile) {
        if (!isConfigured()) {
            logger.warn("ASTAP path or star database not configured, skipping plate solve");
            return null;
        }

        try {
            // ASTAP CLI: -f (file) -r (search radius 30 deg) -d (database)
            ProcessBuilder pb = new ProcessBuilder(
                astapPath,
                "-f", fitsFile.getAbsolutePath(),
                "-r", "30",
                "-d", dbPath
            );
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);

            Process p = pb.start();
            boolean finished = p.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                p.destroy();
                logger.warn("ASTAP did not finish within {} s on {}", timeoutSeconds, fitsFile.getName());
                return null;
            }

            String basePath = fitsFile.getAbsolutePath().substring(0, fitsFile.getAbsolutePath().lastIndexOf('.'));
            File wcsFile = new File(basePath + ".wcs");
            File iniFile = new File(basePath + ".ini");

            CelestialPoint result = null;
            if (wcsFile.exists()) {
                result = parseWcsFile(wcsFile);
                Files.deleteIfExists(wcsFile.toPath());
            }
            Files.deleteIfExists(iniFile.toPath());

            if (result == null) logger.info("ASTAP found no solution for {}", fitsFile.getName());
            return result;

        } catch (IOException e) {
            logger.error("ASTAP failed on {}", fitsFile.getName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Plate solve of {} interrupted", fitsFile.getName());
        }
        return null;
    }

    // null when CRVAL1 or CRVAL2 is missing
    CelestialPoint parseWcsFile(File wcs) throws IOException {
        double ra = 0, dec = 0;
        boolean foundRa = false, foundDec = false;

        for (String l : Files.readAllLines(wcs.toPath())) {
            if (l.startsWith("CRVAL1")) {
                ra = cardValue(l);
                foundRa = !Double.isNaN(ra);
            }
            if (l.startsWith("CRVAL2")) {
                dec = cardValue(l);
                foundDec = !Double.isNaN(dec);
            }
        }
        return (foundRa && foundDec) ? new CelestialPoint(ra, dec) : null;
    }

    private static double cardValue(String card) {
        String[] parts = card.split("=", 2);
        if (parts.length < 2) return Double.NaN;
        try {
            return Double.parseDouble(parts[1].split("/")[0].trim());
        } catch (NumberFormatException e) {
            logger.debug("Unparseable WCS card: {}", card);
            return Double.NaN;
        }
    }
}
