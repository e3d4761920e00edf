package com.astrostack.service;

import com.astrostack.model.FrameData;
import com.astrostack.model.FrameData.FitsMetadata;
import ij.process.FloatProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Comparator;

// rows keep file order: pixel (x, y) is element [y][x] of the stored array
public class FitsImageService {

    private static final Logger logger = LoggerFactory.getLogger(FitsImageService.class);

    public FrameData read(File f) throws IOException {
        try (Fits fits = new Fits(f)) {
            for (BasicHDU<?> hdu : fits.read()) {
                Header header = hdu.getHeader();
                float[][] data = toFloat(hdu.getKernel(), header.getDoubleValue("BZERO", 0.0), header.getDoubleValue("BSCALE", 1.0));
                if (data == null) continue;

                int h = data.length, w = data[0].length;
                float[] px = new float[w * h];
                for (int y = 0; y < h; y++) System.arraycopy(data[y], 0, px, y * w, w);

                FitsMetadata meta = readMetadata(header);
                meta.width = w;
                meta.height = h;
                logger.debug("Read {} ({}x{})", f.getName(), w, h);
                return new FrameData(f.getName(), new FloatProcessor(w, h, px), meta);
            }
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS file " + f, e);
        }
        throw new IOException("No 2D image in " + f);
    }

    public void write(File f, FloatProcessor image, int combinedFrames) throws IOException {
        int w = image.getWidth(), h = image.getHeight();
        float[] px = (float[]) image.getPixels();
        float[][] data = new float[h][w];
        for (int y = 0; y < h; y++) System.arraycopy(px, y * w, data[y], 0, w);

        Files.deleteIfExists(f.toPath());
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(f, "rw")) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            hdu.addValue("NCOMBINE", combinedFrames, "number of frames combined");
            fits.addHDU(hdu);
            fits.write(out);
        } catch (FitsException e) {
            throw new IOException("Cannot write FITS file " + f, e);
        }
        logger.info("Wrote {} ({}x{})", f.getName(), w, h);
    }

    public File[] listFrames(File dir) {
        File[] files = dir.listFiles((d, name) -> {
            String n = name.toLowerCase();
            return n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts");
        });
        if (files == null) return new File[0];
        Arrays.sort(files, Comparator.comparing(File::getName));
        return files;
    }

    private FitsMetadata readMetadata(Header header) {
        FitsMetadata meta = new FitsMetadata();
        meta.exposureTime = header.getDoubleValue("EXPTIME", 0);
        if (meta.exposureTime == 0) meta.exposureTime = header.getDoubleValue("EXPOSURE", 0);

        meta.gain = header.getDoubleValue("GAIN", -1);
        if (meta.gain == -1) meta.gain = header.getDoubleValue("EGAIN", 0);

        meta.offset = header.getDoubleValue("OFFSET", 0);
        String object = header.getStringValue("OBJECT");
        meta.object = (object != null) ? object.trim() : "";
        return meta;
    }

    private float[][] toFloat(Object k, double bzero, double bscale) {
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            if (f.length == 0 || f[0].length == 0) return null;
            if (bzero == 0 && bscale == 1) return f;
            float[][] d = new float[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = (float) (bzero + bscale * f[i][j]);
            return d;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            if (s.length == 0 || s[0].length == 0) return null;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            if (s.length == 0 || s[0].length == 0) return null;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            if (s.length == 0 || s[0].length == 0) return null;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            if (s.length == 0 || s[0].length == 0) return null;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            if (s.length == 0 || s[0].length == 0) return null;
            float[][] d = new float[s.length][s[0].length];
            // FITS bytes are unsigned
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * (s[i][j] & 0xFF));
            return d;
        }
        return null;
    }
}
