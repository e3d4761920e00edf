package com.astrostack.service;

import com.astrostack.model.FrameData;
import ij.process.FloatProcessor;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import static org.junit.Assert.*;

public class FitsImageServiceTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final FitsImageService service = new FitsImageService();

    @Test
    public void testWriteThenRead() throws IOException {
        FloatProcessor image = SyntheticImages.textured(64, 48, 9L);
        image.setf(3, 40, -12.5f);
        File f = new File(tmp.getRoot(), "combined.fits");

        service.write(f, image, 7);
        FrameData back = service.read(f);

        assertEquals("combined.fits", back.name);
        assertEquals(64, back.metadata.width);
        assertEquals(48, back.metadata.height);
        assertEquals(-12.5f, back.image.getf(3, 40), 0f);
        assertArrayEquals((float[]) image.getPixels(), (float[]) back.image.getPixels(), 0f);
    }

    @Test
    public void testOverwrite() throws IOException {
        File f = new File(tmp.getRoot(), "out.fits");
        service.write(f, SyntheticImages.flat(20, 20, 1f), 1);
        service.write(f, SyntheticImages.flat(10, 5, 2f), 1);

        FrameData back = service.read(f);
        assertEquals(10, back.image.getWidth());
        assertEquals(5, back.image.getHeight());
        assertEquals(2f, back.image.getf(9, 4), 0f);
    }

    @Test
    public void testListFramesSortedAndFiltered() throws IOException {
        File dir = tmp.newFolder("frames");
        for (String name : new String[] {"b.fits", "a.FIT", "c.fts", "notes.txt", "d.png"}) {
            assertTrue(new File(dir, name).createNewFile());
        }

        File[] frames = service.listFrames(dir);
        assertEquals(3, frames.length);
        assertEquals("a.FIT", frames[0].getName());
        assertEquals("b.fits", frames[1].getName());
        assertEquals("c.fts", frames[2].getName());
    }

    @Test
    public void testListFramesMissingDirectory() {
        assertEquals(0, service.listFrames(new File(tmp.getRoot(), "nope")).length);
    }

    @Test(expected = IOException.class)
    public void testGarbageFile() throws IOException {
        File f = tmp.newFile("broken.fits");
        Files.write(f.toPath(), "this is not a FITS file".getBytes(StandardCharsets.US_ASCII));
        service.read(f);
    }
}
