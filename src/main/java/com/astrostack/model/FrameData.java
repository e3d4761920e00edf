package com.astrostack.model;

import ij.process.FloatProcessor;

public class FrameData {

    public static class FitsMetadata {
        public double exposureTime = 0;
        public double gain = 0;
        public double offset = 0;
        public String object = "";
        public int width = 0;
        public int height = 0;
    }

    public final String name;
    public final FloatProcessor image;
    public final FitsMetadata metadata;

    public FrameData(String name, FloatProcessor image, FitsMetadata metadata) {
        this.name = name;
        this.image = image;
        this.metadata = metadata;
    }
}
