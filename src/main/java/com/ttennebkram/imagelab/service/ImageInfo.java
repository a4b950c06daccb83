package com.ttennebkram.imagelab.service;

/**
 * Dimensions of an uploaded image.
 */
public final class ImageInfo {

    private final int width;
    private final int height;
    private final int channels;

    ImageInfo(int width, int height, int channels) {
        this.width = width;
        this.height = height;
        this.channels = channels;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    @Override
    public String toString() {
        return width + " x " + height + " (" + channels + " channel" + (channels == 1 ? "" : "s") + ")";
    }
}
