package com.ttennebkram.imagelab.render;

/**
 * Encoded export output with the metadata needed to serve it.
 */
public final class ExportedImage {

    private final byte[] content;
    private final ExportFormat format;

    ExportedImage(byte[] content, ExportFormat format) {
        this.content = content;
        this.format = format;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public ExportFormat getFormat() {
        return format;
    }

    public String getMediaType() {
        return format.getMediaType();
    }

    public String getFileName() {
        return "exported_image." + format.getExtension();
    }
}
