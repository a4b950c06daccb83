package com.ttennebkram.imagelab.render;

import com.ttennebkram.imagelab.errors.UnsupportedFormatException;
import com.ttennebkram.imagelab.raster.RasterCodec;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * An export target: a raster container OpenCV can write, or a one-page PDF.
 */
public final class ExportFormat {

    private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,10}");

    /** Any channel layout the encoder takes. */
    public static final int ANY_CHANNELS = 0;

    public static final ExportFormat PDF = new ExportFormat("pdf", "application/pdf", false, false, true);

    private final String extension;
    private final String mediaType;
    private final boolean lossy;
    private final boolean alphaSupported;
    private final boolean document;
    private final int requiredChannels;

    private ExportFormat(String extension, String mediaType, boolean lossy, boolean alphaSupported, boolean document) {
        this(extension, mediaType, lossy, alphaSupported, document, ANY_CHANNELS);
    }

    private ExportFormat(String extension, String mediaType, boolean lossy, boolean alphaSupported, boolean document,
                         int requiredChannels) {
        this.extension = extension;
        this.mediaType = mediaType;
        this.lossy = lossy;
        this.alphaSupported = alphaSupported;
        this.document = document;
        this.requiredChannels = requiredChannels;
    }

    /**
     * Parse a format name such as "png", ".JPG" or "pdf".
     *
     * @throws UnsupportedFormatException if the name is malformed or no encoder exists for it
     */
    public static ExportFormat parse(String name) {
        String ext = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        if (!EXTENSION.matcher(ext).matches()) {
            throw new UnsupportedFormatException(String.valueOf(name));
        }

        switch (ext) {
            case "pdf":
                return PDF;
            case "png":
                return new ExportFormat("png", "image/png", false, true, false);
            case "jpg":
            case "jpeg":
                return new ExportFormat(ext, "image/jpeg", true, false, false);
            case "webp":
                return new ExportFormat("webp", "image/webp", true, true, false);
            case "tif":
            case "tiff":
                return new ExportFormat(ext, "image/tiff", false, true, false);
            case "pgm":
            case "pbm":
                requireWriter(ext);
                return new ExportFormat(ext, "image/x-portable-" + (ext.equals("pgm") ? "graymap" : "bitmap"),
                        false, false, false, 1);
            case "ppm":
                requireWriter(ext);
                return new ExportFormat(ext, "image/x-portable-pixmap", false, false, false, 3);
            default:
                requireWriter(ext);
                return new ExportFormat(ext, "image/" + ext, false, false, false);
        }
    }

    private static void requireWriter(String ext) {
        if (!RasterCodec.canEncode(ext)) {
            throw new UnsupportedFormatException(ext);
        }
    }

    public String getExtension() {
        return extension;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * Whether the quality setting applies.
     */
    public boolean isLossy() {
        return lossy;
    }

    public boolean isAlphaSupported() {
        return alphaSupported;
    }

    /**
     * Channel count the encoder insists on (1 or 3), or {@link #ANY_CHANNELS}.
     */
    public int getRequiredChannels() {
        return requiredChannels;
    }

    /**
     * True for the paginated document format.
     */
    public boolean isDocument() {
        return document;
    }

    @Override
    public String toString() {
        return extension;
    }
}
