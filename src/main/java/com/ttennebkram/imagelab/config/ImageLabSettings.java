package com.ttennebkram.imagelab.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tunables for the batch orchestrator and the renderers.
 *
 * Defaults come from {@code imagelab.properties} on the classpath; any key can
 * be overridden with a JVM system property of the same name
 * (e.g. {@code -Dbatch.maxItems=20}).
 */
public final class ImageLabSettings {

    private static final Logger log = LoggerFactory.getLogger(ImageLabSettings.class);

    public static final String RESOURCE = "imagelab.properties";

    public static final String BATCH_MAX_ITEMS = "batch.maxItems";
    public static final String BATCH_PARALLELISM = "batch.parallelism";
    public static final String BATCH_ARCHIVE_RETENTION = "batch.archiveRetention";
    public static final String COMPARE_LABEL_HEIGHT = "compare.labelHeight";
    public static final String EXPORT_DEFAULT_QUALITY = "export.defaultQuality";
    public static final String EXPORT_PDF_PAGE_SIZE = "export.pdf.pageSize";
    public static final String EXPORT_PDF_MARGIN = "export.pdf.margin";
    public static final String EXPORT_PDF_DPI = "export.pdf.dpi";

    /**
     * Page geometry for PDF export.
     */
    public enum PageSize {
        /** Page matches the image size at the configured DPI. */
        IMAGE,
        A4,
        LETTER
    }

    private final int batchMaxItems;
    private final int batchParallelism;
    private final int batchArchiveRetention;
    private final int compareLabelHeight;
    private final int exportDefaultQuality;
    private final PageSize pdfPageSize;
    private final float pdfMargin;
    private final float pdfDpi;

    private ImageLabSettings(Properties props) {
        this.batchMaxItems = positiveInt(props, BATCH_MAX_ITEMS, 10);
        this.batchParallelism = positiveInt(props, BATCH_PARALLELISM, 1);
        this.batchArchiveRetention = positiveInt(props, BATCH_ARCHIVE_RETENTION, 16);
        this.compareLabelHeight = positiveInt(props, COMPARE_LABEL_HEIGHT, 30);
        this.exportDefaultQuality = intInRange(props, EXPORT_DEFAULT_QUALITY, 95, 0, 100);
        this.pdfPageSize = pageSize(props, EXPORT_PDF_PAGE_SIZE, PageSize.IMAGE);
        this.pdfMargin = nonNegativeFloat(props, EXPORT_PDF_MARGIN, 0f);
        this.pdfDpi = positiveFloat(props, EXPORT_PDF_DPI, 100f);
    }

    /**
     * Load the classpath defaults, then apply system property overrides.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static ImageLabSettings load() {
        Properties props = new Properties();
        try (InputStream in = ImageLabSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.debug("No {} on classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        for (String key : new String[]{BATCH_MAX_ITEMS, BATCH_PARALLELISM, BATCH_ARCHIVE_RETENTION,
                COMPARE_LABEL_HEIGHT, EXPORT_DEFAULT_QUALITY, EXPORT_PDF_PAGE_SIZE, EXPORT_PDF_MARGIN,
                EXPORT_PDF_DPI}) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return new ImageLabSettings(props);
    }

    /**
     * Settings from explicit properties only; absent keys take built-in defaults.
     */
    public static ImageLabSettings from(Properties props) {
        return new ImageLabSettings(props);
    }

    public static ImageLabSettings defaults() {
        return new ImageLabSettings(new Properties());
    }

    public int getBatchMaxItems() {
        return batchMaxItems;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    public int getBatchArchiveRetention() {
        return batchArchiveRetention;
    }

    public int getCompareLabelHeight() {
        return compareLabelHeight;
    }

    public int getExportDefaultQuality() {
        return exportDefaultQuality;
    }

    public PageSize getPdfPageSize() {
        return pdfPageSize;
    }

    public float getPdfMargin() {
        return pdfMargin;
    }

    public float getPdfDpi() {
        return pdfDpi;
    }

    private static int positiveInt(Properties props, String key, int defaultValue) {
        return intInRange(props, key, defaultValue, 1, Integer.MAX_VALUE);
    }

    private static int intInRange(Properties props, String key, int defaultValue, int min, int max) {
        String raw = props.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    private static float positiveFloat(Properties props, String key, float defaultValue) {
        float value = floatValue(props, key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }

    private static float nonNegativeFloat(Properties props, String key, float defaultValue) {
        float value = floatValue(props, key, defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative, got " + value);
        }
        return value;
    }

    private static float floatValue(Properties props, String key, float defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + raw + "'", e);
        }
    }

    private static PageSize pageSize(Properties props, String key, PageSize defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return PageSize.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " must be one of IMAGE, A4, LETTER; got '" + raw + "'", e);
        }
    }

    @Override
    public String toString() {
        return "ImageLabSettings{maxItems=" + batchMaxItems
                + ", parallelism=" + batchParallelism
                + ", archiveRetention=" + batchArchiveRetention
                + ", labelHeight=" + compareLabelHeight
                + ", quality=" + exportDefaultQuality
                + ", pdf=" + pdfPageSize + "/" + pdfMargin + "pt/" + pdfDpi + "dpi}";
    }
}
