package com.ttennebkram.imagelab.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ImageLabSettingsTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(ImageLabSettings.BATCH_MAX_ITEMS);
    }

    @Test
    void testDefaults() {
        ImageLabSettings settings = ImageLabSettings.defaults();

        assertThat(settings.getBatchMaxItems()).isEqualTo(10);
        assertThat(settings.getBatchParallelism()).isEqualTo(1);
        assertThat(settings.getBatchArchiveRetention()).isEqualTo(16);
        assertThat(settings.getCompareLabelHeight()).isEqualTo(30);
        assertThat(settings.getExportDefaultQuality()).isEqualTo(95);
        assertThat(settings.getPdfPageSize()).isEqualTo(ImageLabSettings.PageSize.IMAGE);
        assertThat(settings.getPdfMargin()).isZero();
        assertThat(settings.getPdfDpi()).isEqualTo(100f);
    }

    @Test
    void testClasspathResourceMatchesDefaults() {
        ImageLabSettings loaded = ImageLabSettings.load();

        assertThat(loaded.getBatchMaxItems()).isEqualTo(10);
        assertThat(loaded.getCompareLabelHeight()).isEqualTo(30);
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(ImageLabSettings.BATCH_MAX_ITEMS, "25");

        assertThat(ImageLabSettings.load().getBatchMaxItems()).isEqualTo(25);
    }

    @Test
    void testExplicitProperties() {
        Properties props = new Properties();
        props.setProperty(ImageLabSettings.BATCH_PARALLELISM, " 4 ");
        props.setProperty(ImageLabSettings.EXPORT_PDF_PAGE_SIZE, "letter");

        ImageLabSettings settings = ImageLabSettings.from(props);

        assertThat(settings.getBatchParallelism()).isEqualTo(4);
        assertThat(settings.getPdfPageSize()).isEqualTo(ImageLabSettings.PageSize.LETTER);
    }

    @Test
    void testInvalidValues() {
        assertThatThrownBy(() -> ImageLabSettings.from(props(ImageLabSettings.BATCH_MAX_ITEMS, "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ImageLabSettings.BATCH_MAX_ITEMS);
        assertThatThrownBy(() -> ImageLabSettings.from(props(ImageLabSettings.EXPORT_DEFAULT_QUALITY, "150")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ImageLabSettings.from(props(ImageLabSettings.EXPORT_PDF_PAGE_SIZE, "A3")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ImageLabSettings.from(props(ImageLabSettings.EXPORT_PDF_DPI, "abc")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ImageLabSettings.from(props(ImageLabSettings.EXPORT_PDF_MARGIN, "-1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Properties props(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return props;
    }
}
