package com.ttennebkram.imagelab.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.UnsupportedFormatException;
import com.ttennebkram.imagelab.raster.OpenCvNatives;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ExportRendererTest {

    private static ExportRenderer renderer;

    @BeforeAll
    static void setUp() {
        OpenCvNatives.ensureLoaded();
        renderer = new ExportRenderer(ImageLabSettings.defaults());
    }

    @Test
    void testPngRoundTripIsLossless() {
        try (RasterBuffer source = TestImages.pattern(33, 21)) {
            ExportedImage exported = renderer.export(source, "png");

            assertThat(exported.getMediaType()).isEqualTo("image/png");
            assertThat(exported.getFileName()).isEqualTo("exported_image.png");
            try (RasterBuffer decoded = RasterCodec.decode(exported.getContent())) {
                assertThat(decoded.sameSamples(source)).isTrue();
            }
        }
    }

    @Test
    void testPngKeepsAlpha() {
        try (RasterBuffer source = TestImages.withAlpha(10, 10);
             RasterBuffer decoded = RasterCodec.decode(renderer.export(source, "png").getContent())) {

            assertThat(decoded.channels()).isEqualTo(4);
        }
    }

    @Test
    void testJpegDropsAlpha() {
        try (RasterBuffer source = TestImages.withAlpha(16, 16)) {
            ExportedImage exported = renderer.export(source, ".JPG", 80);

            assertThat(exported.getMediaType()).isEqualTo("image/jpeg");
            assertThat(exported.getFileName()).isEqualTo("exported_image.jpg");
            try (RasterBuffer decoded = RasterCodec.decode(exported.getContent())) {
                assertThat(decoded.channels()).isEqualTo(3);
                assertThat(decoded.width()).isEqualTo(16);
            }
        }
    }

    @Test
    void testQualityAffectsLossyOutput() {
        try (RasterBuffer source = TestImages.pattern(128, 128)) {
            byte[] low = renderer.export(source, "jpg", 5).getContent();
            byte[] high = renderer.export(source, "jpg", 100).getContent();

            assertThat(low.length).isLessThan(high.length);
        }
    }

    @Test
    void testQualityOutOfRange() {
        try (RasterBuffer source = TestImages.pattern(8, 8)) {
            assertThatThrownBy(() -> renderer.export(source, "jpg", 101))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("quality");
            assertThatThrownBy(() -> renderer.export(source, "jpg", -1))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }

    @Test
    void testUnsupportedFormat() {
        try (RasterBuffer source = TestImages.pattern(8, 8)) {
            assertThatThrownBy(() -> renderer.export(source, "xyz"))
                    .isInstanceOf(UnsupportedFormatException.class)
                    .hasMessageContaining("xyz");
            assertThatThrownBy(() -> renderer.export(source, "../png"))
                    .isInstanceOf(UnsupportedFormatException.class);
            assertThatThrownBy(() -> renderer.export(source, ""))
                    .isInstanceOf(UnsupportedFormatException.class);
        }
    }

    @Test
    void testDisabledCodecIsUnsupported() {
        // OpenEXR ships compiled in but switched off
        for (RasterBuffer source : new RasterBuffer[] {
                TestImages.gray(8, 8, 40), TestImages.pattern(8, 8), TestImages.withAlpha(8, 8)}) {
            try (RasterBuffer buffer = source) {
                assertThatThrownBy(() -> renderer.export(buffer, "exr", 80))
                        .isInstanceOf(UnsupportedFormatException.class)
                        .hasMessageContaining("exr");
            }
        }
    }

    @Test
    void testGraymapTakesColorInput() {
        try (RasterBuffer color = TestImages.solid(12, 9, 30, 60, 90);
             RasterBuffer withAlpha = TestImages.withAlpha(12, 9)) {
            for (String format : new String[] {"pgm", "pbm"}) {
                for (RasterBuffer source : new RasterBuffer[] {color, withAlpha}) {
                    ExportedImage exported = renderer.export(source, format);

                    try (RasterBuffer decoded = RasterCodec.decode(exported.getContent())) {
                        assertThat(decoded.channels()).isEqualTo(1);
                        assertThat(decoded.width()).isEqualTo(12);
                        assertThat(decoded.height()).isEqualTo(9);
                    }
                }
            }
        }
    }

    @Test
    void testPixmapTakesGrayInput() {
        try (RasterBuffer source = TestImages.gray(10, 6, 77)) {
            ExportedImage exported = renderer.export(source, "ppm");

            assertThat(exported.getMediaType()).isEqualTo("image/x-portable-pixmap");
            try (RasterBuffer decoded = RasterCodec.decode(exported.getContent());
                 RasterBuffer expected = TestImages.solid(10, 6, 77, 77, 77)) {
                assertThat(decoded.sameSamples(expected)).isTrue();
            }
        }
    }

    @Test
    void testPdfHasOnePageSizedToImage() throws IOException {
        try (RasterBuffer source = TestImages.pattern(200, 100)) {
            ExportedImage exported = renderer.export(source, "pdf");

            byte[] content = exported.getContent();
            assertThat(exported.getMediaType()).isEqualTo("application/pdf");
            assertThat(new String(Arrays.copyOf(content, 4), StandardCharsets.US_ASCII)).isEqualTo("%PDF");
            try (PDDocument document = PDDocument.load(content)) {
                assertThat(document.getNumberOfPages()).isEqualTo(1);
                PDRectangle box = document.getPage(0).getMediaBox();
                // 200 x 100 pixels at 100 dpi
                assertThat(box.getWidth()).isEqualTo(144f);
                assertThat(box.getHeight()).isEqualTo(72f);
            }
        }
    }

    @Test
    void testPdfOnFixedPage() throws IOException {
        Properties props = new Properties();
        props.setProperty(ImageLabSettings.EXPORT_PDF_PAGE_SIZE, "a4");
        props.setProperty(ImageLabSettings.EXPORT_PDF_MARGIN, "36");
        ExportRenderer a4 = new ExportRenderer(ImageLabSettings.from(props));

        try (RasterBuffer source = TestImages.gray(50, 80, 200);
             PDDocument document = PDDocument.load(a4.export(source, "pdf").getContent())) {

            PDPage page = document.getPage(0);
            assertThat(page.getMediaBox().getWidth()).isEqualTo(PDRectangle.A4.getWidth());
            assertThat(page.getMediaBox().getHeight()).isEqualTo(PDRectangle.A4.getHeight());
        }
    }

    @Test
    void testFormatParsing() {
        assertThat(ExportFormat.parse("PDF")).isSameAs(ExportFormat.PDF);
        assertThat(ExportFormat.parse("jpeg").isLossy()).isTrue();
        assertThat(ExportFormat.parse("png").isAlphaSupported()).isTrue();
        assertThat(ExportFormat.parse("tiff").getMediaType()).isEqualTo("image/tiff");
        assertThat(ExportFormat.parse("bmp").getExtension()).isEqualTo("bmp");
        assertThat(ExportFormat.parse("pgm").getRequiredChannels()).isEqualTo(1);
        assertThat(ExportFormat.parse("ppm").getRequiredChannels()).isEqualTo(3);
        assertThat(ExportFormat.parse("png").getRequiredChannels()).isEqualTo(ExportFormat.ANY_CHANNELS);
    }
}
