package com.ttennebkram.imagelab.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.batch.BatchArchive;
import com.ttennebkram.imagelab.batch.BatchInput;
import com.ttennebkram.imagelab.batch.BatchReport;
import com.ttennebkram.imagelab.batch.InMemoryBatchArchiveStore;
import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.errors.BatchTooLargeException;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.UnreadableImageException;
import com.ttennebkram.imagelab.operations.OperationRegistry;
import com.ttennebkram.imagelab.raster.OpenCvNatives;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import com.ttennebkram.imagelab.render.ExportedImage;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ImageLabServiceTest {

    private static ImageLabService service;
    private static byte[] upload;

    @BeforeAll
    static void setUp() {
        OpenCvNatives.ensureLoaded();
        ImageLabSettings settings = ImageLabSettings.defaults();
        service = new ImageLabService(OperationRegistry.getDefault(), settings,
                new InMemoryBatchArchiveStore(settings.getBatchArchiveRetention()),
                Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneOffset.UTC));
        upload = TestImages.pngPattern(64, 48);
    }

    @Test
    void testDescribe() {
        ImageInfo info = service.describe(upload);

        assertThat(info.getWidth()).isEqualTo(64);
        assertThat(info.getHeight()).isEqualTo(48);
        assertThat(info.getChannels()).isEqualTo(3);
        assertThat(info).hasToString("64 x 48 (3 channels)");
    }

    @Test
    void testApplyReturnsPng() {
        byte[] png = service.apply(upload, "resize", "{\"width\": 32, \"height\": 16}");

        try (RasterBuffer decoded = RasterCodec.decode(png)) {
            assertThat(decoded.width()).isEqualTo(32);
            assertThat(decoded.height()).isEqualTo(16);
        }
    }

    @Test
    void testApplyRejectsGarbage() {
        assertThatThrownBy(() -> service.apply("junk".getBytes(StandardCharsets.UTF_8), "grayscale", (String) null))
                .isInstanceOf(UnreadableImageException.class);
    }

    @Test
    void testBatchAndDownload() {
        List<BatchInput> inputs = new ArrayList<>();
        inputs.add(BatchInput.encoded("one.png", upload));
        inputs.add(BatchInput.encoded("two.png", upload));

        BatchReport report = service.batch("sharpen", "", inputs);

        assertThat(report.getSuccessCount()).isEqualTo(2);
        Optional<BatchArchive> archive = service.downloadBatch(report.getBatchId().orElseThrow(AssertionError::new));
        assertThat(archive).isPresent();
        assertThat(archive.get().getEntryNames()).containsExactly("processed_1_one.png", "processed_2_two.png");
        assertThat(service.downloadBatch("unknown")).isEmpty();

        JsonObject manifest = JsonParser.parseString(service.batchManifest(report, false)).getAsJsonObject();
        assertThat(manifest.get("processed_count").getAsInt()).isEqualTo(2);
    }

    @Test
    void testBatchCeiling() {
        List<BatchInput> inputs = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            inputs.add(BatchInput.encoded("img" + i + ".png", upload));
        }

        assertThatThrownBy(() -> service.batch("grayscale", null, inputs))
                .isInstanceOf(BatchTooLargeException.class)
                .hasMessage("Maximum 10 images allowed per batch, got 11");
    }

    @Test
    void testCompare() {
        try (RasterBuffer composite = RasterCodec.decode(service.compare(upload, "grayscale", null))) {
            assertThat(composite.width()).isEqualTo(128);
            assertThat(composite.height()).isEqualTo(78);
        }
    }

    @Test
    void testCompareRejectsBadParameterJson() {
        assertThatThrownBy(() -> service.compare(upload, "blur", "not json"))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void testExport() {
        ExportedImage exported = service.export(upload, "jpeg", 50);

        assertThat(exported.getMediaType()).isEqualTo("image/jpeg");
        try (RasterBuffer decoded = RasterCodec.decode(exported.getContent())) {
            assertThat(decoded.width()).isEqualTo(64);
        }
    }

    @Test
    void testCreateReport() {
        String json = service.createReport("scan.png", upload, "[{\"operation\": \"blur\"}]");

        JsonObject report = JsonParser.parseString(json).getAsJsonObject();
        assertThat(report.get("timestamp").getAsString()).isEqualTo("2025-01-02 03:04:05");
        assertThat(report.get("original_filename").getAsString()).isEqualTo("scan.png");
        assertThat(report.get("original_dimensions").getAsString()).isEqualTo("64 x 48");
        assertThat(report.get("operations_applied").getAsInt()).isEqualTo(1);
    }

    @Test
    void testCreateReportRejectsNonArray() {
        assertThatThrownBy(() -> service.createReport("scan.png", upload, "\"blur\""))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessage("Invalid operations format");
    }
}
