package com.ttennebkram.imagelab;

import static org.assertj.core.api.Assertions.assertThat;

import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.raster.OpenCvNatives;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import com.ttennebkram.imagelab.service.ImageLabService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageLabCliTest {

    private static ImageLabService service;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ImageLabCli cli;
    private Path input;

    @BeforeAll
    static void loadNatives() {
        OpenCvNatives.ensureLoaded();
        service = new ImageLabService(ImageLabSettings.defaults());
    }

    @BeforeEach
    void setUp() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new ImageLabCli(service,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        input = tempDir.resolve("input.png");
        Files.write(input, TestImages.pngPattern(40, 30));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testNoArgumentsIsUsageError() {
        assertThat(cli.run(new String[0])).isEqualTo(ImageLabCli.EXIT_USAGE);
        assertThat(stderr()).contains("Usage: imagelab");
    }

    @Test
    void testHelp() {
        assertThat(cli.run(new String[] {"--help"})).isEqualTo(ImageLabCli.EXIT_OK);
        assertThat(stdout()).contains("Commands:");
    }

    @Test
    void testList() {
        assertThat(cli.run(new String[] {"list"})).isEqualTo(ImageLabCli.EXIT_OK);
        assertThat(stdout()).contains("grayscale", "morph_edge", "alias canny -> morph_edge");
    }

    @Test
    void testApply() throws IOException {
        Path output = tempDir.resolve("out.png");

        int code = cli.run(new String[] {"apply", "resize", input.toString(), output.toString(),
                "--params", "{\"width\": 10, \"height\": 20}"});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_OK);
        try (RasterBuffer result = RasterCodec.decode(Files.readAllBytes(output))) {
            assertThat(result.width()).isEqualTo(10);
            assertThat(result.height()).isEqualTo(20);
        }
    }

    @Test
    void testUnknownOperationExitCode() {
        int code = cli.run(new String[] {"apply", "foo", input.toString(), tempDir.resolve("x.png").toString()});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_FAILED);
        assertThat(stderr()).contains("UNKNOWN_OPERATION");
    }

    @Test
    void testBatchWritesArchiveAndManifest() throws IOException {
        Path broken = tempDir.resolve("broken.png");
        Files.write(broken, "nope".getBytes(StandardCharsets.UTF_8));
        Path zip = tempDir.resolve("out.zip");
        Path manifest = tempDir.resolve("manifest.json");

        int code = cli.run(new String[] {"batch", "grayscale", zip.toString(), input.toString(), broken.toString(),
                "--manifest", manifest.toString()});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_OK);
        assertThat(Files.size(zip)).isPositive();
        assertThat(new String(Files.readAllBytes(manifest), StandardCharsets.UTF_8))
                .contains("\"failed_count\": 1", "processed_1_input.png");
        assertThat(stdout()).contains("1 of 2 images processed");
        assertThat(stderr()).contains("broken.png");
    }

    @Test
    void testExportUsesOutputExtension() throws IOException {
        Path output = tempDir.resolve("out.pdf");

        assertThat(cli.run(new String[] {"export", input.toString(), output.toString()})).isEqualTo(ImageLabCli.EXIT_OK);
        assertThat(new String(Files.readAllBytes(output), 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
    }

    @Test
    void testExportToDisabledCodecIsReported() {
        Path output = tempDir.resolve("out.exr");

        int code = cli.run(new String[] {"export", input.toString(), output.toString()});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_FAILED);
        assertThat(stderr()).contains("UNSUPPORTED_FORMAT");
        assertThat(output).doesNotExist();
    }

    @Test
    void testReport() {
        int code = cli.run(new String[] {"report", input.toString(), "--operations", "[]", "--name", "photo.png"});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_OK);
        assertThat(stdout()).contains("\"original_filename\": \"photo.png\"", "\"original_dimensions\": \"40 x 30\"");
    }

    @Test
    void testBadQualityIsUsageError() {
        int code = cli.run(new String[] {"export", input.toString(), "x.jpg", "--quality", "high"});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_USAGE);
    }

    @Test
    void testMissingInputFile() {
        int code = cli.run(new String[] {"info", tempDir.resolve("missing.png").toString()});

        assertThat(code).isEqualTo(ImageLabCli.EXIT_IO);
    }
}
