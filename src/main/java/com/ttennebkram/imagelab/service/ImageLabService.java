package com.ttennebkram.imagelab.service;

import com.ttennebkram.imagelab.batch.BatchArchive;
import com.ttennebkram.imagelab.batch.BatchArchiveStore;
import com.ttennebkram.imagelab.batch.BatchInput;
import com.ttennebkram.imagelab.batch.BatchManifest;
import com.ttennebkram.imagelab.batch.BatchOrchestrator;
import com.ttennebkram.imagelab.batch.BatchReport;
import com.ttennebkram.imagelab.batch.InMemoryBatchArchiveStore;
import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.dispatch.Dispatcher;
import com.ttennebkram.imagelab.operations.OperationRegistry;
import com.ttennebkram.imagelab.params.ParameterJson;
import com.ttennebkram.imagelab.raster.OpenCvNatives;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import com.ttennebkram.imagelab.render.ComparisonArtifact;
import com.ttennebkram.imagelab.render.ComparisonRenderer;
import com.ttennebkram.imagelab.render.ExportRenderer;
import com.ttennebkram.imagelab.render.ExportedImage;
import com.ttennebkram.imagelab.report.ProcessingReport;
import com.ttennebkram.imagelab.report.ReportBuilder;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Byte-level entry points over the core, one per request type an outer layer
 * (HTTP handler, CLI) serves. Each call decodes its inputs, runs the core and
 * encodes the result; no state is kept between calls except the archive store.
 */
public class ImageLabService {

    private final Dispatcher dispatcher;
    private final BatchOrchestrator batchOrchestrator;
    private final ComparisonRenderer comparisonRenderer;
    private final ExportRenderer exportRenderer;
    private final ReportBuilder reportBuilder;
    private final BatchArchiveStore archiveStore;

    public ImageLabService(OperationRegistry registry, ImageLabSettings settings,
                           BatchArchiveStore archiveStore, Clock clock) {
        this.dispatcher = new Dispatcher(registry);
        this.archiveStore = archiveStore;
        this.batchOrchestrator = new BatchOrchestrator(dispatcher, settings, archiveStore);
        this.comparisonRenderer = new ComparisonRenderer(dispatcher, settings);
        this.exportRenderer = new ExportRenderer(settings);
        this.reportBuilder = new ReportBuilder(clock);
    }

    public ImageLabService(ImageLabSettings settings) {
        this(OperationRegistry.getDefault(), settings,
                new InMemoryBatchArchiveStore(settings.getBatchArchiveRetention()), Clock.systemDefaultZone());
    }

    /**
     * Service with settings from {@code imagelab.properties} and system properties.
     */
    public static ImageLabService createDefault() {
        OpenCvNatives.ensureLoaded();
        return new ImageLabService(ImageLabSettings.load());
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public OperationRegistry getRegistry() {
        return dispatcher.getRegistry();
    }

    /**
     * Decode an upload and report its dimensions.
     */
    public ImageInfo describe(byte[] image) {
        try (RasterBuffer buffer = RasterCodec.decode(image)) {
            return new ImageInfo(buffer.width(), buffer.height(), buffer.channels());
        }
    }

    /**
     * Apply one operation and return the result as PNG.
     */
    public byte[] apply(byte[] image, String operationId, Map<String, ?> parameters) {
        try (RasterBuffer source = RasterCodec.decode(image);
             RasterBuffer result = dispatcher.dispatch(operationId, parameters, source)) {
            return RasterCodec.encodePng(result);
        }
    }

    public byte[] apply(byte[] image, String operationId, String parametersJson) {
        return apply(image, operationId, ParameterJson.parse(parametersJson));
    }

    public BatchReport batch(String operationId, String parametersJson, List<BatchInput> inputs) {
        return batchOrchestrator.run(operationId, ParameterJson.parse(parametersJson), inputs);
    }

    public String batchManifest(BatchReport report, boolean includeImageData) {
        return BatchManifest.toJsonString(report, includeImageData);
    }

    /**
     * Archive of an earlier batch, if it is still held.
     */
    public Optional<BatchArchive> downloadBatch(String batchId) {
        return archiveStore == null ? Optional.empty() : archiveStore.find(batchId);
    }

    /**
     * Side-by-side comparison of the upload and its transformed version, as PNG.
     */
    public byte[] compare(byte[] image, String operationId, String parametersJson) {
        Map<String, Object> params = ParameterJson.parse(parametersJson);
        try (RasterBuffer source = RasterCodec.decode(image);
             ComparisonArtifact artifact = comparisonRenderer.compare(source, operationId, params)) {
            return RasterCodec.encodePng(artifact.getImage());
        }
    }

    public ExportedImage export(byte[] image, String format, Integer quality) {
        try (RasterBuffer source = RasterCodec.decode(image)) {
            return exportRenderer.export(source, format, quality);
        }
    }

    /**
     * JSON report of the operations requested against an upload.
     */
    public String createReport(String filename, byte[] image, String operationsJson) {
        ImageInfo info = describe(image);
        ProcessingReport report = reportBuilder.build(filename, info.getWidth(), info.getHeight(), operationsJson);
        return ReportBuilder.toJsonString(report);
    }
}
