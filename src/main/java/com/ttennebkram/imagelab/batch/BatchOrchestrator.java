package com.ttennebkram.imagelab.batch;

import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.dispatch.Dispatcher;
import com.ttennebkram.imagelab.dispatch.OperationDescriptor;
import com.ttennebkram.imagelab.dispatch.PreparedOperation;
import com.ttennebkram.imagelab.errors.BatchTooLargeException;
import com.ttennebkram.imagelab.errors.ErrorKind;
import com.ttennebkram.imagelab.errors.ImageLabException;
import com.ttennebkram.imagelab.errors.TransformFailedException;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies one operation to an ordered set of images.
 *
 * The batch always completes: a decode or transform failure of one item is
 * recorded as that item's outcome and the remaining items still run. The
 * report lists outcomes in input order, and its archive holds only the
 * successful outputs, encoded as PNG.
 *
 * Request-level problems (too many items, unknown operation, invalid
 * parameters) fail the whole call before any item is touched.
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final Dispatcher dispatcher;
    private final int maxItems;
    private final int parallelism;
    private final BatchArchiveStore archiveStore;

    /**
     * @param archiveStore where archives are kept for later retrieval, or null
     *                     to return them only in the report
     */
    public BatchOrchestrator(Dispatcher dispatcher, ImageLabSettings settings, BatchArchiveStore archiveStore) {
        this.dispatcher = dispatcher;
        this.maxItems = settings.getBatchMaxItems();
        this.parallelism = settings.getBatchParallelism();
        this.archiveStore = archiveStore;
    }

    public BatchOrchestrator(Dispatcher dispatcher, ImageLabSettings settings) {
        this(dispatcher, settings, null);
    }

    public int getMaxItems() {
        return maxItems;
    }

    public BatchReport run(OperationDescriptor descriptor, List<BatchInput> inputs) {
        return run(descriptor.getOperationId(), descriptor.getParameters(), inputs);
    }

    /**
     * Run the batch.
     *
     * @throws BatchTooLargeException if there are more than {@code maxItems} inputs
     * @throws com.ttennebkram.imagelab.errors.UnknownOperationException if the id is not registered
     * @throws com.ttennebkram.imagelab.errors.InvalidParameterException if the parameters are invalid
     */
    public BatchReport run(String operationId, Map<String, ?> parameters, List<BatchInput> inputs) {
        if (inputs.size() > maxItems) {
            throw new BatchTooLargeException(inputs.size(), maxItems);
        }
        PreparedOperation prepared = dispatcher.prepare(operationId, parameters);

        List<BatchItemResult> items = parallelism > 1 && inputs.size() > 1
                ? runConcurrently(prepared, inputs)
                : runSequentially(prepared, inputs);

        BatchArchive archive = BatchArchive.of(items);
        String batchId = archiveStore != null ? archiveStore.store(archive) : null;
        BatchReport report = new BatchReport(prepared.getOperationId(), items, archive, batchId);
        log.info("Batch {} finished: {} of {} items succeeded{}", prepared.getOperationId(),
                report.getSuccessCount(), report.getTotalProcessed(),
                batchId != null ? ", archive " + batchId : "");
        return report;
    }

    private List<BatchItemResult> runSequentially(PreparedOperation prepared, List<BatchInput> inputs) {
        List<BatchItemResult> items = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            items.add(processItem(prepared, i, inputs.get(i)));
        }
        return items;
    }

    private List<BatchItemResult> runConcurrently(PreparedOperation prepared, List<BatchInput> inputs) {
        int threads = Math.min(parallelism, inputs.size());
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "batch-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<BatchItemResult>> futures = new ArrayList<>(inputs.size());
            for (int i = 0; i < inputs.size(); i++) {
                final int index = i;
                futures.add(pool.submit(() -> processItem(prepared, index, inputs.get(index))));
            }
            // Collect in submission order so outcomes stay in input order
            List<BatchItemResult> items = new ArrayList<>(inputs.size());
            for (Future<BatchItemResult> future : futures) {
                items.add(future.get());
            }
            return items;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransformFailedException("Batch interrupted", e);
        } catch (ExecutionException e) {
            // processItem records every RuntimeException, so only Errors get here
            throw new TransformFailedException("Batch worker failed: " + e.getCause(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private BatchItemResult processItem(PreparedOperation prepared, int index, BatchInput input) {
        String sourceName = input.getName();
        try (RasterBuffer source = input.open();
             RasterBuffer output = dispatcher.dispatch(prepared, source)) {
            byte[] png = RasterCodec.encodePng(output);
            return BatchItemResult.success(index, sourceName, outputName(index + 1, sourceName), png);
        } catch (ImageLabException e) {
            log.warn("Batch item #{} ({}) failed: {}", index + 1, sourceName, e.getMessage());
            return BatchItemResult.failure(index, sourceName, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Batch item #{} ({}) failed unexpectedly", index + 1, sourceName, e);
            return BatchItemResult.failure(index, sourceName, ErrorKind.TRANSFORM_FAILED, e.toString());
        }
    }

    /**
     * Archive entry name: {@code processed_<position>_<stem>.png}, where the stem
     * is the source file name without directories or extension.
     */
    static String outputName(int position, String sourceName) {
        String stem = sourceName == null ? "" : sourceName.trim();
        int slash = Math.max(stem.lastIndexOf('/'), stem.lastIndexOf('\\'));
        if (slash >= 0) {
            stem = stem.substring(slash + 1);
        }
        int dot = stem.lastIndexOf('.');
        if (dot > 0) {
            stem = stem.substring(0, dot);
        }
        return stem.isEmpty()
                ? "processed_" + position + "." + RasterCodec.PNG
                : "processed_" + position + "_" + stem + "." + RasterCodec.PNG;
    }
}
