package com.ttennebkram.imagelab.batch;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of one batch call: per-item outcomes in input order, counts, the
 * archive of successful outputs and, when a store was configured, the
 * identifier the archive can be retrieved under.
 */
public final class BatchReport {

    private final String operationId;
    private final List<BatchItemResult> items;
    private final BatchArchive archive;
    private final String batchId;
    private final int successCount;

    BatchReport(String operationId, List<BatchItemResult> items, BatchArchive archive, String batchId) {
        this.operationId = operationId;
        this.items = Collections.unmodifiableList(items);
        this.archive = archive;
        this.batchId = batchId;
        int successes = 0;
        for (BatchItemResult item : items) {
            if (item.isSuccess()) successes++;
        }
        this.successCount = successes;
    }

    public String getOperationId() {
        return operationId;
    }

    public List<BatchItemResult> getItems() {
        return items;
    }

    public int getTotalProcessed() {
        return items.size();
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return items.size() - successCount;
    }

    public BatchArchive getArchive() {
        return archive;
    }

    public Optional<String> getBatchId() {
        return Optional.ofNullable(batchId);
    }

    @Override
    public String toString() {
        return "BatchReport{" + operationId + ", " + successCount + "/" + items.size() + " succeeded"
                + (batchId != null ? ", id=" + batchId : "") + "}";
    }
}
