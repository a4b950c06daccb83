package com.ttennebkram.imagelab.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Descriptive metadata about the operations requested against one source image.
 * It documents intent only; the listed operations are not checked or executed.
 */
public final class ProcessingReport {

    private final String timestamp;
    private final String originalFilename;
    private final int originalWidth;
    private final int originalHeight;
    private final JsonArray operations;

    ProcessingReport(String timestamp, String originalFilename, int originalWidth, int originalHeight,
                     JsonArray operations) {
        this.timestamp = timestamp;
        this.originalFilename = originalFilename;
        this.originalWidth = originalWidth;
        this.originalHeight = originalHeight;
        this.operations = operations.deepCopy();
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public int getOriginalWidth() {
        return originalWidth;
    }

    public int getOriginalHeight() {
        return originalHeight;
    }

    /**
     * Dimensions as "W x H".
     */
    public String getOriginalDimensions() {
        return originalWidth + " x " + originalHeight;
    }

    public int getOperationsApplied() {
        return operations.size();
    }

    /**
     * The operation list exactly as supplied.
     */
    public JsonArray getOperations() {
        return operations.deepCopy();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("timestamp", timestamp);
        json.addProperty("original_filename", originalFilename);
        json.addProperty("original_dimensions", getOriginalDimensions());
        json.addProperty("operations_applied", getOperationsApplied());
        json.add("operations", operations.deepCopy());
        return json;
    }
}
