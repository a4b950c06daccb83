package com.ttennebkram.imagelab.batch;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Base64;

/**
 * JSON manifest of a batch report, as returned to batch callers.
 *
 * <pre>
 * { "success": true, "batch_id": "...", "operation": "blur",
 *   "processed_count": 2, "failed_count": 1,
 *   "results": [ { "filename": "processed_1_a.png", "original_filename": "a.jpg",
 *                  "status": "success", "image_data": "&lt;base64 png&gt;" },
 *                { "original_filename": "b.jpg", "status": "failed",
 *                  "error": "...", "error_kind": "UNREADABLE_IMAGE" } ],
 *   "download_available": true }
 * </pre>
 */
public final class BatchManifest {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private BatchManifest() {
    }

    public static JsonObject toJson(BatchReport report, boolean includeImageData) {
        JsonObject root = new JsonObject();
        root.addProperty("success", true);
        report.getBatchId().ifPresent(id -> root.addProperty("batch_id", id));
        root.addProperty("operation", report.getOperationId());
        root.addProperty("processed_count", report.getSuccessCount());
        root.addProperty("failed_count", report.getFailureCount());

        JsonArray results = new JsonArray();
        for (BatchItemResult item : report.getItems()) {
            JsonObject json = new JsonObject();
            json.addProperty("index", item.getIndex());
            json.addProperty("original_filename", item.getSourceName());
            if (item.isSuccess()) {
                json.addProperty("filename", item.getOutputName());
                json.addProperty("status", "success");
                if (includeImageData) {
                    json.addProperty("image_data", Base64.getEncoder().encodeToString(item.getEncoded()));
                }
            } else {
                json.addProperty("status", "failed");
                json.addProperty("error", item.getErrorMessage());
                json.addProperty("error_kind", item.getErrorKind().name());
            }
            results.add(json);
        }
        root.add("results", results);
        root.addProperty("download_available",
                report.getBatchId().isPresent() && report.getArchive().getEntryCount() > 0);
        return root;
    }

    public static String toJsonString(BatchReport report, boolean includeImageData) {
        return GSON.toJson(toJson(report, includeImageData));
    }
}
