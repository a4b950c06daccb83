package com.ttennebkram.imagelab.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.imagelab.dispatch.OperationDescriptor;
import com.ttennebkram.imagelab.errors.InvalidParameterException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds {@link ProcessingReport}s. Purely descriptive: operations are recorded
 * verbatim and never looked up in the registry.
 *
 * Operations given as JSON text must form a JSON array. Parseable JSON of any
 * other shape, such as a single object, is rejected with the same
 * "Invalid operations format" error as unparseable text, so a report always
 * carries a list of operations.
 */
public class ReportBuilder {

    public static final String DEFAULT_FILENAME = "Uploaded Image";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    private final Clock clock;

    public ReportBuilder(Clock clock) {
        this.clock = clock;
    }

    public ReportBuilder() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param operations the requested operations, recorded as-is
     */
    public ProcessingReport build(String sourceName, int width, int height, JsonArray operations) {
        String name = sourceName == null || sourceName.trim().isEmpty() ? DEFAULT_FILENAME : sourceName;
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return new ProcessingReport(timestamp, name, width, height,
                operations == null ? new JsonArray() : operations);
    }

    /**
     * Report from a JSON-encoded operation list.
     *
     * @throws InvalidParameterException if the text is not a JSON array
     */
    public ProcessingReport build(String sourceName, int width, int height, String operationsJson) {
        JsonElement parsed;
        try {
            parsed = operationsJson == null ? null : JsonParser.parseString(operationsJson);
        } catch (JsonParseException e) {
            throw new InvalidParameterException("operations", "Invalid operations format", e);
        }
        if (parsed == null || !parsed.isJsonArray()) {
            throw new InvalidParameterException("operations", "Invalid operations format");
        }
        return build(sourceName, width, height, parsed.getAsJsonArray());
    }

    /**
     * Report from descriptors, each recorded as {@code {"operation": id, "params": {...}}}.
     */
    public ProcessingReport build(String sourceName, int width, int height, List<OperationDescriptor> descriptors) {
        JsonArray operations = new JsonArray();
        for (OperationDescriptor descriptor : descriptors) {
            JsonObject entry = new JsonObject();
            entry.addProperty("operation", descriptor.getOperationId());
            entry.add("params", GSON.toJsonTree(descriptor.getParameters()));
            operations.add(entry);
        }
        return build(sourceName, width, height, operations);
    }

    public static String toJsonString(ProcessingReport report) {
        return GSON.toJson(report.toJson());
    }
}
