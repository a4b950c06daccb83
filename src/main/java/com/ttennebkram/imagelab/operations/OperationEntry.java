package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.params.OperationParameters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resolved registry entry: the identifier a caller used, the operation it
 * maps to, and any parameters an alias fixes.
 */
public final class OperationEntry {

    private final String id;
    private final ImageOperation operation;
    private final Map<String, Object> preset;

    OperationEntry(String id, ImageOperation operation, Map<String, Object> preset) {
        this.id = id;
        this.operation = operation;
        this.preset = Collections.unmodifiableMap(new LinkedHashMap<>(preset));
    }

    /**
     * The identifier this entry is registered under (an operation id or an alias).
     */
    public String getId() {
        return id;
    }

    public ImageOperation getOperation() {
        return operation;
    }

    public boolean isAlias() {
        return !id.equals(operation.getOperationId());
    }

    public Map<String, Object> getPreset() {
        return preset;
    }

    /**
     * Merge caller parameters with the alias preset and validate them against
     * the operation's schema and cross-parameter rules.
     *
     * @throws InvalidParameterException if a value is invalid or overrides a preset
     */
    public OperationParameters resolveParameters(Map<String, ?> raw) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<String, ?> e : raw.entrySet()) {
                if (preset.containsKey(e.getKey())) {
                    throw new InvalidParameterException(e.getKey(),
                            "Parameter '" + e.getKey() + "' is fixed by '" + id + "'");
                }
                merged.put(e.getKey(), e.getValue());
            }
        }
        merged.putAll(preset);

        OperationParameters params = operation.getParameterSchema().validate(merged);
        operation.validate(params);
        return params;
    }

    @Override
    public String toString() {
        return isAlias() ? id + " -> " + operation.getOperationId() + preset : id;
    }
}
