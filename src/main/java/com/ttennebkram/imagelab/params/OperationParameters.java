package com.ttennebkram.imagelab.params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated, typed parameter values for one operation invocation.
 * Only produced by {@link ParameterSchema#validate(Map)}, so every value has
 * already been coerced to its declared type.
 */
public final class OperationParameters {

    private final Map<String, Object> values;

    OperationParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public int getInt(String key) {
        return ((Number) require(key)).intValue();
    }

    public double getDouble(String key) {
        return ((Number) require(key)).doubleValue();
    }

    public boolean getBoolean(String key) {
        return (Boolean) require(key);
    }

    public String getString(String key) {
        return (String) require(key);
    }

    /**
     * String value, or {@code defaultValue} for optional parameters left unset.
     */
    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value instanceof String ? (String) value : defaultValue;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String key) {
        Object value = values.get(key);
        if (value == null) {
            // Schemas give every read parameter a default; reaching here is a wiring bug
            throw new IllegalStateException("No value for parameter '" + key + "'");
        }
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
