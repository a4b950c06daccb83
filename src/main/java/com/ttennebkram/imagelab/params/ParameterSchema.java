package com.ttennebkram.imagelab.params;

import com.ttennebkram.imagelab.errors.InvalidParameterException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The full set of parameters an operation recognizes.
 * Validation rejects keys outside the schema, coerces values to the declared
 * types and fills in defaults.
 */
public final class ParameterSchema {

    private static final ParameterSchema EMPTY = new ParameterSchema(Collections.emptyMap());

    private final Map<String, ParameterSpec> specs;

    private ParameterSchema(Map<String, ParameterSpec> specs) {
        this.specs = specs;
    }

    public static ParameterSchema empty() {
        return EMPTY;
    }

    public static ParameterSchema of(ParameterSpec... specs) {
        Map<String, ParameterSpec> map = new LinkedHashMap<>();
        for (ParameterSpec spec : specs) {
            if (map.put(spec.getName(), spec) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + spec.getName());
            }
        }
        return new ParameterSchema(Collections.unmodifiableMap(map));
    }

    public Collection<ParameterSpec> getSpecs() {
        return specs.values();
    }

    public boolean recognizes(String name) {
        return specs.containsKey(name);
    }

    /**
     * Validate a raw parameter map.
     *
     * @param raw parameter values as supplied by the caller; may be null
     * @return typed parameters with defaults applied
     * @throws InvalidParameterException on the first unknown key or bad value
     */
    public OperationParameters validate(Map<String, ?> raw) {
        Map<String, ?> input = raw == null ? Collections.emptyMap() : raw;

        for (String key : input.keySet()) {
            if (!specs.containsKey(key)) {
                throw new InvalidParameterException(key, specs.isEmpty()
                        ? "Parameter '" + key + "' is not accepted; this operation takes no parameters"
                        : "Unknown parameter '" + key + "'; expected one of " + specs.keySet());
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (ParameterSpec spec : specs.values()) {
            Object value = spec.resolve(input.get(spec.getName()));
            if (value != null) {
                values.put(spec.getName(), value);
            }
        }
        return new OperationParameters(values);
    }
}
