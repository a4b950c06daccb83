package com.ttennebkram.imagelab.dispatch;

import com.ttennebkram.imagelab.params.ParameterJson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One requested transform: an operation identifier plus its raw parameters.
 * Parameters are validated only when the descriptor is dispatched.
 */
public final class OperationDescriptor {

    private final String operationId;
    private final Map<String, Object> parameters;

    public OperationDescriptor(String operationId, Map<String, ?> parameters) {
        this.operationId = Objects.requireNonNull(operationId, "operationId");
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static OperationDescriptor of(String operationId) {
        return new OperationDescriptor(operationId, Collections.emptyMap());
    }

    /**
     * Build a descriptor from a JSON-encoded parameter object.
     *
     * @throws com.ttennebkram.imagelab.errors.InvalidParameterException on malformed JSON
     */
    public static OperationDescriptor fromJson(String operationId, String parametersJson) {
        return new OperationDescriptor(operationId, ParameterJson.parse(parametersJson));
    }

    public String getOperationId() {
        return operationId;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperationDescriptor)) return false;
        OperationDescriptor that = (OperationDescriptor) o;
        return operationId.equals(that.operationId) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operationId, parameters);
    }

    @Override
    public String toString() {
        return operationId + parameters;
    }
}
