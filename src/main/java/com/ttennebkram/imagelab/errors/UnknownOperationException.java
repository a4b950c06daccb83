package com.ttennebkram.imagelab.errors;

/**
 * Thrown when an operation identifier is not present in the registry.
 */
public class UnknownOperationException extends ImageLabException {

    private final String operationId;

    public UnknownOperationException(String operationId) {
        super(ErrorKind.UNKNOWN_OPERATION, "Unknown operation: " + operationId);
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
