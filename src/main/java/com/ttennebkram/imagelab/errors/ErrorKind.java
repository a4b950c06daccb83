package com.ttennebkram.imagelab.errors;

/**
 * Failure categories surfaced by the image lab core.
 * Each kind maps to the HTTP-style status an outer layer should report.
 */
public enum ErrorKind {

    UNKNOWN_OPERATION(400),
    INVALID_PARAMETER(400),
    UNREADABLE_IMAGE(400),
    BATCH_TOO_LARGE(400),
    UNSUPPORTED_FORMAT(400),
    TRANSFORM_FAILED(500);

    private final int statusCode;

    ErrorKind(int statusCode) {
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * True for failures caused by the request itself (4xx).
     */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
