package com.ttennebkram.imagelab.errors;

/**
 * Thrown when a parameter is missing, has the wrong type or is out of range,
 * and when an input buffer does not satisfy the raster invariants.
 */
public class InvalidParameterException extends ImageLabException {

    private final String parameterName;

    public InvalidParameterException(String parameterName, String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
        this.parameterName = parameterName;
    }

    public InvalidParameterException(String parameterName, String message, Throwable cause) {
        super(ErrorKind.INVALID_PARAMETER, message, cause);
        this.parameterName = parameterName;
    }

    /**
     * Name of the offending parameter, or null when the failure is not tied to one.
     */
    public String getParameterName() {
        return parameterName;
    }
}
