package com.ttennebkram.imagelab.errors;

/**
 * Wraps a failure raised while a transform or encoder was running.
 * The original cause is always attached for diagnostics.
 */
public class TransformFailedException extends ImageLabException {

    public TransformFailedException(String message, Throwable cause) {
        super(ErrorKind.TRANSFORM_FAILED, message, cause);
    }

    public TransformFailedException(String message) {
        super(ErrorKind.TRANSFORM_FAILED, message);
    }
}
