package com.ttennebkram.imagelab.errors;

/**
 * Base class for every failure raised by the operation registry, dispatcher,
 * batch orchestrator and renderers.
 */
public abstract class ImageLabException extends RuntimeException {

    private final ErrorKind kind;

    protected ImageLabException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ImageLabException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return kind.getStatusCode();
    }
}
