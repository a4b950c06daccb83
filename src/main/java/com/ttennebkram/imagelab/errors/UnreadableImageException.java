package com.ttennebkram.imagelab.errors;

/**
 * Thrown when encoded image bytes cannot be decoded into a raster buffer.
 */
public class UnreadableImageException extends ImageLabException {

    public UnreadableImageException(String message) {
        super(ErrorKind.UNREADABLE_IMAGE, message);
    }

    public UnreadableImageException(String message, Throwable cause) {
        super(ErrorKind.UNREADABLE_IMAGE, message, cause);
    }
}
