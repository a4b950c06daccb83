package com.ttennebkram.imagelab.errors;

/**
 * Thrown when an export target format cannot be encoded.
 */
public class UnsupportedFormatException extends ImageLabException {

    private final String format;

    public UnsupportedFormatException(String format) {
        super(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported format: " + format);
        this.format = format;
    }

    public UnsupportedFormatException(String format, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported format: " + format, cause);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
