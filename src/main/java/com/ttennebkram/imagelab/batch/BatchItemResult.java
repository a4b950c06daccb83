package com.ttennebkram.imagelab.batch;

import com.ttennebkram.imagelab.errors.ErrorKind;

/**
 * Outcome of one batch input: either the encoded output or the reason it failed.
 * Immutable once created.
 */
public final class BatchItemResult {

    /**
     * Whether an item was processed.
     */
    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    private final int index;
    private final String sourceName;
    private final Outcome outcome;
    private final String outputName;
    private final byte[] encoded;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private BatchItemResult(int index, String sourceName, Outcome outcome, String outputName,
                            byte[] encoded, ErrorKind errorKind, String errorMessage) {
        this.index = index;
        this.sourceName = sourceName;
        this.outcome = outcome;
        this.outputName = outputName;
        this.encoded = encoded;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    static BatchItemResult success(int index, String sourceName, String outputName, byte[] encoded) {
        return new BatchItemResult(index, sourceName, Outcome.SUCCESS, outputName, encoded.clone(), null, null);
    }

    static BatchItemResult failure(int index, String sourceName, ErrorKind kind, String message) {
        return new BatchItemResult(index, sourceName, Outcome.FAILURE, null, null, kind, message);
    }

    /**
     * Zero-based position of the input in the batch.
     */
    public int getIndex() {
        return index;
    }

    public String getSourceName() {
        return sourceName;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /**
     * Archive entry name of the output; null for failures.
     */
    public String getOutputName() {
        return outputName;
    }

    /**
     * PNG-encoded output; null for failures.
     */
    public byte[] getEncoded() {
        return encoded == null ? null : encoded.clone();
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "#" + index + " " + sourceName + " -> " + outputName
                : "#" + index + " " + sourceName + " failed: " + errorKind + " " + errorMessage;
    }
}
