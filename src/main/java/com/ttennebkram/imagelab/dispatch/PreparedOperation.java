package com.ttennebkram.imagelab.dispatch;

import com.ttennebkram.imagelab.operations.OperationEntry;
import com.ttennebkram.imagelab.params.OperationParameters;

/**
 * An operation whose identifier has been resolved and whose parameters have
 * been validated, ready to run against any number of buffers.
 */
public final class PreparedOperation {

    private final OperationEntry entry;
    private final OperationParameters parameters;

    PreparedOperation(OperationEntry entry, OperationParameters parameters) {
        this.entry = entry;
        this.parameters = parameters;
    }

    /**
     * The identifier the caller asked for (operation id or alias).
     */
    public String getOperationId() {
        return entry.getId();
    }

    OperationEntry getEntry() {
        return entry;
    }

    public OperationParameters getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return entry.getId() + parameters;
    }
}
