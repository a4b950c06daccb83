package com.ttennebkram.imagelab.errors;

/**
 * Thrown before any batch work starts when the item count exceeds the ceiling.
 */
public class BatchTooLargeException extends ImageLabException {

    private final int itemCount;
    private final int maxItems;

    public BatchTooLargeException(int itemCount, int maxItems) {
        super(ErrorKind.BATCH_TOO_LARGE,
                "Maximum " + maxItems + " images allowed per batch, got " + itemCount);
        this.itemCount = itemCount;
        this.maxItems = maxItems;
    }

    public int getItemCount() {
        return itemCount;
    }

    public int getMaxItems() {
        return maxItems;
    }
}
