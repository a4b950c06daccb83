package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import org.opencv.core.Mat;

/**
 * Interface for catalog operations.
 * Each operation encapsulates:
 * - Processing logic (OpenCV calls)
 * - The schema of parameters it recognizes
 *
 * Operations hold no state between calls and perform no I/O, so identical
 * input and parameters always give identical output.
 */
public interface ImageOperation {

    /**
     * Get the operation identifier (e.g., "grayscale", "morph_edge").
     */
    String getOperationId();

    /**
     * Get the category for grouping (e.g., "Color", "Filter").
     */
    String getCategory();

    /**
     * Get a description of this operation, including the OpenCV call it maps to.
     */
    String getDescription();

    /**
     * Parameters this operation recognizes, with types, defaults and ranges.
     */
    ParameterSchema getParameterSchema();

    /**
     * Cross-parameter checks that a per-parameter schema cannot express.
     * Called by the dispatcher after schema validation, before any pixel work.
     *
     * @throws com.ttennebkram.imagelab.errors.InvalidParameterException on violation
     */
    default void validate(OperationParameters params) {
        // Default: no cross-parameter rules
    }

    /**
     * Whether {@link #apply} writes into its input.
     */
    default boolean isDestructive() {
        return false;
    }

    /**
     * Transform an input image.
     *
     * @param input 8-bit, 1 or 3 channel BGR image (do not modify or release
     *              unless this operation is destructive)
     * @param params validated parameters
     * @return the output image (caller will release)
     */
    Mat apply(Mat input, OperationParameters params);
}
