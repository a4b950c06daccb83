package com.ttennebkram.imagelab.operations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for ImageOperation classes to declare their metadata.
 * Used for auto-registration at runtime - no compile-time registration needed.
 * The OperationRegistry uses this annotation to discover operations.
 *
 * Example usage:
 * <pre>
 * {@literal @}OperationInfo(
 *     id = "convolution",
 *     category = "Filter",
 *     description = "Blur or sharpen\nImgproc.GaussianBlur / Imgproc.filter2D",
 *     aliases = {@OperationAlias(id = "blur", preset = "op=blur")}
 * )
 * public class ConvolutionOperation extends ImageOperationBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface OperationInfo {

    /**
     * The operation identifier requests use (e.g., "grayscale", "resize_crop").
     */
    String id();

    /**
     * Category for grouping (e.g., "Color", "Filter", "Geometry").
     */
    String category();

    /**
     * Description/method signature shown in listings.
     */
    String description() default "";

    /**
     * Whether the operation draws into the buffer it is handed.
     * The dispatcher gives destructive operations a private copy.
     */
    boolean destructive() default false;

    /**
     * Additional identifiers that resolve to this operation with fixed parameters.
     */
    OperationAlias[] aliases() default {};
}
