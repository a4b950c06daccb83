package com.ttennebkram.imagelab.operations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * An alternative identifier for an operation, with some parameters fixed.
 * Presets are written as {@code "name=value"}; a caller may not override them.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({})
public @interface OperationAlias {

    String id();

    String[] preset() default {};
}
