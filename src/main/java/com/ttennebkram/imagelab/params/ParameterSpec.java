package com.ttennebkram.imagelab.params;

import com.ttennebkram.imagelab.errors.InvalidParameterException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Declaration of one recognized parameter: name, type, default and constraints.
 *
 * Built fluently:
 * <pre>
 * ParameterSpec.integer("ksize").defaultValue(7).positiveOdd()
 * ParameterSpec.string("space").required().oneOf("RGB", "HSV", "LAB")
 * </pre>
 */
public final class ParameterSpec {

    private final String name;
    private final ParameterType type;
    private Object defaultValue;
    private boolean required;
    private Double min;
    private Double max;
    private boolean odd;
    private Set<Object> allowed = Collections.emptySet();

    private ParameterSpec(String name, ParameterType type) {
        this.name = name;
        this.type = type;
    }

    public static ParameterSpec integer(String name) {
        return new ParameterSpec(name, ParameterType.INTEGER);
    }

    public static ParameterSpec decimal(String name) {
        return new ParameterSpec(name, ParameterType.FLOAT);
    }

    public static ParameterSpec bool(String name) {
        return new ParameterSpec(name, ParameterType.BOOLEAN);
    }

    public static ParameterSpec string(String name) {
        return new ParameterSpec(name, ParameterType.STRING);
    }

    public ParameterSpec defaultValue(Object value) {
        this.defaultValue = type.coerce(value);
        if (this.defaultValue == null) {
            throw new IllegalArgumentException("Default for " + name + " is not a " + type + ": " + value);
        }
        return this;
    }

    public ParameterSpec required() {
        this.required = true;
        return this;
    }

    public ParameterSpec min(double min) {
        this.min = min;
        return this;
    }

    public ParameterSpec max(double max) {
        this.max = max;
        return this;
    }

    public ParameterSpec range(double min, double max) {
        return min(min).max(max);
    }

    /**
     * Kernel and window sizes: positive and odd.
     */
    public ParameterSpec positiveOdd() {
        this.odd = true;
        return min(1);
    }

    public ParameterSpec oneOf(Object... values) {
        Set<Object> set = new LinkedHashSet<>();
        for (Object v : values) {
            set.add(type.coerce(v));
        }
        this.allowed = Collections.unmodifiableSet(set);
        return this;
    }

    public String getName() {
        return name;
    }

    public ParameterType getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    public Set<Object> getAllowedValues() {
        return allowed;
    }

    /**
     * Coerce and check a raw value. A null raw value yields the default.
     *
     * @return the typed value, or null when absent and optional without default
     * @throws InvalidParameterException on a missing required value, a type
     *         mismatch or a constraint violation
     */
    Object resolve(Object raw) {
        if (raw == null) {
            if (required) {
                throw new InvalidParameterException(name, "Missing required parameter '" + name + "'");
            }
            return defaultValue;
        }

        Object value = type.coerce(raw);
        if (value == null) {
            throw new InvalidParameterException(name,
                    "Parameter '" + name + "' must be " + describeType() + ", got " + describeRaw(raw));
        }

        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidParameterException(name, "Parameter '" + name + "' must be finite");
            }
            if (odd && ((Integer) value) % 2 == 0) {
                throw new InvalidParameterException(name,
                        "Parameter '" + name + "' must be a positive odd integer, got " + value);
            }
            if (min != null && d < min) {
                throw new InvalidParameterException(name,
                        "Parameter '" + name + "' must be "
                                + (odd && min == 1.0 ? "a positive odd integer" : ">= " + format(min))
                                + ", got " + value);
            }
            if (max != null && d > max) {
                throw new InvalidParameterException(name,
                        "Parameter '" + name + "' must be <= " + format(max) + ", got " + value);
            }
        }

        if (!allowed.isEmpty() && !allowed.contains(value)) {
            throw new InvalidParameterException(name,
                    "Parameter '" + name + "' must be one of " + allowed + ", got " + value);
        }
        return value;
    }

    private String describeType() {
        switch (type) {
            case INTEGER: return "an integer";
            case FLOAT: return "a number";
            case BOOLEAN: return "a boolean";
            default: return "a string";
        }
    }

    private static String describeRaw(Object raw) {
        return raw instanceof String ? "'" + raw + "'" : String.valueOf(raw);
    }

    private static String format(double d) {
        return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" (").append(type.name().toLowerCase());
        if (required) sb.append(", required");
        if (defaultValue != null) sb.append(", default ").append(defaultValue);
        if (!allowed.isEmpty()) sb.append(", one of ").append(Arrays.toString(allowed.toArray()));
        return sb.append(')').toString();
    }
}
