package com.ttennebkram.imagelab.params;

import java.math.BigDecimal;

/**
 * Value types an operation parameter can declare.
 * Each type knows how to coerce raw values coming from JSON or form fields.
 */
public enum ParameterType {

    INTEGER {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof Integer) {
                return raw;
            }
            BigDecimal decimal = toDecimal(raw);
            if (decimal == null) {
                return null;
            }
            try {
                // 5.0 is accepted, 5.5 is not
                return decimal.stripTrailingZeros().intValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
    },

    FLOAT {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof Double) {
                return raw;
            }
            BigDecimal decimal = toDecimal(raw);
            return decimal == null ? null : decimal.doubleValue();
        }
    },

    BOOLEAN {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            if (raw instanceof String) {
                String s = ((String) raw).trim().toLowerCase();
                if ("true".equals(s) || "1".equals(s)) return Boolean.TRUE;
                if ("false".equals(s) || "0".equals(s)) return Boolean.FALSE;
            }
            return null;
        }
    },

    STRING {
        @Override
        Object coerce(Object raw) {
            return raw instanceof String ? raw : null;
        }
    };

    /**
     * Convert a raw value to this type's Java representation.
     *
     * @return Integer, Double, Boolean or String, or null if the value cannot be coerced
     */
    abstract Object coerce(Object raw);

    private static BigDecimal toDecimal(Object raw) {
        try {
            if (raw instanceof Number) {
                return new BigDecimal(raw.toString());
            }
            if (raw instanceof String) {
                return new BigDecimal(((String) raw).trim());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }
}
