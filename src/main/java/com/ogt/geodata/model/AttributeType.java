package com.ogt.geodata.model;

import java.util.Collection;

/**
 * Tipo de almacenamiento de una columna, inferido de sus valores no nulos.
 */
public enum AttributeType {
    STRING,
    INTEGER,
    REAL,
    BOOLEAN;

    public static AttributeType infer(Collection<?> values) {
        boolean allBoolean = true;
        boolean allIntegral = true;
        boolean allNumeric = true;
        boolean any = false;

        for (Object v : values) {
            if (v == null) continue;
            any = true;
            if (!(v instanceof Boolean)) allBoolean = false;
            if (!(v instanceof Number)) {
                allNumeric = false;
                allIntegral = false;
            } else if (!isIntegral((Number) v)) {
                allIntegral = false;
            }
        }

        if (!any) return STRING;
        if (allBoolean) return BOOLEAN;
        if (allIntegral) return INTEGER;
        if (allNumeric) return REAL;
        return STRING;
    }

    /**
     * Convierte un valor al tipo de la columna (los escalares ya compatibles se devuelven tal cual).
     */
    public Object coerce(Object value) {
        if (value == null) return null;
        return switch (this) {
            case STRING -> value.toString();
            case INTEGER -> ((Number) value).longValue();
            case REAL -> ((Number) value).doubleValue();
            case BOOLEAN -> value;
        };
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || n instanceof java.math.BigInteger;
    }
}
