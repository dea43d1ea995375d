/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

/**
 * Kinds of values a {@link ParameterValue} can hold.
 */
public enum ValueKind {
    NUMBER,
    STRING,
    SYMBOL,
    VECTOR,

    /**
     * Value kept as text because it could not be coerced, or because the field is unrecognized.
     */
    RAW,

    /**
     * Sentinel for a parameter missing from a sequence. Only appears in comparison output.
     */
    ABSENT;

    /**
     * Resolve the kind named in the registry table (number, string, symbol, vector).
     */
    public static ValueKind fromConfig(String type) {
        if (type == null) {
            return STRING;
        }
        switch (type.trim().toLowerCase()) {
            case "number":
            case "numeric":
                return NUMBER;
            case "string":
            case "text":
                return STRING;
            case "symbol":
            case "enum":
                return SYMBOL;
            case "vector":
            case "array":
                return VECTOR;
            default:
                throw new IllegalArgumentException("Unknown parameter type: " + type);
        }
    }

    public boolean isTextual() {
        return this == STRING || this == SYMBOL || this == RAW;
    }
}
