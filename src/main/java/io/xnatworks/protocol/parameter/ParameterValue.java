/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable value of an acquisition parameter.
 *
 * A value is exactly one of: a number, a free-text string, an enumerated symbol,
 * or an ordered vector of numbers. Two further kinds exist for bookkeeping:
 * {@link ValueKind#RAW} keeps the original text of a field that could not be
 * coerced, and {@link ValueKind#ABSENT} marks a missing parameter in a diff.
 */
public final class ParameterValue {

    private static final ParameterValue ABSENT = new ParameterValue(ValueKind.ABSENT, Double.NaN, null, null);

    private final ValueKind kind;
    private final double number;
    private final String text;
    private final double[] vector;

    private ParameterValue(ValueKind kind, double number, String text, double[] vector) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.vector = vector;
    }

    public static ParameterValue ofNumber(double number) {
        return new ParameterValue(ValueKind.NUMBER, number, null, null);
    }

    public static ParameterValue ofString(String text) {
        return new ParameterValue(ValueKind.STRING, Double.NaN, Objects.requireNonNull(text, "text"), null);
    }

    public static ParameterValue ofSymbol(String symbol) {
        return new ParameterValue(ValueKind.SYMBOL, Double.NaN, Objects.requireNonNull(symbol, "symbol"), null);
    }

    public static ParameterValue ofVector(double... values) {
        Objects.requireNonNull(values, "values");
        return new ParameterValue(ValueKind.VECTOR, Double.NaN, null, values.clone());
    }

    public static ParameterValue raw(String text) {
        return new ParameterValue(ValueKind.RAW, Double.NaN, text == null ? "" : text, null);
    }

    public static ParameterValue absent() {
        return ABSENT;
    }

    public ValueKind getKind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind == ValueKind.NUMBER || kind == ValueKind.VECTOR;
    }

    public boolean isAbsent() {
        return kind == ValueKind.ABSENT;
    }

    public boolean isRaw() {
        return kind == ValueKind.RAW;
    }

    /**
     * @return the number held by a NUMBER value
     * @throws IllegalStateException for any other kind
     */
    public double getNumber() {
        if (kind != ValueKind.NUMBER) {
            throw new IllegalStateException("Not a number value: " + kind);
        }
        return number;
    }

    /**
     * @return a copy of the components of a VECTOR value
     * @throws IllegalStateException for any other kind
     */
    public double[] getVector() {
        if (kind != ValueKind.VECTOR) {
            throw new IllegalStateException("Not a vector value: " + kind);
        }
        return vector.clone();
    }

    /**
     * Numeric components of this value: a NUMBER is a one-element vector.
     * Returns null for non-numeric kinds.
     */
    double[] numericComponents() {
        if (kind == ValueKind.NUMBER) {
            return new double[]{number};
        }
        if (kind == ValueKind.VECTOR) {
            return vector;
        }
        return null;
    }

    /**
     * Text form of the value. Numbers are rendered without trailing zeros,
     * vectors as DICOM multi-values separated by a backslash.
     */
    public String asText() {
        switch (kind) {
            case NUMBER:
                return formatNumber(number);
            case VECTOR:
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < vector.length; i++) {
                    if (i > 0) sb.append('\\');
                    sb.append(formatNumber(vector[i]));
                }
                return sb.toString();
            case ABSENT:
                return "Absent";
            default:
                return text;
        }
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterValue)) return false;
        ParameterValue that = (ParameterValue) o;
        return kind == that.kind
                && Double.compare(number, that.number) == 0
                && Objects.equals(text, that.text)
                && Arrays.equals(vector, that.vector);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(kind, number, text);
        result = 31 * result + Arrays.hashCode(vector);
        return result;
    }

    @Override
    public String toString() {
        return asText();
    }
}
