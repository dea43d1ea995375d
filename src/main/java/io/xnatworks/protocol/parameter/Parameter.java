/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import java.util.Objects;

/**
 * A single named acquisition setting.
 *
 * Recognized parameters carry the registry's canonical name. Unrecognized ones keep the
 * name they arrived with and a RAW value; they are retained for reporting but never take
 * part in a compliance verdict unless explicitly requested.
 */
public final class Parameter {

    private final String name;
    private final ParameterValue value;
    private final String unit;
    private final boolean recognized;

    public Parameter(String name, ParameterValue value, String unit, boolean recognized) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.unit = unit;
        this.recognized = recognized;
        if (value.isAbsent()) {
            throw new IllegalArgumentException("Parameter " + name + " cannot hold the absent sentinel");
        }
    }

    public static Parameter recognized(String name, ParameterValue value, String unit) {
        return new Parameter(name, value, unit, true);
    }

    public static Parameter unrecognized(String rawName, String rawText) {
        return new Parameter(rawName, ParameterValue.raw(rawText), null, false);
    }

    public String getName() { return name; }
    public ParameterValue getValue() { return value; }
    public String getUnit() { return unit; }
    public boolean isRecognized() { return recognized; }

    /**
     * True when the name was recognized but the value had to be kept as raw text.
     */
    public boolean isUncoerced() {
        return recognized && value.isRaw();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter)) return false;
        Parameter that = (Parameter) o;
        return recognized == that.recognized
                && name.equals(that.name)
                && value.equals(that.value)
                && Objects.equals(unit, that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, unit, recognized);
    }

    @Override
    public String toString() {
        String rendered = unit != null ? value.asText() + " " + unit : value.asText();
        return String.format("%s(%s)%s", name, rendered, recognized ? "" : "?");
    }
}
