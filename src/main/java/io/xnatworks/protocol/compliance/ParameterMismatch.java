/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.compliance;

import io.xnatworks.protocol.parameter.ParameterValue;

import java.util.Objects;

/**
 * One failed parameter in a comparison. A side that lacks the parameter is
 * represented by {@link ParameterValue#absent()}.
 */
public final class ParameterMismatch {

    private final String name;
    private final ParameterValue valueA;
    private final ParameterValue valueB;
    private final MismatchType type;

    public ParameterMismatch(String name, ParameterValue valueA, ParameterValue valueB, MismatchType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueA = valueA != null ? valueA : ParameterValue.absent();
        this.valueB = valueB != null ? valueB : ParameterValue.absent();
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() { return name; }
    public ParameterValue getValueA() { return valueA; }
    public ParameterValue getValueB() { return valueB; }
    public MismatchType getType() { return type; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterMismatch)) return false;
        ParameterMismatch that = (ParameterMismatch) o;
        return name.equals(that.name) && valueA.equals(that.valueA)
                && valueB.equals(that.valueB) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, valueA, valueB, type);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s <> %s", type, name, truncate(valueA.asText(), 30), truncate(valueB.asText(), 30));
    }

    private static String truncate(String s, int maxLen) {
        if (s.length() <= maxLen) return s;
        return s.substring(0, maxLen - 3) + "...";
    }
}
