/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

/**
 * Handles the absent and raw cases shared by every rule.
 */
abstract class AbstractEquivalenceRule implements EquivalenceRule {

    @Override
    public final boolean isEquivalent(ParameterValue a, ParameterValue b) {
        if (a == null || b == null || a.isAbsent() || b.isAbsent()) {
            return false;
        }
        if (a.isRaw() || b.isRaw()) {
            return a.isRaw() && b.isRaw() && compareRaw(a.asText(), b.asText());
        }
        return compare(a, b);
    }

    /**
     * Compare two uncoerced values by their raw text.
     */
    protected boolean compareRaw(String a, String b) {
        return a.equals(b);
    }

    /**
     * Compare two present, coerced values.
     */
    protected abstract boolean compare(ParameterValue a, ParameterValue b);

    @Override
    public String toString() {
        return getType().name();
    }
}
