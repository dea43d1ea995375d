/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

/**
 * Decides whether two values of the same parameter mean the same acquisition setting.
 *
 * Implementations are attached to a parameter kind in the registry, not to a value.
 * Every implementation must be symmetric: {@code isEquivalent(a, b) == isEquivalent(b, a)}.
 * Transitivity is not promised.
 */
public interface EquivalenceRule {

    RuleType getType();

    /**
     * Absent values are never equivalent to anything. A RAW value is only equivalent to
     * an identical RAW value.
     */
    boolean isEquivalent(ParameterValue a, ParameterValue b);

    /**
     * Whether a symbol is a known encoding for this rule. Rules without a closed
     * vocabulary accept everything.
     */
    default boolean accepts(String symbol) {
        return true;
    }

    /**
     * Case and whitespace folding used by every text comparison.
     */
    static String fold(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", "").toUpperCase();
    }
}
