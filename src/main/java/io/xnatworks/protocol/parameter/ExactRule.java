/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Values must be identical after normalization. Text is compared case- and
 * whitespace-folded; numbers and vectors by exact numeric equality.
 */
public class ExactRule extends AbstractEquivalenceRule {

    private final Set<String> allowedValues = new HashSet<>();

    public ExactRule() {
    }

    /**
     * @param allowedValues closed vocabulary for symbols; empty means any value is accepted
     */
    public ExactRule(Collection<String> allowedValues) {
        if (allowedValues != null) {
            for (String value : allowedValues) {
                this.allowedValues.add(EquivalenceRule.fold(value));
            }
        }
    }

    @Override
    public RuleType getType() {
        return RuleType.EXACT;
    }

    @Override
    protected boolean compare(ParameterValue a, ParameterValue b) {
        if (a.isNumeric() && b.isNumeric()) {
            double[] left = a.numericComponents();
            double[] right = b.numericComponents();
            if (left.length != right.length) {
                return false;
            }
            for (int i = 0; i < left.length; i++) {
                // == rather than Arrays.equals so that NaN never matches
                if (!(left[i] == right[i])) {
                    return false;
                }
            }
            return true;
        }
        if (a.isNumeric() != b.isNumeric()) {
            return false;
        }
        return EquivalenceRule.fold(a.asText()).equals(EquivalenceRule.fold(b.asText()));
    }

    @Override
    public boolean accepts(String symbol) {
        return allowedValues.isEmpty() || allowedValues.contains(EquivalenceRule.fold(symbol));
    }

    @Override
    public String toString() {
        return allowedValues.isEmpty() ? "EXACT" : "EXACT" + Arrays.toString(allowedValues.toArray());
    }
}
