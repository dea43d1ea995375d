/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

/**
 * Numeric values match when {@code |a - b| <= tolerance}, component-wise for vectors.
 * NaN, infinities, non-numeric values and uncoerced raw text never match.
 */
public class NumericToleranceRule extends AbstractEquivalenceRule {

    private final double tolerance;

    public NumericToleranceRule(double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be a non-negative number: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public RuleType getType() {
        return RuleType.NUMERIC_TOLERANCE;
    }

    @Override
    protected boolean compareRaw(String a, String b) {
        return false;
    }

    @Override
    protected boolean compare(ParameterValue a, ParameterValue b) {
        double[] left = a.numericComponents();
        double[] right = b.numericComponents();
        if (left == null || right == null || left.length != right.length || left.length == 0) {
            return false;
        }
        for (int i = 0; i < left.length; i++) {
            double difference = Math.abs(left[i] - right[i]);
            // NaN compares false, so NaN and inf - inf fall out here
            if (!(difference <= tolerance)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "NUMERIC_TOLERANCE(" + ParameterValue.formatNumber(tolerance) + ")";
    }
}
