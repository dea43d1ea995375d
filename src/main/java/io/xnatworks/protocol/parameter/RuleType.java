/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

/**
 * Equivalence rule families understood by the registry.
 */
public enum RuleType {
    EXACT,
    NUMERIC_TOLERANCE,
    AXIS_EQUIVALENCE,
    SET_MEMBERSHIP;

    public static RuleType fromConfig(String type) {
        if (type == null) {
            return EXACT;
        }
        switch (type.trim().toLowerCase()) {
            case "exact":
                return EXACT;
            case "tolerance":
            case "numeric_tolerance":
                return NUMERIC_TOLERANCE;
            case "axis":
            case "axis_equivalence":
                return AXIS_EQUIVALENCE;
            case "set":
            case "set_membership":
                return SET_MEMBERSHIP;
            default:
                throw new IllegalArgumentException("Unknown equivalence rule: " + type);
        }
    }
}
