/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.compliance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Verdict of comparing two sequences. Compliant iff there are no mismatches.
 * Mismatches follow the evaluation order, so two runs over the same input
 * produce identical results.
 */
public final class ComplianceResult {

    private final String sequenceA;
    private final String sequenceB;
    private final List<ParameterMismatch> mismatches;
    private final List<String> evaluated;
    private final List<String> skipped;

    public ComplianceResult(String sequenceA, String sequenceB, List<ParameterMismatch> mismatches,
                            List<String> evaluated, List<String> skipped) {
        this.sequenceA = sequenceA;
        this.sequenceB = sequenceB;
        this.mismatches = Collections.unmodifiableList(new ArrayList<>(mismatches));
        this.evaluated = Collections.unmodifiableList(new ArrayList<>(evaluated));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
    }

    public boolean isCompliant() {
        return mismatches.isEmpty();
    }

    public List<ParameterMismatch> getMismatches() {
        return mismatches;
    }

    /**
     * @return the mismatch recorded for a parameter, or null if it passed or was not evaluated
     */
    public ParameterMismatch getMismatch(String name) {
        for (ParameterMismatch m : mismatches) {
            if (m.getName().equals(name)) {
                return m;
            }
        }
        return null;
    }

    /**
     * Names of every parameter in the evaluation subset, in evaluation order.
     */
    public List<String> getEvaluated() {
        return evaluated;
    }

    /**
     * Parameters left out because they are optional for comparison and absent on a side.
     */
    public List<String> getSkipped() {
        return skipped;
    }

    public String getSequenceA() { return sequenceA; }
    public String getSequenceB() { return sequenceB; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== COMPLIANCE CHECK ").append(isCompliant() ? "PASSED" : "FAILED").append(" ===\n");
        sb.append("Sequences: ").append(sequenceA).append(" vs ").append(sequenceB).append("\n");
        sb.append("Parameters: ").append(evaluated.size() - skipped.size() - mismatches.size()).append(" matched, ")
          .append(mismatches.size()).append(" mismatched, ")
          .append(skipped.size()).append(" skipped\n");

        if (!mismatches.isEmpty()) {
            sb.append("\nMISMATCHES:\n");
            for (ParameterMismatch m : mismatches) {
                sb.append("  ✗ ").append(m).append("\n");
            }
        }
        if (!skipped.isEmpty()) {
            sb.append("\nSKIPPED: ").append(String.join(", ", skipped)).append("\n");
        }
        return sb.toString();
    }
}
