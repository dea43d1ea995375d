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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of checking a candidate protocol against a reference protocol.
 */
public final class ProtocolComplianceReport {

    private final String referenceName;
    private final String candidateName;
    private final Map<String, ComplianceResult> results;
    private final List<String> missingSequences;
    private final List<String> extraSequences;

    public ProtocolComplianceReport(String referenceName, String candidateName,
                                    Map<String, ComplianceResult> results,
                                    List<String> missingSequences, List<String> extraSequences) {
        this.referenceName = referenceName;
        this.candidateName = candidateName;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.missingSequences = Collections.unmodifiableList(new ArrayList<>(missingSequences));
        this.extraSequences = Collections.unmodifiableList(new ArrayList<>(extraSequences));
    }

    /**
     * Compliant iff every reference sequence is present in the candidate and complies.
     * Extra candidate sequences do not affect the verdict.
     */
    public boolean isCompliant() {
        return missingSequences.isEmpty() && getNonCompliantSequences().isEmpty();
    }

    public String getReferenceName() { return referenceName; }
    public String getCandidateName() { return candidateName; }

    /**
     * Per-sequence results in reference order.
     */
    public Map<String, ComplianceResult> getResults() { return results; }

    public ComplianceResult getResult(String sequenceName) {
        return results.get(sequenceName);
    }

    /** Reference sequences the candidate does not contain. */
    public List<String> getMissingSequences() { return missingSequences; }

    /** Candidate sequences the reference does not contain. */
    public List<String> getExtraSequences() { return extraSequences; }

    public List<String> getNonCompliantSequences() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, ComplianceResult> e : results.entrySet()) {
            if (!e.getValue().isCompliant()) {
                names.add(e.getKey());
            }
        }
        return names;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== PROTOCOL COMPLIANCE ").append(isCompliant() ? "PASSED" : "FAILED").append(" ===\n");
        sb.append("Reference: ").append(referenceName).append("\n");
        sb.append("Candidate: ").append(candidateName).append("\n");
        sb.append("Sequences: ").append(results.size() - getNonCompliantSequences().size()).append(" compliant, ")
          .append(getNonCompliantSequences().size()).append(" non-compliant, ")
          .append(missingSequences.size()).append(" missing\n");

        for (Map.Entry<String, ComplianceResult> e : results.entrySet()) {
            ComplianceResult r = e.getValue();
            sb.append("  ").append(r.isCompliant() ? "✓" : "✗").append(" ").append(e.getKey());
            if (!r.isCompliant()) {
                sb.append(" (").append(r.getMismatches().size()).append(" mismatches)");
            }
            sb.append("\n");
        }
        for (String name : missingSequences) {
            sb.append("  ✗ ").append(name).append(" (missing)\n");
        }
        if (!extraSequences.isEmpty()) {
            sb.append("Extra sequences: ").append(String.join(", ", extraSequences)).append("\n");
        }
        return sb.toString();
    }
}
