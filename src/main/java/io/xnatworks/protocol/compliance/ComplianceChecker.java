/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.compliance;

import io.xnatworks.protocol.imaging.ImagingProtocol;
import io.xnatworks.protocol.parameter.EquivalenceRule;
import io.xnatworks.protocol.parameter.Parameter;
import io.xnatworks.protocol.parameter.ParameterDefinition;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.parameter.ParameterValue;
import io.xnatworks.protocol.sequence.ImagingSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares sequences parameter by parameter.
 *
 * The evaluation subset is the registry's required parameters plus any extras, taken
 * in registry order, followed by extras the registry does not know (compared by raw
 * text). A parameter missing on either side is a mismatch unless the registry marks it
 * skip-if-absent. Each comparison is independent: the checker holds no state between calls.
 */
public class ComplianceChecker {
    private static final Logger log = LoggerFactory.getLogger(ComplianceChecker.class);

    private final ParameterRegistry registry;
    private final List<String> defaultExtras;

    public ComplianceChecker() {
        this(ParameterRegistry.getDefault(), Collections.<String>emptyList());
    }

    public ComplianceChecker(ParameterRegistry registry) {
        this(registry, Collections.<String>emptyList());
    }

    /**
     * @param defaultExtras parameters evaluated in every comparison on top of the required subset
     */
    public ComplianceChecker(ParameterRegistry registry, Collection<String> defaultExtras) {
        this.registry = registry;
        this.defaultExtras = defaultExtras != null
                ? Collections.unmodifiableList(new ArrayList<>(defaultExtras))
                : Collections.<String>emptyList();
    }

    public ParameterRegistry getRegistry() {
        return registry;
    }

    public List<String> getDefaultExtras() {
        return defaultExtras;
    }

    public ComplianceResult compare(ImagingSequence a, ImagingSequence b) {
        return compare(a, b, Collections.<String>emptyList());
    }

    public ComplianceResult compare(ImagingSequence a, ImagingSequence b, Collection<String> extras) {
        return evaluate(a.getName(), b.getName(), a.getParameters(), b.getParameters(), extras);
    }

    /**
     * Compare two parameter sets keyed by parameter name (canonical names for recognized parameters).
     */
    public ComplianceResult compareParameters(Map<String, Parameter> a, Map<String, Parameter> b,
                                              Collection<String> extras) {
        return evaluate("A", "B", a, b, extras);
    }

    /**
     * The ordered evaluation subset for a set of extras.
     */
    public List<String> evaluationSubset(Collection<String> extras) {
        Set<String> recognizedExtras = new LinkedHashSet<>();
        Set<String> unrecognizedExtras = new LinkedHashSet<>();
        List<String> requested = new ArrayList<>(defaultExtras);
        if (extras != null) {
            requested.addAll(extras);
        }
        for (String extra : requested) {
            if (extra == null || extra.trim().isEmpty()) {
                continue;
            }
            Optional<String> canonical = registry.resolveName(extra);
            if (canonical.isPresent()) {
                recognizedExtras.add(canonical.get());
            } else {
                unrecognizedExtras.add(extra.trim());
            }
        }

        List<String> subset = new ArrayList<>();
        for (ParameterDefinition def : registry.getDefinitions()) {
            if (def.isRequired() || recognizedExtras.contains(def.getName())) {
                subset.add(def.getName());
            }
        }
        subset.addAll(unrecognizedExtras);
        return subset;
    }

    /**
     * Compare every reference sequence with the candidate sequence of the same name.
     */
    public ProtocolComplianceReport compareProtocols(ImagingProtocol reference, ImagingProtocol candidate) {
        Map<String, ComplianceResult> results = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, ImagingSequence> entry : reference.getSequences().entrySet()) {
            String name = entry.getKey();
            Optional<ImagingSequence> other = candidate.findSequence(name);
            if (other.isPresent()) {
                results.put(name, compare(entry.getValue(), other.get()));
            } else {
                log.debug("Sequence {} of {} has no counterpart in {}", name, reference.getName(), candidate.getName());
                missing.add(name);
            }
        }

        List<String> extra = new ArrayList<>();
        for (String name : candidate.getSequenceNames()) {
            if (!reference.containsSequence(name)) {
                extra.add(name);
            }
        }

        ProtocolComplianceReport report = new ProtocolComplianceReport(
                reference.getName(), candidate.getName(), results, missing, extra);
        if (report.isCompliant()) {
            log.info("Protocol {} complies with {}: {} sequences checked",
                    candidate.getName(), reference.getName(), results.size());
        } else {
            log.warn("Protocol {} does not comply with {}: {} non-compliant, {} missing",
                    candidate.getName(), reference.getName(), report.getNonCompliantSequences().size(), missing.size());
        }
        return report;
    }

    private ComplianceResult evaluate(String nameA, String nameB,
                                      Map<String, Parameter> a, Map<String, Parameter> b,
                                      Collection<String> extras) {
        List<String> subset = evaluationSubset(extras);
        List<ParameterMismatch> mismatches = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (String name : subset) {
            ParameterDefinition def = registry.getDefinition(name);
            Parameter pa = a.get(name);
            Parameter pb = b.get(name);

            if (pa == null || pb == null) {
                if (def != null && def.isSkipIfAbsent()) {
                    skipped.add(name);
                    continue;
                }
                MismatchType type = pa == null && pb == null ? MismatchType.MISSING_IN_BOTH
                        : pa == null ? MismatchType.MISSING_IN_FIRST : MismatchType.MISSING_IN_SECOND;
                mismatches.add(new ParameterMismatch(name, valueOf(pa), valueOf(pb), type));
                continue;
            }

            boolean equivalent;
            if (def != null) {
                EquivalenceRule rule = def.getRule();
                equivalent = rule.isEquivalent(pa.getValue(), pb.getValue());
            } else {
                // Not in the registry: raw text equality
                equivalent = pa.getValue().asText().equals(pb.getValue().asText());
            }
            if (!equivalent) {
                MismatchType type = def != null && (pa.getValue().isRaw() || pb.getValue().isRaw())
                        ? MismatchType.UNCOERCED : MismatchType.NOT_EQUIVALENT;
                mismatches.add(new ParameterMismatch(name, pa.getValue(), pb.getValue(), type));
            }
        }

        for (ParameterMismatch m : mismatches) {
            log.debug("{} vs {}: {}", nameA, nameB, m);
        }
        ComplianceResult result = new ComplianceResult(nameA, nameB, mismatches, subset, skipped);
        if (result.isCompliant()) {
            log.info("{} complies with {}: {} parameters checked", nameB, nameA, subset.size() - skipped.size());
        } else {
            log.warn("{} does not comply with {}: {} mismatches ({})", nameB, nameA, mismatches.size(), mismatchNames(mismatches));
        }
        return result;
    }

    private static ParameterValue valueOf(Parameter p) {
        return p != null ? p.getValue() : ParameterValue.absent();
    }

    private static String mismatchNames(List<ParameterMismatch> mismatches) {
        List<String> names = new ArrayList<>();
        for (ParameterMismatch m : mismatches) {
            names.add(m.getName());
        }
        return String.join(", ", names);
    }
}
