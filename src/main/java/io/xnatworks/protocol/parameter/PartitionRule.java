/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for rules that map each encoding to one class of a fixed partition.
 * Encodings outside the partition only match an identical encoding.
 */
abstract class PartitionRule extends AbstractEquivalenceRule {

    private final List<List<String>> classes;
    private final Map<String, Integer> classIndex = new HashMap<>();

    PartitionRule(List<List<String>> classes) {
        if (classes == null || classes.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " needs at least one class");
        }
        List<List<String>> copy = new ArrayList<>();
        for (int i = 0; i < classes.size(); i++) {
            List<String> members = classes.get(i);
            if (members == null || members.isEmpty()) {
                throw new IllegalArgumentException("Empty equivalence class at position " + i);
            }
            for (String member : members) {
                String key = key(member);
                Integer previous = classIndex.putIfAbsent(key, i);
                if (previous != null && previous != i) {
                    throw new IllegalArgumentException("Encoding '" + member + "' appears in two classes");
                }
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(members)));
        }
        this.classes = Collections.unmodifiableList(copy);
    }

    /**
     * Lookup key for an encoding. Subclasses may strip more than case and whitespace.
     */
    protected String key(String encoding) {
        return EquivalenceRule.fold(encoding);
    }

    public List<List<String>> getClasses() {
        return classes;
    }

    /**
     * @return index of the class holding this encoding, or -1 when it is outside the partition
     */
    public int classOf(String encoding) {
        Integer index = classIndex.get(key(encoding));
        return index != null ? index : -1;
    }

    @Override
    protected boolean compare(ParameterValue a, ParameterValue b) {
        if (a.isNumeric() || b.isNumeric()) {
            return a.isNumeric() && b.isNumeric()
                    && EquivalenceRule.fold(a.asText()).equals(EquivalenceRule.fold(b.asText()));
        }
        int left = classOf(a.asText());
        int right = classOf(b.asText());
        if (left >= 0 || right >= 0) {
            return left == right;
        }
        return key(a.asText()).equals(key(b.asText()));
    }

    @Override
    public boolean accepts(String symbol) {
        return classOf(symbol) >= 0;
    }

    @Override
    public String toString() {
        return getType().name() + classes;
    }
}
