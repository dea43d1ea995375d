/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging;

import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.sequence.ImagingSequence;
import io.xnatworks.protocol.sequence.SequenceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named collection of sequences making up one scan protocol.
 *
 * Sequences are addressed by name only (case-sensitive) and kept in insertion order.
 * The collection only grows: adding a name twice fails with
 * {@link DuplicateSequenceException} and there is no removal. Lookups of a missing
 * name fail with {@link SequenceNotFoundException}:
 *
 * <pre>
 * try {
 *     ImagingSequence t2 = protocol.getSequence("t2w");
 *     ...
 * } catch (SequenceNotFoundException e) {
 *     report.missing(e.getSequenceName());
 * }
 * </pre>
 *
 * Reads may run concurrently; adding sequences needs a single writer.
 */
public class ImagingProtocol {
    private static final Logger log = LoggerFactory.getLogger(ImagingProtocol.class);

    private final String name;
    private final ParameterRegistry registry;
    private final Map<String, ImagingSequence> sequences = new LinkedHashMap<>();
    private final List<ParseIssue> parseIssues = new ArrayList<>();

    public ImagingProtocol(String name) {
        this(name, ParameterRegistry.getDefault());
    }

    public ImagingProtocol(String name, ParameterRegistry registry) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Protocol name must not be blank");
        }
        this.name = name;
        this.registry = registry;
    }

    public String getName() {
        return name;
    }

    public ParameterRegistry getRegistry() {
        return registry;
    }

    public ImagingSequence getSequence(String sequenceName) throws SequenceNotFoundException {
        ImagingSequence sequence = sequences.get(sequenceName);
        if (sequence == null) {
            throw new SequenceNotFoundException(name, sequenceName);
        }
        return sequence;
    }

    public Optional<ImagingSequence> findSequence(String sequenceName) {
        return Optional.ofNullable(sequences.get(sequenceName));
    }

    public boolean containsSequence(String sequenceName) {
        return sequences.containsKey(sequenceName);
    }

    /**
     * Add a sequence under the given name. The protocol stores its own copy carrying
     * that name.
     *
     * @throws DuplicateSequenceException if the name is taken; the protocol is unchanged
     */
    public void addSequence(String sequenceName, ImagingSequence sequence) throws DuplicateSequenceException {
        if (sequenceName == null || sequenceName.trim().isEmpty()) {
            throw new IllegalArgumentException("Sequence name must not be blank");
        }
        if (sequence == null) {
            throw new IllegalArgumentException("Sequence must not be null");
        }
        if (sequences.containsKey(sequenceName)) {
            throw new DuplicateSequenceException(name, sequenceName);
        }
        sequences.put(sequenceName, sequence.renamed(sequenceName));
        log.debug("Added sequence {} to protocol {}", sequenceName, name);
    }

    /**
     * Add a sequence under its own name.
     *
     * @throws IllegalArgumentException if the sequence is unnamed
     */
    public void addSequence(ImagingSequence sequence) throws DuplicateSequenceException {
        if (sequence.isUnnamed()) {
            throw new IllegalArgumentException("Unnamed sequence needs an explicit name before it can be added to " + name);
        }
        addSequence(sequence.getName(), sequence);
    }

    public ImagingSequence addSequenceFromDict(String sequenceName, Map<String, ?> dict)
            throws DuplicateSequenceException {
        if (sequences.containsKey(sequenceName)) {
            throw new DuplicateSequenceException(name, sequenceName);
        }
        ImagingSequence sequence = SequenceBuilder.fromDict(dict, sequenceName, registry);
        addSequence(sequenceName, sequence);
        return sequences.get(sequenceName);
    }

    /**
     * Add several sequences from dictionaries keyed by sequence name. Nothing is added
     * if any of the names is already taken.
     */
    public void addSequencesFromDict(Map<String, ? extends Map<String, ?>> dicts) throws DuplicateSequenceException {
        for (String sequenceName : dicts.keySet()) {
            if (sequences.containsKey(sequenceName)) {
                throw new DuplicateSequenceException(name, sequenceName);
            }
        }
        for (Map.Entry<String, ? extends Map<String, ?>> entry : dicts.entrySet()) {
            addSequenceFromDict(entry.getKey(), entry.getValue());
        }
    }

    public List<String> getSequenceNames() {
        return new ArrayList<>(sequences.keySet());
    }

    /**
     * Sequences in insertion order.
     */
    public Map<String, ImagingSequence> getSequences() {
        return Collections.unmodifiableMap(sequences);
    }

    public int size() {
        return sequences.size();
    }

    public boolean isEmpty() {
        return sequences.isEmpty();
    }

    public void addParseIssue(ParseIssue issue) {
        parseIssues.add(issue);
    }

    /**
     * Sequence blocks that were only partially recovered when the protocol was parsed.
     */
    public List<ParseIssue> getParseIssues() {
        return Collections.unmodifiableList(parseIssues);
    }

    @Override
    public String toString() {
        return String.format("ImagingProtocol{name=%s, sequences=%s%s}", name, sequences.keySet(),
                parseIssues.isEmpty() ? "" : ", parseIssues=" + parseIssues.size());
    }
}
