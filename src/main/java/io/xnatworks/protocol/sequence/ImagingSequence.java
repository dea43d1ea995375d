/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.sequence;

import io.xnatworks.protocol.parameter.Parameter;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.parameter.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The acquisition parameters of one scan.
 *
 * Instances are immutable and safe to share between comparisons. Use
 * {@link SequenceBuilder} or the static factories to create one, and
 * {@link #renamed(String)} to get a copy under another name.
 */
public final class ImagingSequence {
    private static final Logger log = LoggerFactory.getLogger(ImagingSequence.class);

    /**
     * Placeholder name of a sequence whose name could not be derived.
     */
    public static final String UNNAMED = "UNNAMED";

    private static final DateTimeFormatter DICOM_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    // DICOM TM: HH, HHmm, HHmmss or HHmmss.FFFFFF
    private static final DateTimeFormatter DICOM_TIME = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .optionalStart()
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 6, true)
            .optionalEnd()
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private static final DateTimeFormatter TIMESTAMP_LABEL = DateTimeFormatter.ofPattern("MM_dd_yyyy_HH_mm_ss");
    private static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("MM_dd_yyyy");

    private final String name;
    private final boolean unnamed;
    private final Map<String, Parameter> parameters;
    private final String sourceDescriptor;
    private final List<String> missingRequired;
    private final ParameterRegistry registry;

    ImagingSequence(String name, boolean unnamed, Map<String, Parameter> parameters,
                    String sourceDescriptor, List<String> missingRequired, ParameterRegistry registry) {
        this.name = name;
        this.unnamed = unnamed;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.sourceDescriptor = sourceDescriptor;
        this.missingRequired = missingRequired;
        this.registry = registry;
    }

    public static ImagingSequence fromHeader(Map<?, ?> header) {
        return SequenceBuilder.fromHeader(header, null, ParameterRegistry.getDefault());
    }

    public static ImagingSequence fromHeader(Map<?, ?> header, String name) {
        return SequenceBuilder.fromHeader(header, name, ParameterRegistry.getDefault());
    }

    public static ImagingSequence fromDict(Map<String, ?> dict) {
        return SequenceBuilder.fromDict(dict, null, ParameterRegistry.getDefault());
    }

    public static ImagingSequence fromDict(String name, Map<String, ?> dict) {
        return SequenceBuilder.fromDict(dict, name, ParameterRegistry.getDefault());
    }

    public String getName() {
        return name;
    }

    /**
     * True when no name was supplied or derivable; the name is then {@link #UNNAMED}.
     */
    public boolean isUnnamed() {
        return unnamed;
    }

    /**
     * Provenance: a header digest, "manual", or whatever the producer recorded.
     */
    public String getSourceDescriptor() {
        return sourceDescriptor;
    }

    public ParameterRegistry getRegistry() {
        return registry;
    }

    /**
     * Look up a parameter by canonical name, alias or tag.
     *
     * @return the parameter, or null if the sequence does not hold it
     */
    public Parameter getParameter(Object key) {
        if (key == null) {
            return null;
        }
        Parameter p = parameters.get(key.toString());
        if (p != null) {
            return p;
        }
        Optional<String> canonical = registry.resolveName(key);
        return canonical.isPresent() ? parameters.get(canonical.get()) : null;
    }

    public boolean hasParameter(Object key) {
        return getParameter(key) != null;
    }

    /**
     * All parameters in insertion order, keyed by name.
     */
    public Map<String, Parameter> getParameters() {
        return parameters;
    }

    public List<Parameter> getRecognizedParameters() {
        List<Parameter> result = new ArrayList<>();
        for (Parameter p : parameters.values()) {
            if (p.isRecognized()) {
                result.add(p);
            }
        }
        return result;
    }

    public List<Parameter> getUnrecognizedParameters() {
        List<Parameter> result = new ArrayList<>();
        for (Parameter p : parameters.values()) {
            if (!p.isRecognized()) {
                result.add(p);
            }
        }
        return result;
    }

    /**
     * Required registry parameters this sequence does not hold, in registry order.
     */
    public List<String> getMissingRequired() {
        return missingRequired;
    }

    public boolean isFullySpecified() {
        return missingRequired.isEmpty();
    }

    /**
     * True when EchoTime holds more than one echo.
     */
    public boolean isMultiEcho() {
        Parameter te = parameters.get("EchoTime");
        return te != null
                && te.getValue().getKind() == ValueKind.VECTOR
                && te.getValue().getVector().length > 1;
    }

    public int size() {
        return parameters.size();
    }

    /**
     * Subject of the session, from PatientID.
     */
    public Optional<String> getSubjectId() {
        return textOf("PatientID");
    }

    /**
     * Session identifier, from StudyInstanceUID.
     */
    public Optional<String> getSessionId() {
        return textOf("StudyInstanceUID");
    }

    /**
     * Run identifier, from SeriesInstanceUID.
     */
    public Optional<String> getRunId() {
        return textOf("SeriesInstanceUID");
    }

    /**
     * Acquisition time from ContentDate and ContentTime. A date without a time
     * gives the start of that day.
     *
     * @return empty when there is no ContentDate or either value is not a valid DICOM date or time
     */
    public Optional<LocalDateTime> getTimestamp() {
        Optional<String> date = textOf("ContentDate");
        if (!date.isPresent()) {
            return Optional.empty();
        }
        try {
            LocalDate day = LocalDate.parse(date.get(), DICOM_DATE);
            Optional<String> time = textOf("ContentTime");
            LocalTime at = time.isPresent() ? LocalTime.parse(time.get(), DICOM_TIME) : LocalTime.MIDNIGHT;
            return Optional.of(LocalDateTime.of(day, at));
        } catch (DateTimeParseException e) {
            log.warn("Sequence {} has an unreadable content date or time: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Timestamp as {@code MM_dd_yyyy_HH_mm_ss}, or {@code MM_dd_yyyy} when only the date is known.
     */
    public Optional<String> getTimestampLabel() {
        Optional<LocalDateTime> timestamp = getTimestamp();
        if (!timestamp.isPresent()) {
            return Optional.empty();
        }
        DateTimeFormatter format = textOf("ContentTime").isPresent() ? TIMESTAMP_LABEL : DATE_LABEL;
        return Optional.of(timestamp.get().format(format));
    }

    private Optional<String> textOf(String parameterName) {
        Parameter p = parameters.get(parameterName);
        if (p == null) {
            return Optional.empty();
        }
        String text = p.getValue().asText().trim();
        return text.isEmpty() ? Optional.<String>empty() : Optional.of(text);
    }

    /**
     * @return a copy of this sequence carrying the given name
     */
    public ImagingSequence renamed(String newName) {
        if (newName == null || newName.trim().isEmpty()) {
            throw new IllegalArgumentException("Sequence name must not be blank");
        }
        return new ImagingSequence(newName, false, parameters, sourceDescriptor, missingRequired, registry);
    }

    @Override
    public String toString() {
        return String.format("ImagingSequence{name=%s, parameters=%d, missingRequired=%s, source=%s}",
                name, parameters.size(), missingRequired, sourceDescriptor);
    }
}
