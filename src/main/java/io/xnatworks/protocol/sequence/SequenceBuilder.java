/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.sequence;

import io.xnatworks.protocol.parameter.DicomTags;
import io.xnatworks.protocol.parameter.Parameter;
import io.xnatworks.protocol.parameter.ParameterDefinition;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.parameter.ParameterValue;
import io.xnatworks.protocol.parameter.ValueCoercer;
import io.xnatworks.protocol.parameter.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles an {@link ImagingSequence} from key/value entries.
 *
 * Each entry is resolved through the {@link ParameterRegistry} and its value coerced to
 * the declared kind. Unknown keys are kept as unrecognized parameters and bad values as
 * RAW text; neither stops the build. When a key resolves to a name that is already
 * present the first value is kept.
 *
 * <pre>
 * ImagingSequence seq = new SequenceBuilder()
 *         .name("t1_mprage")
 *         .put("TR", "2300 ms")
 *         .put(0x00180081, 2.98)
 *         .build();
 * </pre>
 */
public class SequenceBuilder {
    private static final Logger log = LoggerFactory.getLogger(SequenceBuilder.class);

    public static final String MANUAL_SOURCE = "manual";

    static final String EFFECTIVE_ECHO_SPACING = "EffectiveEchoSpacing";
    static final String PIXEL_BANDWIDTH = "PixelBandwidth";
    static final String PHASE_ENCODING_STEPS = "PhaseEncodingSteps";

    private final ParameterRegistry registry;
    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private String name;
    private String source;

    public SequenceBuilder() {
        this(ParameterRegistry.getDefault());
    }

    public SequenceBuilder(ParameterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Build a sequence from a raw header mapping. Keys may be names, aliases, tag strings
     * or {@link Integer} tag numbers.
     */
    public static ImagingSequence fromHeader(Map<?, ?> header, String name, ParameterRegistry registry) {
        SequenceBuilder builder = new SequenceBuilder(registry)
                .name(name)
                .source(headerDigest(header));
        for (Map.Entry<?, ?> entry : header.entrySet()) {
            builder.put(entry.getKey(), entry.getValue());
        }
        builder.deriveEffectiveEchoSpacing();
        return builder.build();
    }

    /**
     * Build a sequence from a plain dictionary of already typed values.
     */
    public static ImagingSequence fromDict(Map<String, ?> dict, String name, ParameterRegistry registry) {
        return new SequenceBuilder(registry)
                .name(name)
                .source(MANUAL_SOURCE)
                .putAll(dict)
                .build();
    }

    public SequenceBuilder name(String name) {
        this.name = name;
        return this;
    }

    public SequenceBuilder source(String source) {
        this.source = source;
        return this;
    }

    /**
     * Add one entry. Blank values are ignored.
     */
    public SequenceBuilder put(Object key, Object value) {
        if (key == null) {
            log.warn("Ignoring header entry without a key (value '{}')", ValueCoercer.stringify(value));
            return this;
        }
        if (!ValueCoercer.isPresent(value)) {
            log.debug("Ignoring {}: no value", key);
            return this;
        }

        Optional<ParameterDefinition> def = registry.resolve(key);
        if (def.isPresent()) {
            String canonical = def.get().getName();
            if (parameters.containsKey(canonical)) {
                log.warn("Duplicate value for {} from key '{}' ignored", canonical, key);
                return this;
            }
            parameters.put(canonical, ValueCoercer.coerce(def.get(), value));
        } else {
            putUnrecognized(key, value);
        }
        return this;
    }

    public SequenceBuilder putAll(Map<?, ?> entries) {
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
        return this;
    }

    /**
     * Add an entry as unrecognized without consulting the registry.
     */
    public SequenceBuilder putUnrecognized(Object key, Object value) {
        String rawName = keyText(key);
        if (parameters.containsKey(rawName)) {
            log.warn("Duplicate value for unrecognized field '{}' ignored", rawName);
            return this;
        }
        log.debug("Unrecognized field '{}' kept as raw text", rawName);
        parameters.put(rawName, Parameter.unrecognized(rawName, ValueCoercer.stringify(value)));
        return this;
    }

    /**
     * Add a parameter exactly as given, without resolving or coercing it. Used when
     * restoring a sequence from its durable form.
     */
    public SequenceBuilder putParameter(Parameter parameter) {
        if (parameters.containsKey(parameter.getName())) {
            log.warn("Duplicate parameter {} ignored", parameter.getName());
            return this;
        }
        parameters.put(parameter.getName(), parameter);
        return this;
    }

    public boolean contains(String canonicalName) {
        return parameters.containsKey(canonicalName);
    }

    public ImagingSequence build() {
        String resolvedName = name != null ? name.trim() : "";
        boolean unnamed = false;
        if (resolvedName.isEmpty()) {
            resolvedName = deriveName();
        }
        if (resolvedName == null) {
            resolvedName = ImagingSequence.UNNAMED;
            unnamed = true;
            log.debug("No sequence name could be derived, using placeholder");
        }

        List<String> missing = new ArrayList<>();
        for (String required : registry.getRequiredNames()) {
            if (!parameters.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            log.debug("Sequence {} lacks required parameters {}", resolvedName, missing);
        }

        return new ImagingSequence(resolvedName, unnamed, parameters,
                source != null ? source : MANUAL_SOURCE, Collections.unmodifiableList(missing), registry);
    }

    private String deriveName() {
        for (String candidate : registry.getSequenceNameParameters()) {
            Parameter p = parameters.get(candidate);
            if (p != null) {
                String text = p.getValue().asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * EffectiveEchoSpacing = 1 / (PixelBandwidth * PhaseEncodingSteps) seconds, when not supplied.
     */
    void deriveEffectiveEchoSpacing() {
        ParameterDefinition def = registry.getDefinition(EFFECTIVE_ECHO_SPACING);
        if (def == null || parameters.containsKey(EFFECTIVE_ECHO_SPACING)) {
            return;
        }
        double bandwidth = numberOf(PIXEL_BANDWIDTH);
        double steps = numberOf(PHASE_ENCODING_STEPS);
        if (bandwidth > 0 && steps > 0) {
            double spacing = 1.0 / (bandwidth * steps);
            parameters.put(EFFECTIVE_ECHO_SPACING,
                    Parameter.recognized(EFFECTIVE_ECHO_SPACING, ParameterValue.ofNumber(spacing), def.getUnit()));
            log.debug("Derived {} = {} s", EFFECTIVE_ECHO_SPACING, spacing);
        }
    }

    private double numberOf(String canonicalName) {
        Parameter p = parameters.get(canonicalName);
        if (p == null || p.getValue().getKind() != ValueKind.NUMBER) {
            return Double.NaN;
        }
        return p.getValue().getNumber();
    }

    private static String keyText(Object key) {
        if (key instanceof Integer) {
            return DicomTags.format((Integer) key);
        }
        if (key instanceof Enum) {
            return ((Enum<?>) key).name();
        }
        return key.toString().trim();
    }

    /**
     * Provenance of a header: "header:sha256:" followed by the first 8 bytes of the
     * digest over the sorted entries.
     */
    static String headerDigest(Map<?, ?> header) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<?, ?> entry : header.entrySet()) {
            if (entry.getKey() != null) {
                lines.add(keyText(entry.getKey()) + "=" + ValueCoercer.stringify(entry.getValue()));
            }
        }
        Collections.sort(lines);

        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder("header:sha256:");
            for (int i = 0; i < 8; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
