/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of recognized acquisition parameters.
 *
 * Maps canonical names, vendor aliases, DICOM keywords and DICOM tag numbers to a
 * {@link ParameterDefinition}. Name lookups ignore case, whitespace and underscores.
 * Unknown names resolve to {@link Optional#empty()} rather than failing, since vendor
 * headers routinely carry fields nobody has catalogued.
 *
 * A registry is immutable once built. {@link #getDefault()} loads the bundled
 * {@code parameter-registry.yaml} once per process; other tables can be loaded with
 * {@link #load(File)} or {@link #load(InputStream)}.
 */
public final class ParameterRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParameterRegistry.class);

    public static final String DEFAULT_RESOURCE = "/parameter-registry.yaml";

    private final Map<String, ParameterDefinition> definitions;
    private final Map<String, ParameterDefinition> byNormalizedName;
    private final Map<Integer, ParameterDefinition> byTag;
    private final List<String> requiredNames;
    private final List<String> sequenceNameParameters;

    private ParameterRegistry(RegistrySpec spec) {
        Map<String, ParameterDefinition> defs = new LinkedHashMap<>();
        Map<String, ParameterDefinition> names = new HashMap<>();
        Map<Integer, ParameterDefinition> tags = new HashMap<>();
        List<String> required = new ArrayList<>();

        for (RegistrySpec.ParameterSpec row : spec.getParameters()) {
            ParameterDefinition def = ParameterDefinition.fromSpec(row);
            if (defs.containsKey(def.getName())) {
                throw new IllegalStateException("Duplicate registry entry: " + def.getName());
            }
            defs.put(def.getName(), def);

            index(names, def.getName(), def);
            for (String alias : def.getAliases()) {
                index(names, alias, def);
            }

            if (def.hasDicomTag()) {
                ParameterDefinition previous = tags.putIfAbsent(def.getDicomTag(), def);
                if (previous != null) {
                    throw new IllegalStateException(String.format("DICOM tag %s mapped to both %s and %s",
                            DicomTags.format(def.getDicomTag()), previous.getName(), def.getName()));
                }
            }
            if (def.isRequired()) {
                required.add(def.getName());
            }
        }

        List<String> namingParams = new ArrayList<>();
        if (spec.getSequenceNameParameters() != null) {
            for (String naming : spec.getSequenceNameParameters()) {
                ParameterDefinition def = names.get(normalize(naming));
                if (def == null) {
                    throw new IllegalStateException("Unknown sequence name parameter: " + naming);
                }
                namingParams.add(def.getName());
            }
        }

        this.definitions = Collections.unmodifiableMap(defs);
        this.byNormalizedName = names;
        this.byTag = tags;
        this.requiredNames = Collections.unmodifiableList(required);
        this.sequenceNameParameters = Collections.unmodifiableList(namingParams);
    }

    private static void index(Map<String, ParameterDefinition> names, String name, ParameterDefinition def) {
        String key = normalize(name);
        if (key.isEmpty()) {
            return;
        }
        ParameterDefinition previous = names.putIfAbsent(key, def);
        if (previous != null && previous != def) {
            throw new IllegalStateException(String.format("Name '%s' claimed by both %s and %s",
                    name, previous.getName(), def.getName()));
        }
    }

    /**
     * The bundled registry, loaded on first use.
     */
    public static ParameterRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    public static ParameterRegistry fromSpec(RegistrySpec spec) {
        return new ParameterRegistry(spec);
    }

    public static ParameterRegistry load(InputStream yaml) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        RegistrySpec spec = mapper.readValue(yaml, RegistrySpec.class);
        return new ParameterRegistry(spec);
    }

    public static ParameterRegistry load(File yamlFile) throws IOException {
        log.info("Loading parameter registry from: {}", yamlFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        RegistrySpec spec = mapper.readValue(yamlFile, RegistrySpec.class);
        return new ParameterRegistry(spec);
    }

    /**
     * Resolve a raw header key to its registry entry.
     *
     * @param key a name, alias, DICOM keyword or tag string, an {@link Integer} tag number,
     *            or an enum constant (resolved by its name)
     * @return the definition, or empty when the key is unrecognized
     */
    public Optional<ParameterDefinition> resolve(Object key) {
        if (key == null) {
            return Optional.empty();
        }
        if (key instanceof Number) {
            return Optional.ofNullable(byTag.get(((Number) key).intValue()));
        }
        String text = key instanceof Enum ? ((Enum<?>) key).name() : key.toString();

        ParameterDefinition def = byNormalizedName.get(normalize(text));
        if (def != null) {
            return Optional.of(def);
        }
        int tag = DicomTags.parse(text);
        if (tag != -1) {
            return Optional.ofNullable(byTag.get(tag));
        }
        return Optional.empty();
    }

    /**
     * @return the canonical name for a raw key, or empty when unrecognized
     */
    public Optional<String> resolveName(Object key) {
        return resolve(key).map(ParameterDefinition::getName);
    }

    public boolean isRecognized(Object key) {
        return resolve(key).isPresent();
    }

    /**
     * @return the definition for a canonical name, or null if there is none
     */
    public ParameterDefinition getDefinition(String canonicalName) {
        return definitions.get(canonicalName);
    }

    /**
     * @throws IllegalArgumentException if the name is not canonical
     */
    public EquivalenceRule ruleFor(String canonicalName) {
        ParameterDefinition def = definitions.get(canonicalName);
        if (def == null) {
            throw new IllegalArgumentException("Not a canonical parameter name: " + canonicalName);
        }
        return def.getRule();
    }

    public boolean isRequired(String canonicalName) {
        ParameterDefinition def = definitions.get(canonicalName);
        return def != null && def.isRequired();
    }

    public boolean isSkipIfAbsent(String canonicalName) {
        ParameterDefinition def = definitions.get(canonicalName);
        return def != null && def.isSkipIfAbsent();
    }

    /**
     * Required parameter names in table order.
     */
    public List<String> getRequiredNames() {
        return requiredNames;
    }

    /**
     * All definitions in table order, which is the canonical comparison order.
     */
    public List<ParameterDefinition> getDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    public List<String> getSequenceNameParameters() {
        return sequenceNameParameters;
    }

    public int size() {
        return definitions.size();
    }

    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.replaceAll("[\\s_]+", "").toLowerCase();
    }

    private static final class DefaultHolder {
        private static final ParameterRegistry INSTANCE = loadDefault();

        private static ParameterRegistry loadDefault() {
            try (InputStream in = ParameterRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Bundled registry not found: " + DEFAULT_RESOURCE);
                }
                ParameterRegistry registry = load(in);
                log.info("Loaded {} parameter definitions ({} required)",
                        registry.size(), registry.getRequiredNames().size());
                return registry;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read bundled registry " + DEFAULT_RESOURCE, e);
            }
        }
    }
}
