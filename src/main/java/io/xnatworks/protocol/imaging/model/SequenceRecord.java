/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable form of one sequence.
 */
public class SequenceRecord {

    private String name;
    private boolean unnamed;
    private String sourceDescriptor;
    private List<ParameterRecord> parameters = new ArrayList<>();

    public SequenceRecord() {
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @JsonProperty("unnamed")
    public boolean isUnnamed() {
        return unnamed;
    }

    public void setUnnamed(boolean unnamed) {
        this.unnamed = unnamed;
    }

    @JsonProperty("source_descriptor")
    public String getSourceDescriptor() {
        return sourceDescriptor;
    }

    public void setSourceDescriptor(String sourceDescriptor) {
        this.sourceDescriptor = sourceDescriptor;
    }

    @JsonProperty("parameters")
    public List<ParameterRecord> getParameters() {
        return parameters;
    }

    public void setParameters(List<ParameterRecord> parameters) {
        this.parameters = parameters;
    }
}
