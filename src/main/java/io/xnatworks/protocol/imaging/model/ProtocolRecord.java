/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable form of an imaging protocol: nested maps, lists and primitives only,
 * so any generic serializer can store it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProtocolRecord {

    private String name;
    private List<SequenceRecord> sequences = new ArrayList<>();
    private List<ParseIssueRecord> parseIssues = new ArrayList<>();

    public ProtocolRecord() {
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @JsonProperty("sequences")
    public List<SequenceRecord> getSequences() {
        return sequences;
    }

    public void setSequences(List<SequenceRecord> sequences) {
        this.sequences = sequences;
    }

    @JsonProperty("parse_issues")
    public List<ParseIssueRecord> getParseIssues() {
        return parseIssues;
    }

    public void setParseIssues(List<ParseIssueRecord> parseIssues) {
        this.parseIssues = parseIssues;
    }
}
