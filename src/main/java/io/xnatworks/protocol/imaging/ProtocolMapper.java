/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.xnatworks.protocol.imaging.model.ParameterRecord;
import io.xnatworks.protocol.imaging.model.ParseIssueRecord;
import io.xnatworks.protocol.imaging.model.ProtocolRecord;
import io.xnatworks.protocol.imaging.model.SequenceRecord;
import io.xnatworks.protocol.parameter.Parameter;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.parameter.ParameterValue;
import io.xnatworks.protocol.parameter.ValueKind;
import io.xnatworks.protocol.sequence.ImagingSequence;
import io.xnatworks.protocol.sequence.SequenceBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts protocols to and from their durable form.
 *
 * The durable form stores each value with its kind, so restoring a protocol
 * reproduces it exactly without running coercion again.
 */
public class ProtocolMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;
    private final ParameterRegistry registry;

    public ProtocolMapper() {
        this(ParameterRegistry.getDefault());
    }

    public ProtocolMapper(ParameterRegistry registry) {
        this.registry = registry;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ProtocolRecord toRecord(ImagingProtocol protocol) {
        ProtocolRecord record = new ProtocolRecord();
        record.setName(protocol.getName());
        for (ImagingSequence sequence : protocol.getSequences().values()) {
            record.getSequences().add(toRecord(sequence));
        }
        for (ParseIssue issue : protocol.getParseIssues()) {
            record.getParseIssues().add(new ParseIssueRecord(issue.getSequenceName(), issue.getMessage()));
        }
        return record;
    }

    public ImagingProtocol fromRecord(ProtocolRecord record) throws ProtocolException {
        if (record.getName() == null || record.getName().trim().isEmpty()) {
            throw new ProtocolParseException("Protocol record has no name");
        }
        ImagingProtocol protocol = new ImagingProtocol(record.getName(), registry);
        if (record.getSequences() != null) {
            for (SequenceRecord sequenceRecord : record.getSequences()) {
                if (sequenceRecord.getName() == null) {
                    throw new ProtocolParseException("Sequence record without a name in protocol " + record.getName());
                }
                protocol.addSequence(sequenceRecord.getName(), fromRecord(sequenceRecord));
            }
        }
        if (record.getParseIssues() != null) {
            for (ParseIssueRecord issue : record.getParseIssues()) {
                protocol.addParseIssue(new ParseIssue(issue.getSequenceName(),
                        issue.getMessage() != null ? issue.getMessage() : ""));
            }
        }
        return protocol;
    }

    /**
     * @return the protocol as nested maps, lists and primitives
     */
    public Map<String, Object> toMap(ImagingProtocol protocol) {
        return objectMapper.convertValue(toRecord(protocol), MAP_TYPE);
    }

    public ImagingProtocol fromMap(Map<String, ?> map) throws ProtocolException {
        ProtocolRecord record;
        try {
            record = objectMapper.convertValue(map, ProtocolRecord.class);
        } catch (IllegalArgumentException e) {
            throw new ProtocolParseException("Not a protocol record: " + e.getMessage(), e);
        }
        return fromRecord(record);
    }

    public String toJson(ImagingProtocol protocol) {
        try {
            return objectMapper.writeValueAsString(toRecord(protocol));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize protocol " + protocol.getName(), e);
        }
    }

    public ImagingProtocol fromJson(String json) throws ProtocolException {
        ProtocolRecord record;
        try {
            record = objectMapper.readValue(json, ProtocolRecord.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolParseException("Invalid protocol JSON: " + e.getOriginalMessage(), e);
        }
        return fromRecord(record);
    }

    private SequenceRecord toRecord(ImagingSequence sequence) {
        SequenceRecord record = new SequenceRecord();
        record.setName(sequence.getName());
        record.setUnnamed(sequence.isUnnamed());
        record.setSourceDescriptor(sequence.getSourceDescriptor());
        for (Parameter p : sequence.getParameters().values()) {
            record.getParameters().add(toRecord(p));
        }
        return record;
    }

    private ParameterRecord toRecord(Parameter parameter) {
        ParameterRecord record = new ParameterRecord();
        ParameterValue value = parameter.getValue();
        record.setName(parameter.getName());
        record.setKind(value.getKind().name());
        record.setUnit(parameter.getUnit());
        record.setRecognized(parameter.isRecognized());
        switch (value.getKind()) {
            case NUMBER:
                record.setNumber(value.getNumber());
                break;
            case VECTOR:
                List<Double> components = new ArrayList<>();
                for (double d : value.getVector()) {
                    components.add(d);
                }
                record.setVector(components);
                break;
            default:
                record.setText(value.asText());
                break;
        }
        return record;
    }

    private ImagingSequence fromRecord(SequenceRecord record) throws ProtocolParseException {
        SequenceBuilder builder = new SequenceBuilder(registry)
                .name(record.isUnnamed() ? null : record.getName())
                .source(record.getSourceDescriptor());
        if (record.getParameters() != null) {
            for (ParameterRecord p : record.getParameters()) {
                builder.putParameter(fromRecord(record.getName(), p));
            }
        }
        return builder.build();
    }

    private Parameter fromRecord(String sequenceName, ParameterRecord record) throws ProtocolParseException {
        if (record.getName() == null || record.getKind() == null) {
            throw new ProtocolParseException("Incomplete parameter record in sequence " + sequenceName);
        }
        ValueKind kind;
        try {
            kind = ValueKind.valueOf(record.getKind());
        } catch (IllegalArgumentException e) {
            throw new ProtocolParseException("Unknown value kind '" + record.getKind() + "' for " + record.getName(), e);
        }

        ParameterValue value;
        switch (kind) {
            case NUMBER:
                if (record.getNumber() == null) {
                    throw new ProtocolParseException("Number missing for " + record.getName());
                }
                value = ParameterValue.ofNumber(record.getNumber());
                break;
            case VECTOR:
                if (record.getVector() == null) {
                    throw new ProtocolParseException("Vector missing for " + record.getName());
                }
                double[] components = new double[record.getVector().size()];
                for (int i = 0; i < components.length; i++) {
                    components[i] = record.getVector().get(i);
                }
                value = ParameterValue.ofVector(components);
                break;
            case STRING:
                value = ParameterValue.ofString(textOf(record));
                break;
            case SYMBOL:
                value = ParameterValue.ofSymbol(textOf(record));
                break;
            case RAW:
                value = ParameterValue.raw(record.getText());
                break;
            default:
                throw new ProtocolParseException("Parameter " + record.getName() + " cannot be stored as " + kind);
        }
        return new Parameter(record.getName(), value, record.getUnit(), record.isRecognized());
    }

    private static String textOf(ParameterRecord record) throws ProtocolParseException {
        if (record.getText() == null) {
            throw new ProtocolParseException("Text missing for " + record.getName());
        }
        return record.getText();
    }
}
