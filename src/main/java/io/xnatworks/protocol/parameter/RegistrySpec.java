/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of the parameter registry table.
 *
 * <pre>
 * sequence_name_parameters: [ProtocolName, SeriesDescription]
 * parameters:
 *   - name: RepetitionTime
 *     acronym: TR
 *     type: number
 *     unit: ms
 *     dicom_tag: "0018,0080"
 *     aliases: [TR, "Repetition Time"]
 *     xml_card: Routine
 *     required: true
 *     rule:
 *       type: tolerance
 *       tolerance: 0.01
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistrySpec {

    /**
     * Parameters consulted, in order, to name a sequence that was not given a name.
     */
    @JsonProperty("sequence_name_parameters")
    private List<String> sequenceNameParameters = new ArrayList<>();

    private List<ParameterSpec> parameters = new ArrayList<>();

    public List<String> getSequenceNameParameters() { return sequenceNameParameters; }
    public void setSequenceNameParameters(List<String> sequenceNameParameters) { this.sequenceNameParameters = sequenceNameParameters; }

    public List<ParameterSpec> getParameters() { return parameters; }
    public void setParameters(List<ParameterSpec> parameters) { this.parameters = parameters; }

    /**
     * One row of the registry table.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParameterSpec {
        private String name;
        private String acronym;

        /**
         * Type: number, string, symbol, vector
         */
        private String type = "string";

        private String unit;

        /**
         * DICOM tag as "gggg,eeee".
         */
        @JsonProperty("dicom_tag")
        private String dicomTag;

        private List<String> aliases = new ArrayList<>();

        @JsonProperty("allowed_values")
        private List<String> allowedValues = new ArrayList<>();

        /**
         * Card of a vendor XML export to read the value from when its label appears on several cards.
         */
        @JsonProperty("xml_card")
        private String xmlCard;

        private boolean required = false;

        /**
         * Skip the comparison, rather than report a mismatch, when either side lacks the value.
         */
        @JsonProperty("skip_if_absent")
        private boolean skipIfAbsent = false;

        private RuleSpec rule;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getAcronym() { return acronym; }
        public void setAcronym(String acronym) { this.acronym = acronym; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getUnit() { return unit; }
        public void setUnit(String unit) { this.unit = unit; }

        public String getDicomTag() { return dicomTag; }
        public void setDicomTag(String dicomTag) { this.dicomTag = dicomTag; }

        public List<String> getAliases() { return aliases; }
        public void setAliases(List<String> aliases) { this.aliases = aliases; }

        public List<String> getAllowedValues() { return allowedValues; }
        public void setAllowedValues(List<String> allowedValues) { this.allowedValues = allowedValues; }

        public String getXmlCard() { return xmlCard; }
        public void setXmlCard(String xmlCard) { this.xmlCard = xmlCard; }

        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }

        public boolean isSkipIfAbsent() { return skipIfAbsent; }
        public void setSkipIfAbsent(boolean skipIfAbsent) { this.skipIfAbsent = skipIfAbsent; }

        public RuleSpec getRule() { return rule; }
        public void setRule(RuleSpec rule) { this.rule = rule; }
    }

    /**
     * Equivalence rule of a row. Missing means exact.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleSpec {

        /**
         * Type: exact, tolerance, axis, set
         */
        private String type = "exact";

        private Double tolerance;

        /**
         * For axis and set rules: the interchangeable encodings, one list per class.
         */
        private List<List<String>> classes = new ArrayList<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public Double getTolerance() { return tolerance; }
        public void setTolerance(Double tolerance) { this.tolerance = tolerance; }

        public List<List<String>> getClasses() { return classes; }
        public void setClasses(List<List<String>> classes) { this.classes = classes; }
    }
}
