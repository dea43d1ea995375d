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
import java.util.List;

/**
 * Registry entry for one recognized parameter: its expected value kind, unit,
 * equivalence rule and comparison policy.
 */
public final class ParameterDefinition {

    private final String name;
    private final String acronym;
    private final ValueKind kind;
    private final String unit;
    private final int dicomTag;
    private final List<String> aliases;
    private final List<String> spellings;
    private final String xmlCard;
    private final boolean required;
    private final boolean skipIfAbsent;
    private final EquivalenceRule rule;

    ParameterDefinition(String name, String acronym, ValueKind kind, String unit, int dicomTag,
                        List<String> aliases, List<String> allowedValues, String xmlCard,
                        boolean required, boolean skipIfAbsent, EquivalenceRule rule) {
        this.name = name;
        this.acronym = acronym;
        this.kind = kind;
        this.unit = unit;
        this.dicomTag = dicomTag;
        this.aliases = Collections.unmodifiableList(new ArrayList<>(aliases));
        this.xmlCard = xmlCard;
        this.required = required;
        this.skipIfAbsent = skipIfAbsent;
        this.rule = rule;

        List<String> known = new ArrayList<>(allowedValues);
        if (rule instanceof PartitionRule) {
            for (List<String> members : ((PartitionRule) rule).getClasses()) {
                known.addAll(members);
            }
        }
        this.spellings = Collections.unmodifiableList(known);
    }

    /**
     * Build a definition from a registry table row.
     */
    static ParameterDefinition fromSpec(RegistrySpec.ParameterSpec spec) {
        if (spec.getName() == null || spec.getName().trim().isEmpty()) {
            throw new IllegalStateException("Registry row without a name");
        }
        String name = spec.getName().trim();
        ValueKind kind;
        EquivalenceRule rule;
        try {
            kind = ValueKind.fromConfig(spec.getType());
            rule = createRule(spec);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid registry row '" + name + "': " + e.getMessage(), e);
        }

        int tag = -1;
        if (spec.getDicomTag() != null && !spec.getDicomTag().trim().isEmpty()) {
            tag = DicomTags.parse(spec.getDicomTag());
            if (tag == -1) {
                throw new IllegalStateException("Invalid DICOM tag for '" + name + "': " + spec.getDicomTag());
            }
        }

        List<String> aliases = spec.getAliases() != null ? spec.getAliases() : Collections.<String>emptyList();
        List<String> allowed = spec.getAllowedValues() != null ? spec.getAllowedValues() : Collections.<String>emptyList();
        String xmlCard = spec.getXmlCard() != null && !spec.getXmlCard().trim().isEmpty()
                ? spec.getXmlCard().trim() : null;
        return new ParameterDefinition(name, spec.getAcronym(), kind, spec.getUnit(), tag,
                aliases, allowed, xmlCard, spec.isRequired(), spec.isSkipIfAbsent(), rule);
    }

    private static EquivalenceRule createRule(RegistrySpec.ParameterSpec spec) {
        RegistrySpec.RuleSpec ruleSpec = spec.getRule();
        if (ruleSpec == null) {
            return new ExactRule(spec.getAllowedValues());
        }

        switch (RuleType.fromConfig(ruleSpec.getType())) {
            case NUMERIC_TOLERANCE:
                if (ruleSpec.getTolerance() == null) {
                    throw new IllegalArgumentException("tolerance rule needs a tolerance");
                }
                return new NumericToleranceRule(ruleSpec.getTolerance());
            case AXIS_EQUIVALENCE:
                return new AxisEquivalenceRule(ruleSpec.getClasses());
            case SET_MEMBERSHIP:
                return new SetMembershipRule(ruleSpec.getClasses());
            case EXACT:
            default:
                return new ExactRule(spec.getAllowedValues());
        }
    }

    public String getName() { return name; }
    public String getAcronym() { return acronym; }
    public ValueKind getKind() { return kind; }
    public String getUnit() { return unit; }
    public List<String> getAliases() { return aliases; }
    public boolean isRequired() { return required; }
    public boolean isSkipIfAbsent() { return skipIfAbsent; }
    public EquivalenceRule getRule() { return rule; }

    /**
     * @return the preferred card of a vendor XML export, or null when none is declared
     */
    public String getXmlCard() { return xmlCard; }

    /**
     * @return the DICOM tag number, or -1 for parameters that only come from private headers or vendor exports
     */
    public int getDicomTag() { return dicomTag; }

    public boolean hasDicomTag() {
        return dicomTag != -1;
    }

    /**
     * Normalize a symbol against the known encodings.
     *
     * @return the registry's spelling when the folded symbol is listed, the trimmed symbol
     *         when the rule accepts it in another form (e.g. a signed axis code), or null
     *         when the symbol is not a valid encoding
     */
    public String canonicalSymbol(String symbol) {
        if (symbol == null || symbol.trim().isEmpty()) {
            return null;
        }
        String folded = EquivalenceRule.fold(symbol);
        for (String spelling : spellings) {
            if (EquivalenceRule.fold(spelling).equals(folded)) {
                return spelling;
            }
        }
        return rule.accepts(symbol) ? symbol.trim() : null;
    }

    @Override
    public String toString() {
        return String.format("ParameterDefinition{%s, %s, rule=%s%s}",
                name, kind, rule, required ? ", required" : "");
    }
}
