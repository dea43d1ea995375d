/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import java.util.List;

/**
 * Direction encodings match when they name the same axis with compatible polarity.
 *
 * The sign is dropped to find the axis, so {@code j}, {@code j-} and {@code -j} all
 * resolve to the axis that also holds {@code COL} and {@code A >> P}. Single-letter
 * codes carry a polarity ({@code j} is the same as {@code j+}) and only match codes of
 * the same polarity. Codes without a sign such as {@code COL} or {@code A >> P} match
 * either polarity of their axis.
 */
public class AxisEquivalenceRule extends PartitionRule {

    public AxisEquivalenceRule(List<List<String>> classes) {
        super(classes);
    }

    @Override
    public RuleType getType() {
        return RuleType.AXIS_EQUIVALENCE;
    }

    @Override
    protected String key(String encoding) {
        String folded = EquivalenceRule.fold(encoding);
        if (folded.length() > 1 && isSign(folded.charAt(folded.length() - 1))) {
            folded = folded.substring(0, folded.length() - 1);
        }
        if (folded.length() > 1 && isSign(folded.charAt(0))) {
            folded = folded.substring(1);
        }
        return folded;
    }

    @Override
    protected boolean compare(ParameterValue a, ParameterValue b) {
        if (!super.compare(a, b)) {
            return false;
        }
        if (a.isNumeric()) {
            return true;
        }
        if (classOf(a.asText()) < 0) {
            return EquivalenceRule.fold(a.asText()).equals(EquivalenceRule.fold(b.asText()));
        }
        int left = polarity(a.asText());
        int right = polarity(b.asText());
        return left == 0 || right == 0 || left == right;
    }

    /**
     * @return -1 or +1 for a signed or single-letter code, 0 for a code without polarity
     */
    int polarity(String encoding) {
        String folded = EquivalenceRule.fold(encoding);
        if (folded.length() > 1) {
            char first = folded.charAt(0);
            char last = folded.charAt(folded.length() - 1);
            if (last == '-' || first == '-') {
                return -1;
            }
            if (last == '+' || first == '+') {
                return 1;
            }
        }
        return key(encoding).length() == 1 ? 1 : 0;
    }

    private static boolean isSign(char c) {
        return c == '-' || c == '+';
    }
}
