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
 * Values match when they fall in the same class of a fixed partition,
 * e.g. vendor codes and display names of the same acceleration mode.
 */
public class SetMembershipRule extends PartitionRule {

    public SetMembershipRule(List<List<String>> classes) {
        super(classes);
    }

    @Override
    public RuleType getType() {
        return RuleType.SET_MEMBERSHIP;
    }
}
