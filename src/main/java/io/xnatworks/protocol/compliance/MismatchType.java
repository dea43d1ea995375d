/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.compliance;

/**
 * Why a parameter failed the comparison.
 */
public enum MismatchType {
    /** Both sides hold the parameter but the equivalence rule rejects the pair. */
    NOT_EQUIVALENT,
    MISSING_IN_FIRST,
    MISSING_IN_SECOND,
    MISSING_IN_BOTH,
    /** At least one side holds a value that could not be coerced and the raw texts differ. */
    UNCOERCED
}
