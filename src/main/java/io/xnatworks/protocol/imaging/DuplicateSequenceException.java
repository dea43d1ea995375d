/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging;

/**
 * Thrown when a sequence is added under a name the protocol already holds.
 * The existing sequence is left in place.
 */
public class DuplicateSequenceException extends ProtocolException {
    private final String protocolName;
    private final String sequenceName;

    public DuplicateSequenceException(String protocolName, String sequenceName) {
        super("Protocol " + protocolName + " already contains a sequence named '" + sequenceName + "'");
        this.protocolName = protocolName;
        this.sequenceName = sequenceName;
    }

    public String getProtocolName() {
        return protocolName;
    }

    public String getSequenceName() {
        return sequenceName;
    }
}
