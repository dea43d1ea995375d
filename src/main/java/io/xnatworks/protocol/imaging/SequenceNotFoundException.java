/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging;

/**
 * Thrown when a protocol has no sequence under the requested name.
 */
public class SequenceNotFoundException extends ProtocolException {
    private final String protocolName;
    private final String sequenceName;

    public SequenceNotFoundException(String protocolName, String sequenceName) {
        super("Sequence '" + sequenceName + "' not found in protocol " + protocolName);
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
