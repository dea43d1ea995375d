/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging;

import java.util.Objects;

/**
 * A sequence block that could not be parsed cleanly. The sequence name is null
 * when the block failed before its name was known.
 */
public final class ParseIssue {

    private final String sequenceName;
    private final String message;

    public ParseIssue(String sequenceName, String message) {
        this.sequenceName = sequenceName;
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getSequenceName() { return sequenceName; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseIssue)) return false;
        ParseIssue that = (ParseIssue) o;
        return Objects.equals(sequenceName, that.sequenceName) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceName, message);
    }

    @Override
    public String toString() {
        return (sequenceName != null ? sequenceName : "(unnamed block)") + ": " + message;
    }
}
