/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.imaging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ParseIssueRecord {

    private String sequenceName;
    private String message;

    public ParseIssueRecord() {
    }

    public ParseIssueRecord(String sequenceName, String message) {
        this.sequenceName = sequenceName;
        this.message = message;
    }

    @JsonProperty("sequence_name")
    public String getSequenceName() {
        return sequenceName;
    }

    public void setSequenceName(String sequenceName) {
        this.sequenceName = sequenceName;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
