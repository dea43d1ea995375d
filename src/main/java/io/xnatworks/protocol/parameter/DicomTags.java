/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

/**
 * Parsing and formatting of DICOM tag numbers ({@code (gggg,eeee)} as a 32-bit int).
 */
public final class DicomTags {

    private DicomTags() {
    }

    /**
     * Parse "0018,0080", "(0018,0080)" or "00180080".
     *
     * @return the tag number, or -1 when the text is not a tag
     */
    public static int parse(String tagSpec) {
        if (tagSpec == null) {
            return -1;
        }
        String spec = tagSpec.trim();
        if (spec.startsWith("(") && spec.endsWith(")")) {
            spec = spec.substring(1, spec.length() - 1).trim();
        }
        if (spec.isEmpty()) {
            return -1;
        }

        // Hex pair: "0018,0080"
        if (spec.contains(",")) {
            String[] parts = spec.split(",");
            if (parts.length != 2 || !isHex(parts[0].trim(), 4) || !isHex(parts[1].trim(), 4)) {
                return -1;
            }
            return Integer.parseInt(parts[0].trim(), 16) << 16 | Integer.parseInt(parts[1].trim(), 16);
        }

        // Packed: "00180080"
        if (spec.length() == 8 && isHex(spec, 8)) {
            return (int) Long.parseLong(spec, 16);
        }
        return -1;
    }

    public static String format(int tag) {
        return String.format("(%04X,%04X)", (tag >>> 16) & 0xFFFF, tag & 0xFFFF);
    }

    private static boolean isHex(String s, int maxLength) {
        if (s.isEmpty() || s.length() > maxLength) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
