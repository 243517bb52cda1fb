package com.diffreview.runtime;

import java.util.Locale;

public enum ReviewStyle {
    /** Free-text suggestions, one section per file. */
    SUGGESTIONS,
    /** One JSON review with explicit line comments. */
    STRUCTURED;

    public static ReviewStyle parse(String value) {
        if (value == null || value.isBlank()) {
            return STRUCTURED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown review style: " + value + " (expected suggestions or structured)", e);
        }
    }
}
