package com.vidnyan.qguard.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity levels for validation outcomes.
 */
public enum Severity {
    INFO("info"),          // Clean, nothing to report
    WARNING("warning"),    // Advisory only, query may proceed
    CRITICAL("critical");  // Query must not run

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
