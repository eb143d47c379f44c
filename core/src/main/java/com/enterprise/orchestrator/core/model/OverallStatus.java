package com.enterprise.orchestrator.core.model;

import java.util.Arrays;

/**
 * Document-level lifecycle held on the status record.
 * <p>
 * pending → processing → aggregating → completed, with failed reachable from processing or
 * aggregating, and aggregating → processing as a recoverable backslide.
 */
public enum OverallStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    AGGREGATING("aggregating"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    OverallStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static OverallStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown overall status: " + value));
    }
}
