package com.enterprise.orchestrator.core.model;

import java.util.Arrays;

public enum FileStatus {
    UPLOADED("uploaded"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static FileStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown file status: " + value));
    }
}
