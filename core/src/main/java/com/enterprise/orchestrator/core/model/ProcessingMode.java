package com.enterprise.orchestrator.core.model;

public enum ProcessingMode {
    SYNC,
    ASYNC;

    public String value() {
        return name().toLowerCase();
    }

    public static ProcessingMode fromValue(String value) {
        return value == null ? SYNC : valueOf(value.toUpperCase());
    }
}
