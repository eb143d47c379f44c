package com.enterprise.orchestrator.core.store;

import lombok.Builder;
import lombok.Value;

/**
 * Optional fields written together with an overall status transition. Null fields are left untouched.
 */
@Value
@Builder
public class StatusUpdate {
    String resultKey;
    String errorMessage;
    String completedAt;

    public static StatusUpdate none() {
        return StatusUpdate.builder().build();
    }

    public static StatusUpdate error(String message) {
        return StatusUpdate.builder().errorMessage(message).build();
    }
}
