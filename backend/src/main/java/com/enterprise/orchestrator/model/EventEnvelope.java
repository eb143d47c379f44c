package com.enterprise.orchestrator.model;

import com.enterprise.orchestrator.core.model.DocumentSubmittedEvent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire format of a record on the document stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventEnvelope {
    private String eventType;
    private String timestamp;
    private DocumentSubmittedEvent data;
}
