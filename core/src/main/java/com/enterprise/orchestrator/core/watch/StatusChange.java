package com.enterprise.orchestrator.core.watch;

import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import lombok.Builder;
import lombok.Value;

/**
 * One change-feed entry for the orchestrator table: the record kind (sort key) and the images of
 * the item before and after the mutation. Images are null where the feed carries none.
 */
@Value
@Builder
public class StatusChange {
    String eventName;
    String sortKey;
    DocumentStatusRecord before;
    DocumentStatusRecord after;
}
