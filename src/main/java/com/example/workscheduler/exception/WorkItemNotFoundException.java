package com.example.workscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Work item does not exist or belongs to a different owner
 */
@Getter
public class WorkItemNotFoundException extends RuntimeException {

    private final String itemId;
    private final String ownerId;

    public WorkItemNotFoundException(UUID itemId, String ownerId) {
        super("Work item not found: " + itemId);
        this.itemId = itemId.toString();
        this.ownerId = ownerId;
    }
}
