package com.detection.governance.exception;

import lombok.Getter;

@Getter
public class ContentItemNotFoundException extends GovernanceException {

    private final String itemId;

    public ContentItemNotFoundException(String itemId) {
        super("Content item not found with id: " + itemId);
        this.itemId = itemId;
    }
}
