package com.detection.governance.exception;

import lombok.Getter;

/**
 * A new item could not be created because its id is already in use.
 */
@Getter
public class DuplicateItemIdException extends PreconditionFailedException {

    private final String itemId;

    public DuplicateItemIdException(String itemId) {
        super("Content item already exists with id: " + itemId);
        this.itemId = itemId;
    }
}
