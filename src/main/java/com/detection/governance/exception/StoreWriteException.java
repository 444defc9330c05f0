package com.detection.governance.exception;

/**
 * A multi-item write failed part way. Items already written have been restored
 * before this is thrown.
 */
public class StoreWriteException extends GovernanceException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
