package com.detection.governance.exception;

/**
 * Base type for every error the governance engine returns to its caller.
 */
public abstract class GovernanceException extends RuntimeException {

    protected GovernanceException(String message) {
        super(message);
    }

    protected GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
