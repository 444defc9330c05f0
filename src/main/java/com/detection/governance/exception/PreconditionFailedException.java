package com.detection.governance.exception;

public class PreconditionFailedException extends GovernanceException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
