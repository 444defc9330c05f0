package com.detection.governance.exception;

import com.detection.governance.model.DdlcPhase;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends GovernanceException {

    private final DdlcPhase currentPhase;
    private final DdlcPhase targetPhase;

    public InvalidTransitionException(DdlcPhase currentPhase, DdlcPhase targetPhase, String reason) {
        super(String.format("Cannot transition from %s to %s: %s",
                currentPhase.getValue(), targetPhase.getValue(), reason));
        this.currentPhase = currentPhase;
        this.targetPhase = targetPhase;
    }
}
