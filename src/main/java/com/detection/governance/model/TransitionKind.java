package com.detection.governance.model;

public enum TransitionKind {
    PHASE,
    MERGE
}
