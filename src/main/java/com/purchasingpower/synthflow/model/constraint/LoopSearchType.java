package com.purchasingpower.synthflow.model.constraint;

public enum LoopSearchType {
    FIRST_MATCH,
    LAST_MATCH,
    ALL_MATCHES
}
