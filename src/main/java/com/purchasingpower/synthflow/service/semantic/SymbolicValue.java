package com.purchasingpower.synthflow.service.semantic;

import lombok.Builder;
import lombok.Value;

/**
 * A named value tracked through the effect chain.
 */
@Value
@Builder
public class SymbolicValue {

    public static final String ANY = "Any";

    String name;

    @Builder.Default
    String typeHint = ANY;

    ValueSource source;

    Integer effectIndex;

    public enum ValueSource {
        PARAMETER,
        COMPUTED
    }
}
