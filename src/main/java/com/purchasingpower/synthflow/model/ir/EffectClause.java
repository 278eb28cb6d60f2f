package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One ordered, free-text side effect or step of the specified behavior.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EffectClause {

    String description;

    @Builder.Default
    List<TypedHole> holes = List.of();

    public static EffectClause of(String description) {
        return EffectClause.builder().description(description).build();
    }
}
