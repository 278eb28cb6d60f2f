package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AssertClause {

    String predicate;

    String rationale;

    @Builder.Default
    List<TypedHole> holes = List.of();

    public static AssertClause of(String predicate) {
        return AssertClause.builder().predicate(predicate).build();
    }
}
