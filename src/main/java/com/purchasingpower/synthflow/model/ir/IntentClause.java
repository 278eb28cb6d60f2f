package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class IntentClause {

    String summary;

    String rationale;

    @Builder.Default
    List<TypedHole> holes = List.of();
}
