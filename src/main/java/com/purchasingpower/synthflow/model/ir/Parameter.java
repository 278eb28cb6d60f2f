package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Parameter {

    String name;

    String typeHint;

    String description;
}
