package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class IrMetadata {

    String sourcePath;

    @Builder.Default
    String language = "java";

    String origin;

    @Builder.Default
    List<String> evidence = List.of();
}
