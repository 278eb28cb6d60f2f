package com.purchasingpower.synthflow.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class PlannerProperties {

    @Min(1)
    private int maxConflicts = 10_000;

    @Min(1)
    private int telemetryBufferSize = 500;
}
