package com.purchasingpower.synthflow.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExecutionProperties {

    /**
     * Per test case wall-clock limit for generated code.
     */
    @Min(1)
    private long timeoutMs = 5000;
}
