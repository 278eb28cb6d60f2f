package com.purchasingpower.synthflow.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetryProperties {

    /**
     * Retries after the first attempt. Total attempts are {@code maxRetries + 1}.
     */
    @Min(0)
    private int maxRetries = 3;
}
