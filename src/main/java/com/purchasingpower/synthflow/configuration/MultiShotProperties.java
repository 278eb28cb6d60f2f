package com.purchasingpower.synthflow.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class MultiShotProperties {

    /**
     * Use multi-shot selection as the generate phase when test cases are supplied.
     */
    private boolean enabled = true;

    @Min(0)
    private int candidates = 3;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperatureMin = 0.2;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperatureMax = 0.5;

    /**
     * Generations in flight at once. 1 keeps early exit exact: nothing past the first perfect candidate starts.
     */
    @Min(1)
    private int parallelism = 1;

    @Min(1)
    private int executorPoolSize = 4;

    /**
     * Temperature of a lone generation: the midpoint of the configured range.
     */
    public double singleShotTemperature() {
        return (temperatureMin + temperatureMax) / 2;
    }
}
