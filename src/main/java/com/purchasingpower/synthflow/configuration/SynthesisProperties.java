package com.purchasingpower.synthflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.synthesis")
public class SynthesisProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MultiShotProperties multishot = new MultiShotProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PlannerProperties planner = new PlannerProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExecutionProperties execution = new ExecutionProperties();
}
