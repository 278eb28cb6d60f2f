package com.purchasingpower.synthflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SynthFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(SynthFlowApplication.class, args);
    }
}
