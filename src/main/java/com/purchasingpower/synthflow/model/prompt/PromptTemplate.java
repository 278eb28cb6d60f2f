package com.purchasingpower.synthflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * YAML structure:
 * <pre>
 * name: constraint-code-generation
 * version: 1.0
 * systemPrompt: |
 *   You are an expert...
 * userPrompt: |
 *   Implement {{functionName}}...
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {

    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;
}
