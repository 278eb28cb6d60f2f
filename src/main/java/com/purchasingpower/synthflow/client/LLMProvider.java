package com.purchasingpower.synthflow.client;

/**
 * Chat completion backend used by the code generator.
 *
 * Implementations handle provider-specific API details and must be safe to call from
 * several candidate threads at once.
 */
public interface LLMProvider {

    /**
     * Execute chat completion with the LLM.
     *
     * @param prompt      the rendered prompt
     * @param temperature sampling temperature for this call
     * @param caller      name of the calling component (for logging)
     * @return the raw response text
     */
    String chat(String prompt, double temperature, String caller);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
