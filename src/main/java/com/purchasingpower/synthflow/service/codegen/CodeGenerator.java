package com.purchasingpower.synthflow.service.codegen;

import com.purchasingpower.synthflow.exception.CodeGenerationException;

/**
 * Produces Java source for an IR. The only component that talks to a model backend.
 *
 * <p>Implementations must be thread-safe: multi-shot selection calls them concurrently.
 */
public interface CodeGenerator {

    /**
     * @return the source of a compilation unit defining the method named by the IR signature
     * @throws CodeGenerationException when the backend fails or returns no usable code
     */
    String generate(GenerationContext context);
}
