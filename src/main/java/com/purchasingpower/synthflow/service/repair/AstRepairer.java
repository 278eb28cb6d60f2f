package com.purchasingpower.synthflow.service.repair;

/**
 * Deterministic, pattern-based repair of generated source. Never invokes generation.
 *
 * @since 1.0.0
 */
public interface AstRepairer {

    /**
     * Repairs source using only context-free passes.
     *
     * @return repaired source, or the input unchanged when nothing applies or it does not parse
     */
    String repair(String sourceCode);

    /**
     * Repairs source, enabling passes that depend on the target method and its constraints.
     */
    String repair(String sourceCode, RepairContext context);
}
