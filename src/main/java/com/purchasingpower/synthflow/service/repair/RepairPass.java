package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;

/**
 * One deterministic structural fix.
 *
 * <p>A pass must not re-trigger on its own output, so running it twice changes nothing.
 */
public interface RepairPass {

    String name();

    /**
     * Applies the fix in place.
     *
     * @return true if the compilation unit was modified
     */
    boolean apply(CompilationUnit cu, RepairContext context);
}
