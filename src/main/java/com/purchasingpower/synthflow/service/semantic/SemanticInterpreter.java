package com.purchasingpower.synthflow.service.semantic;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;

import java.util.List;

/**
 * Pre-flight check of an IR before any code is generated.
 */
public interface SemanticInterpreter {

    /**
     * @return issues in discovery order, de-duplicated; ERROR issues block generation
     */
    List<SemanticIssue> interpret(IntermediateRepresentation ir);
}
