package com.purchasingpower.synthflow.service.selection;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;

/**
 * Generates one candidate at a given temperature. Called from pool threads.
 */
@FunctionalInterface
public interface CandidateGenerator {

    String generate(IntermediateRepresentation ir, double temperature);
}
