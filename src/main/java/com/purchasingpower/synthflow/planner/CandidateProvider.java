package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.model.ir.TypedHole;

import java.util.List;
import java.util.Optional;

/**
 * Supplies the ordered values the planner may try for a hole.
 */
public interface CandidateProvider {

    /**
     * @return the candidate values in preference order; {@code Optional.empty()} when the hole
     *         has no enumerable domain and is left open for code generation. A present but empty
     *         list means no value is acceptable, which makes planning unsatisfiable.
     */
    Optional<List<String>> candidates(TypedHole hole);
}
