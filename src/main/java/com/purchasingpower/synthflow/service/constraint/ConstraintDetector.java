package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.SignatureClause;

import java.util.List;

/**
 * Derives structured constraints from natural-language effect descriptions.
 *
 * <p>Detection is fail-open: text without a recognizable pattern yields no constraint,
 * never an error.
 *
 * @since 1.0.0
 */
public interface ConstraintDetector {

    /**
     * Detects constraints from ordered effect descriptions.
     *
     * @param effects   effect descriptions in IR order
     * @param signature function signature, used for return-type context
     * @return detected constraints in detection order (possibly empty)
     */
    List<Constraint> detect(List<String> effects, SignatureClause signature);

    /**
     * Detects constraints for the IR and returns a copy with them appended.
     *
     * <p>A detected constraint is skipped when the IR already carries one of the same type.
     */
    IntermediateRepresentation detectAndApply(IntermediateRepresentation ir);
}
