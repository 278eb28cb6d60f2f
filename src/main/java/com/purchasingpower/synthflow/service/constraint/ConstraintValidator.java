package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;

import java.util.List;

/**
 * Checks generated source against the constraints attached to an IR.
 *
 * <p><b>Thread Safety:</b> Implementations must be stateless and thread-safe.
 *
 * @since 1.0.0
 */
public interface ConstraintValidator {

    /**
     * Validates generated code.
     *
     * @param sourceCode generated Java source (a compilation unit)
     * @param ir         IR whose signature names the target method and whose constraints are checked
     * @return one violation set per call, empty when every constraint holds
     * @throws com.purchasingpower.synthflow.exception.SourceParseException if the source does not parse
     */
    List<ConstraintViolation> validate(String sourceCode, IntermediateRepresentation ir);
}
