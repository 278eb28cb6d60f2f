package com.purchasingpower.synthflow.service.verification;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;

/**
 * Checks the assertions of a (partially) resolved IR, typically against an SMT backend.
 */
public interface AssertionVerifier {

    VerificationResult verify(IntermediateRepresentation ir);
}
