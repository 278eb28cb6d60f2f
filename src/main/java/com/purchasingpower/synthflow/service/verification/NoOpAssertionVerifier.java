package com.purchasingpower.synthflow.service.verification;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Used when no solver backend is wired. Accepts every IR.
 */
@Slf4j
@Component
public class NoOpAssertionVerifier implements AssertionVerifier {

    @Override
    public VerificationResult verify(IntermediateRepresentation ir) {
        log.debug("No assertion backend configured, accepting {} assertion(s)", ir.getAssertions().size());
        return VerificationResult.verified();
    }
}
