package com.purchasingpower.synthflow.service.orchestration;

/**
 * States of the retry loop.
 *
 * <pre>
 * GENERATE -> REPAIR -> VALIDATE -> ACCEPT
 *                                 \-> REFORMULATE -> GENERATE (while budget remains)
 * </pre>
 * A failed generation goes straight to REFORMULATE.
 */
public enum SynthesisPhase {
    GENERATE,
    REPAIR,
    VALIDATE,
    ACCEPT,
    REFORMULATE
}
