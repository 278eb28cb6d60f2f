package com.purchasingpower.synthflow.service.verification;

import lombok.Value;

@Value
public class VerificationResult {

    boolean verified;

    String message;

    public static VerificationResult verified() {
        return new VerificationResult(true, "verified");
    }

    public static VerificationResult refuted(String message) {
        return new VerificationResult(false, message);
    }
}
