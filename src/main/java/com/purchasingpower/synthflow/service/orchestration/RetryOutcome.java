package com.purchasingpower.synthflow.service.orchestration;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of the retry loop: the terminal status, the best attempt and the full history.
 */
@Value
public class RetryOutcome {

    SynthesisStatus status;

    /** Best attempt with code, null when no attempt produced any. */
    AttemptOutcome best;

    List<AttemptOutcome> attempts;

    public int getRetriesUsed() {
        return Math.max(0, attempts.size() - 1);
    }

    public List<Double> getCandidateScores() {
        return attempts.stream()
                .flatMap(a -> a.getCandidateScores().stream())
                .collect(Collectors.toList());
    }
}
