package com.purchasingpower.synthflow.service.orchestration;

import com.purchasingpower.synthflow.service.constraint.ConstraintViolation;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What one pass through generate / repair / validate produced.
 */
@Value
@Builder
public class AttemptOutcome {

    /** One-based. */
    int attempt;

    /** Repaired source, null when generation failed. */
    String code;

    @Builder.Default
    List<ConstraintViolation> violations = List.of();

    /** Scores of the candidates generated in this attempt, empty for single-shot. */
    @Builder.Default
    List<Double> candidateScores = List.of();

    /** Test score of the selected candidate, 0 without tests. */
    double testScore;

    /** Set when the generator failed and there is no code. */
    String generationError;

    public boolean hasCode() {
        return code != null;
    }

    public boolean isAccepted() {
        return hasCode() && errorCount() == 0;
    }

    public long errorCount() {
        return violations.stream().filter(ConstraintViolation::isBlocking).count();
    }

    public List<ConstraintViolation> errors() {
        return violations.stream().filter(ConstraintViolation::isBlocking).collect(Collectors.toList());
    }

    public List<ConstraintViolation> warnings() {
        return violations.stream().filter(v -> !v.isBlocking()).collect(Collectors.toList());
    }
}
