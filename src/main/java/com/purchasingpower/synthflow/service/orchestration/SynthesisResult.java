package com.purchasingpower.synthflow.service.orchestration;

import com.purchasingpower.synthflow.planner.Clause;
import com.purchasingpower.synthflow.service.constraint.ConstraintViolation;
import com.purchasingpower.synthflow.service.semantic.SemanticIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Final outcome of one synthesis run.
 *
 * <p>{@code code} holds the best candidate whenever any attempt produced code, including on
 * GENERATION_EXHAUSTED and CANCELLED.
 */
@Value
@Builder
public class SynthesisResult {

    SynthesisStatus status;

    String code;

    /** Blocking violations of the returned code. */
    @Builder.Default
    List<ConstraintViolation> violations = List.of();

    /** Non-blocking violations of the returned code. */
    @Builder.Default
    List<ConstraintViolation> warnings = List.of();

    @Builder.Default
    List<SemanticIssue> semanticIssues = List.of();

    int retriesUsed;

    @Builder.Default
    List<Double> candidateScores = List.of();

    @Builder.Default
    Map<String, String> holeAssignments = Map.of();

    @Builder.Default
    List<Clause> learnedClauses = List.of();

    /** Human-readable reason for a non-accepted status. */
    String message;

    public boolean isAccepted() {
        return status == SynthesisStatus.ACCEPTED;
    }
}
