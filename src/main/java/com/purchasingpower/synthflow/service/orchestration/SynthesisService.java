package com.purchasingpower.synthflow.service.orchestration;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.model.CancellationSignal;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.planner.AssertionConstraint;
import com.purchasingpower.synthflow.planner.HoleConstraint;
import com.purchasingpower.synthflow.planner.HoleResolutionPlanner;
import com.purchasingpower.synthflow.planner.PlanningResult;
import com.purchasingpower.synthflow.planner.PlanningStatus;
import com.purchasingpower.synthflow.service.constraint.ConstraintDetector;
import com.purchasingpower.synthflow.service.constraint.ConstraintFilter;
import com.purchasingpower.synthflow.service.execution.TestCase;
import com.purchasingpower.synthflow.service.semantic.SemanticInterpreter;
import com.purchasingpower.synthflow.service.semantic.SemanticIssue;
import com.purchasingpower.synthflow.service.verification.AssertionVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Single entry point of the pipeline: detect, plan, interpret, filter, then the retry loop.
 *
 * <p>Terminal outcomes before generation (UNSATISFIABLE, PLANNING_BUDGET_EXHAUSTED and SPECIFICATION_REJECTED)
 * are returned as statuses; nothing is retried with the same IR.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynthesisService {

    private final ConstraintDetector constraintDetector;
    private final HoleResolutionPlanner planner;
    private final AssertionVerifier assertionVerifier;
    private final SemanticInterpreter semanticInterpreter;
    private final ConstraintFilter constraintFilter;
    private final RetryOrchestrator retryOrchestrator;

    public SynthesisResult synthesize(IntermediateRepresentation ir) {
        return synthesize(ir, List.of(), List.of(), CancellationSignal.none());
    }

    public SynthesisResult synthesize(IntermediateRepresentation ir, List<TestCase> testCases) {
        return synthesize(ir, testCases, List.of(), CancellationSignal.none());
    }

    /**
     * @param holeConstraints constraints on hole values in addition to the assertion check
     */
    public SynthesisResult synthesize(IntermediateRepresentation ir,
                                      List<TestCase> testCases,
                                      List<HoleConstraint> holeConstraints,
                                      CancellationSignal cancellation) {
        Preconditions.checkNotNull(ir, "ir must not be null");
        Preconditions.checkNotNull(ir.getSignature(), "ir must have a signature");
        Preconditions.checkNotNull(testCases, "testCases must not be null");

        String methodName = ir.getSignature().getName();
        log.info("🔵 Synthesizing {} ({} effect(s), {} hole(s), {} test(s))",
                methodName, ir.getEffects().size(), ir.typedHoles().size(), testCases.size());

        IntermediateRepresentation detected = constraintDetector.detectAndApply(ir);

        List<HoleConstraint> constraints = new ArrayList<>(holeConstraints);
        constraints.add(new AssertionConstraint(assertionVerifier));
        PlanningResult plan = planner.solve(detected, constraints, cancellation);
        if (plan.getStatus() == PlanningStatus.CANCELLED) {
            return SynthesisResult.builder()
                    .status(SynthesisStatus.CANCELLED)
                    .learnedClauses(plan.getLearnedClauses())
                    .message(plan.getReason())
                    .build();
        }
        if (plan.getStatus() == PlanningStatus.UNSATISFIABLE) {
            return SynthesisResult.builder()
                    .status(SynthesisStatus.UNSATISFIABLE)
                    .learnedClauses(plan.getLearnedClauses())
                    .message("Specification is over-constrained: " + plan.getReason())
                    .build();
        }
        if (plan.getStatus() == PlanningStatus.BUDGET_EXHAUSTED) {
            return SynthesisResult.builder()
                    .status(SynthesisStatus.PLANNING_BUDGET_EXHAUSTED)
                    .learnedClauses(plan.getLearnedClauses())
                    .message("Hole planning gave up: " + plan.getReason())
                    .build();
        }

        IntermediateRepresentation resolved = plan.getResolvedIr();
        List<SemanticIssue> issues = semanticInterpreter.interpret(resolved);
        List<SemanticIssue> blocking = issues.stream().filter(SemanticIssue::isBlocking).collect(Collectors.toList());
        issues.stream().filter(i -> !i.isBlocking()).forEach(i -> log.warn("⚠️ {}", i));
        if (!blocking.isEmpty()) {
            blocking.forEach(i -> log.error("❌ {}", i));
            return SynthesisResult.builder()
                    .status(SynthesisStatus.SPECIFICATION_REJECTED)
                    .semanticIssues(issues)
                    .holeAssignments(plan.assignmentMap())
                    .learnedClauses(plan.getLearnedClauses())
                    .message(blocking.size() + " blocking semantic issue(s)")
                    .build();
        }

        IntermediateRepresentation applicable = constraintFilter.applyTo(resolved);
        RetryOutcome outcome = retryOrchestrator.run(applicable, testCases, cancellation);

        AttemptOutcome best = outcome.getBest();
        SynthesisResult result = SynthesisResult.builder()
                .status(outcome.getStatus())
                .code(best == null ? null : best.getCode())
                .violations(best == null ? List.of() : best.errors())
                .warnings(best == null ? List.of() : best.warnings())
                .semanticIssues(issues)
                .retriesUsed(outcome.getRetriesUsed())
                .candidateScores(outcome.getCandidateScores())
                .holeAssignments(plan.assignmentMap())
                .learnedClauses(plan.getLearnedClauses())
                .message(message(outcome))
                .build();

        log.info("{} Synthesis of {} finished: {} after {} retr{}",
                result.isAccepted() ? "✅" : "❌", methodName, result.getStatus(),
                result.getRetriesUsed(), result.getRetriesUsed() == 1 ? "y" : "ies");
        return result;
    }

    private static String message(RetryOutcome outcome) {
        return switch (outcome.getStatus()) {
            case ACCEPTED -> null;
            case CANCELLED -> "cancelled by caller";
            case GENERATION_EXHAUSTED -> outcome.getBest() == null
                    ? "no attempt produced code"
                    : "best candidate still has " + outcome.getBest().errorCount() + " blocking violation(s)";
            default -> outcome.getStatus().name();
        };
    }
}
