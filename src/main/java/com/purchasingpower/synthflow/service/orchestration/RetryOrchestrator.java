package com.purchasingpower.synthflow.service.orchestration;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.exception.CodeGenerationException;
import com.purchasingpower.synthflow.exception.SourceParseException;
import com.purchasingpower.synthflow.model.CancellationSignal;
import com.purchasingpower.synthflow.model.constraint.Severity;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.service.codegen.CodeGenerator;
import com.purchasingpower.synthflow.service.codegen.GenerationContext;
import com.purchasingpower.synthflow.service.codegen.RetryFeedback;
import com.purchasingpower.synthflow.service.constraint.ConstraintValidator;
import com.purchasingpower.synthflow.service.constraint.ConstraintViolation;
import com.purchasingpower.synthflow.service.constraint.ViolationFeedbackFormatter;
import com.purchasingpower.synthflow.service.constraint.ViolationType;
import com.purchasingpower.synthflow.service.execution.TestCase;
import com.purchasingpower.synthflow.service.repair.AstRepairer;
import com.purchasingpower.synthflow.service.repair.RepairContext;
import com.purchasingpower.synthflow.service.selection.GenerationCandidate;
import com.purchasingpower.synthflow.service.selection.MultiShotSelector;
import com.purchasingpower.synthflow.service.selection.SelectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drives generate, repair and validate until a candidate passes every blocking constraint or
 * the attempt budget runs out.
 *
 * <p>Expected failures (unparsable code, generator errors, violations) are attempt outcomes,
 * not exceptions. Each rejected attempt feeds structured feedback into the next prompt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryOrchestrator {

    private final CodeGenerator codeGenerator;
    private final AstRepairer astRepairer;
    private final ConstraintValidator constraintValidator;
    private final MultiShotSelector multiShotSelector;
    private final ViolationFeedbackFormatter feedbackFormatter;
    private final SynthesisProperties properties;

    public RetryOutcome run(IntermediateRepresentation ir, List<TestCase> testCases, CancellationSignal cancellation) {
        Preconditions.checkNotNull(ir, "ir must not be null");
        Preconditions.checkNotNull(ir.getSignature(), "ir must have a signature");

        int maxAttempts = properties.getRetry().getMaxRetries() + 1;
        RepairContext repairContext = RepairContext.forIr(ir);
        String methodName = ir.getSignature().getName();

        List<AttemptOutcome> attempts = new ArrayList<>();
        List<RetryFeedback> feedback = List.of();
        String previousCode = null;

        SynthesisPhase phase = SynthesisPhase.GENERATE;
        int attempt = 0;
        String code = null;
        List<Double> scores = List.of();
        double testScore = 0;
        AttemptOutcome outcome = null;

        while (true) {
            if (cancellation.isCancelled()) {
                log.warn("⚠️ Synthesis of {} cancelled before {} (attempt {})", methodName, phase, attempt);
                return new RetryOutcome(SynthesisStatus.CANCELLED, best(attempts), List.copyOf(attempts));
            }

            switch (phase) {
                case GENERATE -> {
                    attempt++;
                    log.info("🔵 Attempt {}/{} for {}", attempt, maxAttempts, methodName);
                    GenerationContext context = GenerationContext.builder()
                            .ir(ir)
                            .temperature(properties.getMultishot().singleShotTemperature())
                            .attempt(attempt)
                            .feedback(feedback)
                            .previousCode(previousCode)
                            .build();
                    try {
                        SelectionResult selection = generate(context, testCases, repairContext);
                        GenerationCandidate best = selection.getBest();
                        if (best.isFailed()) {
                            throw new CodeGenerationException("All candidates failed: " + best.getError(), methodName);
                        }
                        code = best.getSourceCode();
                        testScore = best.getScore();
                        scores = best.getTotalTests() > 0 ? selection.getCandidateScores() : List.of();
                        phase = SynthesisPhase.REPAIR;
                    } catch (CodeGenerationException e) {
                        log.warn("❌ Generation failed for {} on attempt {}: {}", methodName, attempt, e.getMessage());
                        outcome = AttemptOutcome.builder()
                                .attempt(attempt)
                                .generationError(e.getMessage())
                                .build();
                        attempts.add(outcome);
                        phase = SynthesisPhase.REFORMULATE;
                    }
                }
                case REPAIR -> {
                    code = astRepairer.repair(code, repairContext);
                    phase = SynthesisPhase.VALIDATE;
                }
                case VALIDATE -> {
                    List<ConstraintViolation> violations = validate(code, ir);
                    outcome = AttemptOutcome.builder()
                            .attempt(attempt)
                            .code(code)
                            .violations(violations)
                            .candidateScores(scores)
                            .testScore(testScore)
                            .build();
                    attempts.add(outcome);
                    outcome.warnings().forEach(w -> log.warn("⚠️ {}", w.toLogString()));
                    phase = outcome.isAccepted() ? SynthesisPhase.ACCEPT : SynthesisPhase.REFORMULATE;
                }
                case ACCEPT -> {
                    log.info("✅ Accepted {} on attempt {} ({} warning(s))",
                            methodName, attempt, outcome.warnings().size());
                    return new RetryOutcome(SynthesisStatus.ACCEPTED, outcome, List.copyOf(attempts));
                }
                case REFORMULATE -> {
                    if (outcome.hasCode()) {
                        log.info("❌ Attempt {} rejected:\n{}", attempt, feedbackFormatter.summary(outcome.getViolations()));
                    }
                    if (attempt >= maxAttempts) {
                        AttemptOutcome best = best(attempts);
                        log.warn("❌ Retry budget exhausted for {} after {} attempt(s)", methodName, attempt);
                        return new RetryOutcome(SynthesisStatus.GENERATION_EXHAUSTED, best, List.copyOf(attempts));
                    }
                    feedback = feedbackFor(outcome);
                    if (outcome.hasCode()) {
                        previousCode = outcome.getCode();
                    }
                    phase = SynthesisPhase.GENERATE;
                }
            }
        }
    }

    private SelectionResult generate(GenerationContext context, List<TestCase> testCases, RepairContext repairContext) {
        int candidates = properties.getMultishot().isEnabled() ? properties.getMultishot().getCandidates() : 0;
        if (candidates == 0 || testCases.isEmpty()) {
            String code = codeGenerator.generate(context);
            GenerationCandidate single = GenerationCandidate.builder()
                    .sourceCode(code)
                    .temperature(context.getTemperature())
                    .build();
            return new SelectionResult(single, List.of(single), false);
        }
        // Candidates are scored after repair so that repairable code is not ranked down
        return multiShotSelector.select(context.getIr(),
                (ir, temperature) -> astRepairer.repair(
                        codeGenerator.generate(context.toBuilder().temperature(temperature).build()),
                        repairContext),
                testCases,
                candidates);
    }

    private List<ConstraintViolation> validate(String code, IntermediateRepresentation ir) {
        try {
            return constraintValidator.validate(code, ir);
        } catch (SourceParseException e) {
            String detail = e.getProblems().isEmpty() ? e.getMessage() : e.getProblems().get(0);
            return List.of(ConstraintViolation.builder()
                    .type(ViolationType.SYNTAX_ERROR)
                    .severity(Severity.ERROR)
                    .message("Generated code does not parse: " + detail)
                    .suggestion(feedbackFormatter.suggestion(ViolationType.SYNTAX_ERROR, null))
                    .build());
        }
    }

    private static List<RetryFeedback> feedbackFor(AttemptOutcome outcome) {
        if (!outcome.hasCode()) {
            return List.of(RetryFeedback.generationError(outcome.getGenerationError()));
        }
        return outcome.errors().stream().map(RetryFeedback::from).collect(Collectors.toList());
    }

    /**
     * Fewest blocking violations, then highest test score, then the latest attempt.
     */
    static AttemptOutcome best(List<AttemptOutcome> attempts) {
        AttemptOutcome best = null;
        for (AttemptOutcome candidate : attempts) {
            if (!candidate.hasCode()) {
                continue;
            }
            if (best == null
                    || candidate.errorCount() < best.errorCount()
                    || (candidate.errorCount() == best.errorCount() && candidate.getTestScore() >= best.getTestScore())) {
                best = candidate;
            }
        }
        return best;
    }
}
