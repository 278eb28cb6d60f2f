package com.purchasingpower.synthflow.service.orchestration;

import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.model.CancellationSignal;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopSearchType;
import com.purchasingpower.synthflow.model.ir.EffectClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.Parameter;
import com.purchasingpower.synthflow.model.ir.SignatureClause;
import com.purchasingpower.synthflow.model.ir.TypedHole;
import com.purchasingpower.synthflow.planner.DomainCandidateProvider;
import com.purchasingpower.synthflow.planner.HoleResolutionPlanner;
import com.purchasingpower.synthflow.planner.PredicateConstraint;
import com.purchasingpower.synthflow.service.constraint.ConstraintDetectorImpl;
import com.purchasingpower.synthflow.service.constraint.ConstraintFilter;
import com.purchasingpower.synthflow.service.constraint.ConstraintValidatorImpl;
import com.purchasingpower.synthflow.service.constraint.ViolationFeedbackFormatter;
import com.purchasingpower.synthflow.service.execution.TestResult;
import com.purchasingpower.synthflow.service.repair.AstRepairerImpl;
import com.purchasingpower.synthflow.service.selection.MultiShotSelector;
import com.purchasingpower.synthflow.service.semantic.EffectChainAnalyzer;
import com.purchasingpower.synthflow.service.semantic.LogicErrorDetector;
import com.purchasingpower.synthflow.service.semantic.SemanticInterpreterImpl;
import com.purchasingpower.synthflow.service.verification.NoOpAssertionVerifier;
import com.purchasingpower.synthflow.telemetry.PlannerTelemetryStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Synthesis Service Tests")
class SynthesisServiceTest {

    private SynthesisProperties properties;
    private RetryOrchestratorTest.ScriptedGenerator generator;
    private SynthesisService service;

    @BeforeEach
    void setUp() {
        properties = new SynthesisProperties();
        generator = new RetryOrchestratorTest.ScriptedGenerator();
        ViolationFeedbackFormatter formatter = new ViolationFeedbackFormatter();

        MultiShotSelector selector = new MultiShotSelector(
                (code, methodName, testCases) -> testCases.stream()
                        .map(tc -> TestResult.builder().testCase(tc).passed(true).build())
                        .collect(Collectors.toList()),
                new TaskExecutorAdapter(Runnable::run), properties);
        RetryOrchestrator orchestrator = new RetryOrchestrator(generator, new AstRepairerImpl(),
                new ConstraintValidatorImpl(formatter), selector, formatter, properties);
        HoleResolutionPlanner planner = new HoleResolutionPlanner(new DomainCandidateProvider(),
                new PlannerTelemetryStream(properties), properties);

        service = new SynthesisService(new ConstraintDetectorImpl(), planner, new NoOpAssertionVerifier(),
                new SemanticInterpreterImpl(new EffectChainAnalyzer(), new LogicErrorDetector()),
                new ConstraintFilter(), orchestrator);
    }

    @Test
    @DisplayName("Detect, plan, interpret, filter and generate produce accepted code")
    void testSynthesize_WellFormedSpecification_ShouldAccept() {
        // Given
        generator.reply(RetryOrchestratorTest.GOOD_FIRST_MATCH);

        // When
        SynthesisResult result = service.synthesize(findFirstIr());

        // Then
        assertTrue(result.isAccepted(), "Expected ACCEPTED but got " + result.getStatus() + ": " + result.getMessage());
        assertEquals(Map.of("prefix", "a"), result.getHoleAssignments());
        assertEquals(0, result.getRetriesUsed());
        assertNotNull(result.getCode());

        IntermediateRepresentation generatedFrom = generator.contexts.get(0).getIr();
        assertTrue(generatedFrom.getEffects().get(1).getDescription().contains("starts with a"),
                "Generator should see the resolved IR");
        assertTrue(generatedFrom.getConstraints().stream()
                .anyMatch(c -> c instanceof LoopBehaviorConstraint loop
                        && loop.getSearchType() == LoopSearchType.FIRST_MATCH),
                "Detected loop constraint should reach the generator");
    }

    @Test
    @DisplayName("Caller hole constraints steer the plan")
    void testSynthesize_HoleConstraint_ShouldPickAllowedValue() {
        generator.reply(RetryOrchestratorTest.GOOD_FIRST_MATCH);
        PredicateConstraint notA = new PredicateConstraint("not-a", List.of("prefix"),
                values -> !"a".equals(values.get("prefix")));

        SynthesisResult result = service.synthesize(findFirstIr(), List.of(), List.of(notA), CancellationSignal.none());

        assertTrue(result.isAccepted());
        assertEquals(Map.of("prefix", "b"), result.getHoleAssignments());
        assertFalse(result.getLearnedClauses().isEmpty());
    }

    @Test
    @DisplayName("Over-constrained holes stop before generation")
    void testSynthesize_Unsatisfiable_ShouldNotGenerate() {
        PredicateConstraint never = new PredicateConstraint("never", List.of("prefix"), values -> false);

        SynthesisResult result = service.synthesize(findFirstIr(), List.of(), List.of(never), CancellationSignal.none());

        assertEquals(SynthesisStatus.UNSATISFIABLE, result.getStatus());
        assertNull(result.getCode());
        assertTrue(generator.contexts.isEmpty());
    }

    @Test
    @DisplayName("Running out of planner conflicts is not reported as over-constrained")
    void testSynthesize_PlannerBudgetExhausted_ShouldNotGenerate() {
        // Given: prefix=b is a solution, but the first conflict already exhausts the budget
        properties.getPlanner().setMaxConflicts(1);
        PredicateConstraint notA = new PredicateConstraint("not-a", List.of("prefix"),
                values -> !"a".equals(values.get("prefix")));

        // When
        SynthesisResult result = service.synthesize(findFirstIr(), List.of(), List.of(notA), CancellationSignal.none());

        // Then
        assertEquals(SynthesisStatus.PLANNING_BUDGET_EXHAUSTED, result.getStatus());
        assertTrue(result.getMessage().contains("budget"), result.getMessage());
        assertNull(result.getCode());
        assertTrue(generator.contexts.isEmpty());
    }

    @Test
    @DisplayName("Blocking semantic issues reject the specification before generation")
    void testSynthesize_ImplicitReturn_ShouldRejectSpecification() {
        IntermediateRepresentation ir = IntermediateRepresentation.builder()
                .signature(SignatureClause.builder()
                        .name("sumValues")
                        .returns("int")
                        .parameters(List.of(Parameter.builder().name("values").typeHint("int[]").build()))
                        .build())
                .effects(List.of(EffectClause.of("Sum all values")))
                .build();

        SynthesisResult result = service.synthesize(ir);

        assertEquals(SynthesisStatus.SPECIFICATION_REJECTED, result.getStatus());
        assertTrue(result.getSemanticIssues().stream().anyMatch(i -> i.getCategory().equals("implicit_return")));
        assertTrue(generator.contexts.isEmpty());
    }

    @Test
    @DisplayName("A cancelled run returns CANCELLED without generating")
    void testSynthesize_Cancelled_ShouldStop() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        SynthesisResult result = service.synthesize(findFirstIr(), List.of(), List.of(), cancellation);

        assertEquals(SynthesisStatus.CANCELLED, result.getStatus());
        assertTrue(generator.contexts.isEmpty());
    }

    private static IntermediateRepresentation findFirstIr() {
        TypedHole prefix = TypedHole.builder()
                .identifier("prefix")
                .typeHint("String")
                .candidateDomain(List.of("a", "b"))
                .build();
        return IntermediateRepresentation.builder()
                .signature(SignatureClause.builder()
                        .name("findFirst")
                        .returns("String")
                        .parameters(List.of(Parameter.builder().name("names").typeHint("List<String>").build()))
                        .build())
                .effects(List.of(
                        EffectClause.of("Iterate over the names"),
                        EffectClause.builder()
                                .description("Return the first name that starts with <?prefix?> immediately when found")
                                .holes(List.of(prefix))
                                .build(),
                        EffectClause.of("Otherwise return null")))
                .build();
    }
}
