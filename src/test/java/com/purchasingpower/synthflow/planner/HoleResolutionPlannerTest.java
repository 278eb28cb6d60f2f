package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.model.CancellationSignal;
import com.purchasingpower.synthflow.model.ir.EffectClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.SignatureClause;
import com.purchasingpower.synthflow.model.ir.TypedHole;
import com.purchasingpower.synthflow.service.verification.VerificationResult;
import com.purchasingpower.synthflow.telemetry.PlannerEvent;
import com.purchasingpower.synthflow.telemetry.PlannerEventType;
import com.purchasingpower.synthflow.telemetry.PlannerTelemetryStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hole Resolution Planner Tests")
class HoleResolutionPlannerTest {

    private SynthesisProperties properties;
    private PlannerTelemetryStream telemetryStream;
    private HoleResolutionPlanner planner;

    @BeforeEach
    void setUp() {
        properties = new SynthesisProperties();
        telemetryStream = new PlannerTelemetryStream(properties);
        planner = new HoleResolutionPlanner(new DomainCandidateProvider(), telemetryStream, properties);
    }

    @Test
    @DisplayName("Forbidden pair conflicts, learns a clause, backjumps to A's level and resolves B")
    void testSession_ForbiddenPair_ShouldLearnAndBackjump() {
        // Given
        IntermediateRepresentation ir = irWithHoles(Map.of(), "A", "B");
        PlanningSession session = planner.newSession(ir, List.of(ClauseConstraint.forbid("A", "1", "B", "1")));

        // When: A=1, B=1
        assertEquals(Optional.of(Literal.is("A", "1")), session.decide());
        assertTrue(session.propagate().isEmpty());
        assertEquals(Optional.of(Literal.is("B", "1")), session.decide());
        assertTrue(session.propagate().isEmpty());

        // Then: conflict
        Conflict conflict = session.detectConflict().orElseThrow();
        assertEquals(List.of(Literal.isNot("A", "1"), Literal.isNot("B", "1")), conflict.getLiterals());

        // Learned clause excludes exactly that pair
        Clause learned = session.learnClause(conflict);
        assertTrue(learned.isLearned());
        assertEquals(2, learned.getLiterals().size());
        assertTrue(learned.getLiterals().containsAll(List.of(Literal.isNot("A", "1"), Literal.isNot("B", "1"))));
        assertEquals("¬(B=1) ∨ ¬(A=1)", learned.toString());

        // Backjump undoes B's decision, keeps A's
        assertEquals(1, session.backjump(learned));
        assertEquals(1, session.decisionLevel());
        assertEquals(Optional.of("1"), session.valueOf("A"));
        assertEquals(Optional.empty(), session.valueOf("B"));

        // Replaying propagation does not re-derive the conflict
        assertTrue(session.propagate().isEmpty());
        assertTrue(session.detectConflict().isEmpty());
        assertEquals(Optional.of("2"), session.valueOf("B"));
        System.out.println("✅ Learned: " + learned);
    }

    @Test
    @DisplayName("Full solve of the forbidden pair emits the expected event sequence")
    void testSolve_ForbiddenPair_ShouldEmitEventsInOrder() {
        // Given
        IntermediateRepresentation ir = irWithHoles(Map.of(), "A", "B");

        // When
        PlanningResult result = planner.solve(ir, List.of(ClauseConstraint.forbid("A", "1", "B", "1")));

        // Then
        assertTrue(result.isSatisfied());
        assertEquals(Map.of("A", "1", "B", "2"), result.assignmentMap());
        assertEquals(1, result.getConflicts());
        assertEquals(2, result.getDecisions());
        assertEquals(1, result.getLearnedClauses().size());

        List<PlannerEventType> types = result.getEvents().stream().map(PlannerEvent::getType).collect(Collectors.toList());
        assertEquals(List.of(
                PlannerEventType.DECIDE, PlannerEventType.PROPAGATE,
                PlannerEventType.DECIDE, PlannerEventType.PROPAGATE,
                PlannerEventType.CONFLICT, PlannerEventType.LEARN, PlannerEventType.BACKJUMP,
                PlannerEventType.PROPAGATE, PlannerEventType.PROPAGATE,
                PlannerEventType.SATISFIED), types);

        Assignment a = result.getAssignments().get(0);
        assertTrue(a.isDecision());
        assertEquals(1, a.getDecisionLevel());
        Assignment b = result.getAssignments().stream().filter(x -> x.getHoleId().equals("B")).findFirst().orElseThrow();
        assertFalse(b.isDecision(), "B=2 should be implied, not decided");
    }

    @Test
    @DisplayName("Resolved IR has placeholders substituted")
    void testSolve_ShouldSubstitutePlaceholders() {
        IntermediateRepresentation ir = irWithHoles(Map.of(), "A", "B").toBuilder()
                .effects(List.of(EffectClause.builder()
                        .description("Pad with <?A?> then <?B: int?>")
                        .holes(holes("A", "B"))
                        .build()))
                .build();

        PlanningResult result = planner.solve(ir, List.of());

        assertEquals("Pad with 1 then 1", result.getResolvedIr().getEffects().get(0).getDescription());
        assertEquals("Pad with <?A?> then <?B: int?>", ir.getEffects().get(0).getDescription(),
                "Input IR must not be mutated");
    }

    @Test
    @DisplayName("Hole ids and values containing '=' stay distinct variables")
    void testSolve_EqualsSignInIdsAndValues_ShouldAssignEveryHole() {
        // Given: "a" = "b=c" and "a=b" = "c" both print as a=b=c
        IntermediateRepresentation ir = irWithHoles(
                Map.of("a", List.of("b=c"), "a=b", List.of("c")), "a", "a=b");

        // When
        PlanningResult result = planner.solve(ir, List.of());

        // Then
        assertTrue(result.isSatisfied());
        assertEquals(2, result.getAssignments().size(), "every planned hole needs its own assignment");
        assertEquals(Map.of("a", "b=c", "a=b", "c"), result.assignmentMap());
        assertNotEquals(Literal.is("a", "b=c").variable(), Literal.is("a=b", "c").variable());
    }

    @Test
    @DisplayName("A predicate that rejects every value is unsatisfiable")
    void testSolve_AlwaysRejecting_ShouldBeUnsatisfiable() {
        IntermediateRepresentation ir = irWithHoles(Map.of(), "A");
        PredicateConstraint never = new PredicateConstraint("never", List.of("A"), values -> false);

        PlanningResult result = planner.solve(ir, List.of(never));

        assertEquals(PlanningStatus.UNSATISFIABLE, result.getStatus());
        assertTrue(result.getReason().contains("level 0"), result.getReason());
        assertNull(result.getResolvedIr());
        assertEquals(PlannerEventType.UNSATISFIABLE,
                result.getEvents().get(result.getEvents().size() - 1).getType());
    }

    @Test
    @DisplayName("Conflict budget exhaustion is reported apart from unsatisfiability")
    void testSolve_ConflictBudgetExhausted_ShouldStop() {
        // Given: solvable with A=1, B=2, but only one conflict allowed
        properties.getPlanner().setMaxConflicts(1);

        // When
        PlanningResult result = planner.solve(irWithHoles(Map.of(), "A", "B"),
                List.of(ClauseConstraint.forbid("A", "1", "B", "1")));

        // Then
        assertEquals(PlanningStatus.BUDGET_EXHAUSTED, result.getStatus(),
                "a budget cutoff proves nothing about satisfiability");
        assertFalse(result.isSatisfied());
        assertTrue(result.getReason().contains("budget"), result.getReason());
        assertEquals(PlannerEventType.BUDGET_EXHAUSTED,
                result.getEvents().get(result.getEvents().size() - 1).getType());
    }

    @Test
    @DisplayName("Holes without a domain stay open; an explicitly empty domain is unsatisfiable")
    void testSolve_EmptyDomains() {
        // Open hole: no candidates declared
        IntermediateRepresentation open = IntermediateRepresentation.builder()
                .signature(SignatureClause.builder().name("f").build())
                .effects(List.of(EffectClause.builder()
                        .description("Use <?X?>")
                        .holes(List.of(TypedHole.builder().identifier("X").typeHint("int").build()))
                        .build()))
                .build();
        PlanningResult openResult = planner.solve(open, List.of());
        assertTrue(openResult.isSatisfied());
        assertTrue(openResult.getAssignments().isEmpty());
        assertEquals("Use <?X?>", openResult.getResolvedIr().getEffects().get(0).getDescription());

        // Explicitly empty candidate list
        HoleResolutionPlanner strict = new HoleResolutionPlanner(
                hole -> Optional.of(List.of()), telemetryStream, properties);
        PlanningResult strictResult = strict.solve(open, List.of());
        assertEquals(PlanningStatus.UNSATISFIABLE, strictResult.getStatus());
    }

    @Test
    @DisplayName("A cancelled signal stops planning before any decision")
    void testSolve_Cancelled_ShouldStop() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        PlanningResult result = planner.solve(irWithHoles(Map.of(), "A"), List.of(), cancellation);

        assertEquals(PlanningStatus.CANCELLED, result.getStatus());
        assertEquals(0, result.getDecisions());
        assertEquals(PlannerEventType.CANCELLED, result.getEvents().get(0).getType());
    }

    @Test
    @DisplayName("Refuted assertions steer the planner to another value")
    void testSolve_AssertionConstraint_ShouldSkipRefutedValue() {
        IntermediateRepresentation ir = irWithHoles(Map.of(), "A").toBuilder()
                .effects(List.of(EffectClause.builder()
                        .description("Offset by <?A?>")
                        .holes(holes("A"))
                        .build()))
                .build();
        AssertionConstraint assertions = new AssertionConstraint(resolved ->
                resolved.getEffects().get(0).getDescription().endsWith("1")
                        ? VerificationResult.refuted("offset 1 breaks the example")
                        : VerificationResult.verified());

        PlanningResult result = planner.solve(ir, List.of(assertions));

        assertEquals(Map.of("A", "2"), result.assignmentMap());
    }

    @Test
    @DisplayName("Events are published to the telemetry stream")
    void testSolve_ShouldPublishTelemetry() {
        List<PlannerEvent> received = new ArrayList<>();
        telemetryStream.events().subscribe(received::add);

        PlanningResult result = planner.solve(irWithHoles(Map.of(), "A", "B"),
                List.of(ClauseConstraint.forbid("A", "1", "B", "1")));

        assertEquals(result.getEvents().size(), received.size());
        assertEquals(result.getEvents(), telemetryStream.recentEvents(100));
        assertEquals(1, received.stream().map(PlannerEvent::getRunId).distinct().count());
    }

    @Test
    @DisplayName("Learned clauses do not leak between runs")
    void testSolve_Twice_ShouldNotShareLearnedClauses() {
        IntermediateRepresentation ir = irWithHoles(Map.of(), "A", "B");
        List<HoleConstraint> constraints = List.of(ClauseConstraint.forbid("A", "1", "B", "1"));

        PlanningResult first = planner.solve(ir, constraints);
        PlanningResult second = planner.solve(ir, constraints);

        assertEquals(first.getLearnedClauses(), second.getLearnedClauses());
        assertEquals(first.getConflicts(), second.getConflicts());
    }

    @Test
    @DisplayName("Solutions agree with brute-force enumeration on random instances")
    void testSolve_RandomInstances_ShouldMatchBruteForce() {
        Random random = new Random(42);

        for (int trial = 0; trial < 200; trial++) {
            // Given
            Map<String, List<String>> domains = new LinkedHashMap<>();
            int holeCount = 2 + random.nextInt(3);
            for (int h = 0; h < holeCount; h++) {
                int size = 1 + random.nextInt(3);
                List<String> values = new ArrayList<>();
                for (int v = 0; v < size; v++) {
                    values.add(String.valueOf(v));
                }
                domains.put("H" + h, values);
            }
            List<String> holeIds = new ArrayList<>(domains.keySet());
            List<HoleConstraint> constraints = randomConstraints(random, domains, holeIds);

            IntermediateRepresentation ir = irWithHoles(domains, holeIds.toArray(new String[0]));

            // When
            PlanningResult result = planner.solve(ir, constraints);

            // Then
            boolean solvable = bruteForce(domains, holeIds, 0, new LinkedHashMap<>(), constraints, ir);
            if (solvable) {
                assertTrue(result.isSatisfied(), "Trial " + trial + " should be satisfiable: " + result.getReason());
                assertEquals(holeIds.size(), result.getAssignments().size());
                assertTrue(satisfiesAll(result.assignmentMap(), constraints, ir, holeIds),
                        "Trial " + trial + " returned an assignment violating a constraint: " + result.assignmentMap());
            } else {
                assertEquals(PlanningStatus.UNSATISFIABLE, result.getStatus(), "Trial " + trial + " has no solution");
            }
        }
    }

    private static List<HoleConstraint> randomConstraints(Random random, Map<String, List<String>> domains, List<String> holeIds) {
        List<HoleConstraint> constraints = new ArrayList<>();
        int clauseCount = random.nextInt(5);
        for (int c = 0; c < clauseCount; c++) {
            String a = holeIds.get(random.nextInt(holeIds.size()));
            String b = holeIds.get(random.nextInt(holeIds.size()));
            if (a.equals(b)) {
                continue;
            }
            constraints.add(ClauseConstraint.forbid(a, pick(random, domains.get(a)), b, pick(random, domains.get(b))));
        }
        if (random.nextBoolean()) {
            List<String> scope = List.of(holeIds.get(0), holeIds.get(holeIds.size() - 1));
            constraints.add(new PredicateConstraint("even-sum", scope, values -> values.values().stream()
                    .mapToInt(Integer::parseInt)
                    .sum() % 2 == 0));
        }
        return constraints;
    }

    private static String pick(Random random, List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private static boolean bruteForce(Map<String, List<String>> domains, List<String> holeIds, int index,
                                      Map<String, String> partial, List<HoleConstraint> constraints,
                                      IntermediateRepresentation ir) {
        if (index == holeIds.size()) {
            return satisfiesAll(partial, constraints, ir, holeIds);
        }
        String hole = holeIds.get(index);
        for (String value : domains.get(hole)) {
            partial.put(hole, value);
            if (bruteForce(domains, holeIds, index + 1, partial, constraints, ir)) {
                partial.remove(hole);
                return true;
            }
            partial.remove(hole);
        }
        return false;
    }

    private static boolean satisfiesAll(Map<String, String> values, List<HoleConstraint> constraints,
                                        IntermediateRepresentation ir, List<String> holeIds) {
        PartialAssignment assignment = new PartialAssignment(ir, values, holeIds);
        return constraints.stream().allMatch(c -> c.check(assignment).isEmpty());
    }

    private static IntermediateRepresentation irWithHoles(Map<String, List<String>> domains, String... holeIds) {
        List<TypedHole> holes = new ArrayList<>();
        for (String id : holeIds) {
            holes.add(TypedHole.builder()
                    .identifier(id)
                    .typeHint("int")
                    .candidateDomain(domains.getOrDefault(id, List.of("1", "2")))
                    .build());
        }
        return IntermediateRepresentation.builder()
                .signature(SignatureClause.builder().name("pad").returns("String").holes(holes).build())
                .build();
    }

    private static List<TypedHole> holes(String... holeIds) {
        List<TypedHole> holes = new ArrayList<>();
        for (String id : holeIds) {
            holes.add(TypedHole.builder().identifier(id).typeHint("int").candidateDomain(List.of("1", "2")).build());
        }
        return holes;
    }
}
