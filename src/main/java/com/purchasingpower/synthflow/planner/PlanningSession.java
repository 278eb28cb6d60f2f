package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.model.CancellationSignal;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.telemetry.PlannerEvent;
import com.purchasingpower.synthflow.telemetry.PlannerEventType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * State of one planning run: the trail, the clause database and the learned clauses.
 *
 * <p>Each hole with an enumerable domain becomes one boolean variable per candidate value,
 * tied together by an at-least-one clause and pairwise at-most-one clauses. Learned clauses
 * take part in unit propagation. {@link HoleConstraint}s are checked at every propagation
 * fixpoint and turn into conflict clauses over the holes they blame.
 *
 * <p>Not thread-safe. A session is owned by a single {@code solve()} call and discarded with it.
 */
@Slf4j
public class PlanningSession {

    private final String runId;
    private final IntermediateRepresentation ir;
    private final Map<String, List<String>> domains;
    private final List<HoleConstraint> constraints;
    private final int maxConflicts;
    private final Consumer<PlannerEvent> listener;

    private final ImplicationGraph graph = new ImplicationGraph();
    private final List<Clause> clauses = new ArrayList<>();
    private final List<Clause> learned = new ArrayList<>();
    private final List<PlannerEvent> events = new ArrayList<>();
    private final Map<Integer, String> domainClauseHoles = new HashMap<>();

    private int decisions;
    private int conflicts;

    /**
     * @param domains candidate values per planned hole, in IR order
     */
    public PlanningSession(String runId,
                           IntermediateRepresentation ir,
                           Map<String, List<String>> domains,
                           List<HoleConstraint> constraints,
                           int maxConflicts,
                           Consumer<PlannerEvent> listener) {
        this.runId = runId;
        this.ir = ir;
        this.domains = Collections.unmodifiableMap(new LinkedHashMap<>(domains));
        this.constraints = List.copyOf(constraints);
        this.maxConflicts = maxConflicts;
        this.listener = listener;
        encodeDomains();
    }

    private void encodeDomains() {
        domains.forEach((hole, values) -> {
            Clause atLeastOne = addClause(values.stream().map(v -> Literal.is(hole, v)).collect(Collectors.toList()), false);
            domainClauseHoles.put(atLeastOne.getId(), hole);
            for (int i = 0; i < values.size(); i++) {
                for (int j = i + 1; j < values.size(); j++) {
                    Clause atMostOne = addClause(
                            List.of(Literal.isNot(hole, values.get(i)), Literal.isNot(hole, values.get(j))), false);
                    domainClauseHoles.put(atMostOne.getId(), hole);
                }
            }
        });
    }

    private Clause addClause(List<Literal> literals, boolean isLearned) {
        Clause clause = new Clause(clauses.size(), List.copyOf(literals), isLearned);
        clauses.add(clause);
        if (isLearned) {
            learned.add(clause);
        }
        return clause;
    }

    public PlanningResult solve(CancellationSignal cancellation) {
        while (true) {
            if (cancellation.isCancelled()) {
                emit(PlannerEventType.CANCELLED, null, null, "cancelled by caller");
                return stopped(PlanningStatus.CANCELLED, "cancelled by caller");
            }

            Optional<Conflict> conflict = propagate();
            if (conflict.isEmpty()) {
                conflict = detectConflict();
            }

            if (conflict.isPresent()) {
                conflicts++;
                emit(PlannerEventType.CONFLICT, null, conflict.get().toString(), conflict.get().getReason());

                if (conflictLevel(conflict.get()) == 0) {
                    String reason = "conflict at decision level 0: " + conflict.get().getReason();
                    emit(PlannerEventType.UNSATISFIABLE, null, conflict.get().toString(), reason);
                    return stopped(PlanningStatus.UNSATISFIABLE, reason);
                }
                if (conflicts >= maxConflicts) {
                    String reason = "conflict budget exhausted after " + conflicts + " conflicts";
                    emit(PlannerEventType.BUDGET_EXHAUSTED, null, null, reason);
                    return stopped(PlanningStatus.BUDGET_EXHAUSTED, reason);
                }

                Clause clause = learnClause(conflict.get());
                backjump(clause);
                continue;
            }

            if (decide().isEmpty()) {
                emit(PlannerEventType.SATISFIED, null, null, decisions + " decision(s), " + conflicts + " conflict(s)");
                return satisfied();
            }
        }
    }

    /**
     * Assigns the first value not yet ruled out to the first hole without a value, in IR order.
     *
     * @return the decided literal, empty when every hole is assigned
     */
    public Optional<Literal> decide() {
        for (Map.Entry<String, List<String>> entry : domains.entrySet()) {
            String hole = entry.getKey();
            if (valueOf(hole).isPresent()) {
                continue;
            }
            for (String value : entry.getValue()) {
                Literal literal = Literal.is(hole, value);
                if (graph.valueOf(literal) == null) {
                    graph.openLevel();
                    graph.addDecision(literal);
                    decisions++;
                    emit(PlannerEventType.DECIDE, literal.toString(), null, null);
                    return Optional.of(literal);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Unit propagation over domain and learned clauses, to a fixpoint.
     *
     * @return the first clause found with every literal false
     */
    public Optional<Conflict> propagate() {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Clause clause : clauses) {
                Literal unassigned = null;
                int unassignedCount = 0;
                boolean satisfied = false;
                for (Literal literal : clause.getLiterals()) {
                    Boolean value = graph.valueOf(literal);
                    if (value == null) {
                        unassigned = literal;
                        unassignedCount++;
                    } else if (value) {
                        satisfied = true;
                        break;
                    }
                }
                if (satisfied) {
                    continue;
                }
                if (unassignedCount == 0) {
                    return Optional.of(new Conflict(clause.getLiterals(),
                            clause.isLearned() ? "learned clause " + clause.getId() + " falsified"
                                    : "domain of " + domainClauseHoles.get(clause.getId()) + " exhausted"));
                }
                if (unassignedCount == 1) {
                    imply(unassigned, clause);
                    changed = true;
                }
            }
        }
        return Optional.empty();
    }

    private void imply(Literal literal, Clause reason) {
        int[] predecessors = reason.getLiterals().stream()
                .filter(l -> !l.equals(literal))
                .mapToInt(graph::nodeOf)
                .toArray();
        graph.addImplied(literal, reason.getId(), predecessors);
        emit(PlannerEventType.PROPAGATE, literal.toString(), reason.toString(), null);
    }

    /**
     * Checks registered constraints against the current assignment.
     *
     * @return a conflict negating the blamed holes' current values
     */
    public Optional<Conflict> detectConflict() {
        PartialAssignment snapshot = new PartialAssignment(ir, currentValues(), List.copyOf(domains.keySet()));
        for (HoleConstraint constraint : constraints) {
            Optional<ConflictReason> reason = constraint.check(snapshot);
            if (reason.isPresent()) {
                List<Literal> literals = reason.get().getHoleIds().stream()
                        .distinct()
                        .map(hole -> valueOf(hole).map(v -> Literal.isNot(hole, v)))
                        .flatMap(Optional::stream)
                        .collect(Collectors.toList());
                return Optional.of(new Conflict(literals, constraint.name() + ": " + reason.get().getExplanation()));
            }
        }
        return Optional.empty();
    }

    /**
     * First-UIP learning: resolves the conflict backwards along the trail until exactly one
     * literal of the conflict level remains.
     */
    public Clause learnClause(Conflict conflict) {
        int level = conflictLevel(conflict);
        if (level == 0) {
            throw new IllegalStateException("Cannot learn from a level 0 conflict");
        }
        if (level < graph.decisionLevel()) {
            // Constraint conflicts can surface above the level where they became true
            graph.truncateTo(level);
        }

        boolean[] seen = new boolean[graph.size()];
        List<Literal> lowerLevel = new ArrayList<>();
        int pending = 0;
        int[] frontier = conflict.getLiterals().stream().mapToInt(graph::nodeOf).toArray();
        int index = graph.size() - 1;
        int uip;

        while (true) {
            for (int node : frontier) {
                if (seen[node] || graph.levelAt(node) == 0) {
                    continue;
                }
                seen[node] = true;
                if (graph.levelAt(node) == level) {
                    pending++;
                } else {
                    lowerLevel.add(graph.literalAt(node).negate());
                }
            }
            while (!seen[index]) {
                index--;
            }
            uip = index;
            index--;
            pending--;
            if (pending == 0) {
                break;
            }
            frontier = graph.predecessorsOf(uip);
        }

        List<Literal> literals = new ArrayList<>();
        literals.add(graph.literalAt(uip).negate());
        literals.addAll(lowerLevel);
        Clause clause = addClause(literals, true);
        emit(PlannerEventType.LEARN, null, clause.toString(), "first UIP " + graph.literalAt(uip));
        return clause;
    }

    /**
     * Rewinds to the second-highest decision level in the clause, 0 for a unit clause.
     *
     * @return the level rewound to
     */
    public int backjump(Clause clause) {
        int highest = 0;
        int second = 0;
        for (Literal literal : clause.getLiterals()) {
            int level = graph.levelOf(literal);
            if (level > highest) {
                second = highest;
                highest = level;
            } else if (level > second && level < highest) {
                second = level;
            }
        }
        int from = graph.decisionLevel();
        int removed = graph.truncateTo(second);
        emit(PlannerEventType.BACKJUMP, null, clause.toString(),
                "level " + from + " -> " + second + ", " + removed + " assignment(s) undone");
        return second;
    }

    private int conflictLevel(Conflict conflict) {
        return conflict.getLiterals().stream().mapToInt(graph::levelOf).max().orElse(0);
    }

    public int decisionLevel() {
        return graph.decisionLevel();
    }

    public Optional<String> valueOf(String hole) {
        return domains.getOrDefault(hole, List.of()).stream()
                .filter(v -> Boolean.TRUE.equals(graph.valueOf(Literal.is(hole, v))))
                .findFirst();
    }

    public List<Clause> learnedClauses() {
        return List.copyOf(learned);
    }

    public List<PlannerEvent> events() {
        return List.copyOf(events);
    }

    private Map<String, String> currentValues() {
        Map<String, String> values = new LinkedHashMap<>();
        for (int node : graph.positiveNodes()) {
            Literal literal = graph.literalAt(node);
            values.put(literal.getHoleId(), literal.getValue());
        }
        return values;
    }

    private PlanningResult satisfied() {
        List<Assignment> assignments = graph.positiveNodes().stream()
                .map(node -> new Assignment(
                        graph.literalAt(node).getHoleId(),
                        graph.literalAt(node).getValue(),
                        graph.levelAt(node),
                        graph.antecedentOf(node)))
                .collect(Collectors.toList());
        Map<String, String> values = currentValues();
        return PlanningResult.builder()
                .status(PlanningStatus.SATISFIED)
                .assignments(assignments)
                .resolvedIr(PlaceholderSubstitution.apply(ir, values))
                .learnedClauses(learnedClauses())
                .events(events())
                .decisions(decisions)
                .conflicts(conflicts)
                .build();
    }

    private PlanningResult stopped(PlanningStatus status, String reason) {
        return PlanningResult.builder()
                .status(status)
                .learnedClauses(learnedClauses())
                .events(events())
                .decisions(decisions)
                .conflicts(conflicts)
                .reason(reason)
                .build();
    }

    private void emit(PlannerEventType type, String literal, String clause, String message) {
        PlannerEvent event = PlannerEvent.builder()
                .runId(runId)
                .sequence(events.size())
                .type(type)
                .decisionLevel(graph.decisionLevel())
                .literal(literal)
                .clause(clause)
                .message(message)
                .build();
        events.add(event);
        log.debug("{}", event);
        listener.accept(event);
    }
}
