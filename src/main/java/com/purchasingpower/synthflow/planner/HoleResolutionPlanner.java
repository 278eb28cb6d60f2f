package com.purchasingpower.synthflow.planner;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.model.CancellationSignal;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.TypedHole;
import com.purchasingpower.synthflow.telemetry.PlannerTelemetryStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves typed holes by conflict-driven search.
 *
 * <p>Stateless: every {@link #solve} call builds its own {@link PlanningSession}, so learned
 * clauses never leak between runs and concurrent runs do not interfere.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoleResolutionPlanner {

    private final CandidateProvider candidateProvider;
    private final PlannerTelemetryStream telemetryStream;
    private final SynthesisProperties properties;

    public PlanningResult solve(IntermediateRepresentation ir, List<HoleConstraint> constraints) {
        return solve(ir, constraints, CancellationSignal.none());
    }

    public PlanningResult solve(IntermediateRepresentation ir,
                                List<HoleConstraint> constraints,
                                CancellationSignal cancellation) {
        PlanningSession session = newSession(ir, constraints);
        PlanningResult result = session.solve(cancellation);

        if (result.isSatisfied()) {
            log.info("✅ Planned {} hole(s) for {} in {} decision(s), {} conflict(s), {} learned clause(s)",
                    result.getAssignments().size(), methodName(ir), result.getDecisions(),
                    result.getConflicts(), result.getLearnedClauses().size());
        } else {
            log.warn("❌ Planning {} for {}: {}", result.getStatus(), methodName(ir), result.getReason());
        }
        return result;
    }

    /**
     * Builds a session without running it, for callers that want to step through
     * decide / propagate / learn / backjump themselves.
     */
    public PlanningSession newSession(IntermediateRepresentation ir, List<HoleConstraint> constraints) {
        Preconditions.checkNotNull(ir, "ir must not be null");
        Preconditions.checkNotNull(constraints, "constraints must not be null");

        Map<String, List<String>> domains = new LinkedHashMap<>();
        for (TypedHole hole : ir.typedHoles()) {
            if (domains.containsKey(hole.getIdentifier())) {
                continue;
            }
            Optional<List<String>> candidates = candidateProvider.candidates(hole);
            if (candidates.isPresent()) {
                domains.put(hole.getIdentifier(), candidates.get());
            } else {
                log.debug("Hole {} has no enumerable domain, leaving it open", hole.getIdentifier());
            }
        }

        String runId = UUID.randomUUID().toString().substring(0, 8);
        log.debug("🔵 Planning run {}: {} hole(s), {} constraint(s)", runId, domains.size(), constraints.size());
        return new PlanningSession(runId, ir, domains, constraints,
                properties.getPlanner().getMaxConflicts(), telemetryStream::publish);
    }

    private static String methodName(IntermediateRepresentation ir) {
        return ir.getSignature() == null ? "<unnamed>" : ir.getSignature().getName();
    }
}
