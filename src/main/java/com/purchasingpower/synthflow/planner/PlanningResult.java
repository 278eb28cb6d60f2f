package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.telemetry.PlannerEvent;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class PlanningResult {

    PlanningStatus status;

    /**
     * Final assignments in trail order. Empty unless satisfied.
     */
    @Builder.Default
    List<Assignment> assignments = List.of();

    /**
     * Input IR with every planned placeholder substituted. Null unless satisfied.
     */
    IntermediateRepresentation resolvedIr;

    @Builder.Default
    List<Clause> learnedClauses = List.of();

    @Builder.Default
    List<PlannerEvent> events = List.of();

    int decisions;

    int conflicts;

    /** Why planning stopped without a solution. */
    String reason;

    public boolean isSatisfied() {
        return status == PlanningStatus.SATISFIED;
    }

    public Map<String, String> assignmentMap() {
        Map<String, String> map = new LinkedHashMap<>();
        assignments.forEach(a -> map.put(a.getHoleId(), a.getValue()));
        return map;
    }
}
