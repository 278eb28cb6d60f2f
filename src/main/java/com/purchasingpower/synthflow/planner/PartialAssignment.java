package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of the holes assigned so far, handed to {@link HoleConstraint}s.
 */
public final class PartialAssignment {

    private final IntermediateRepresentation ir;
    private final Map<String, String> values;
    private final List<String> plannedHoles;

    PartialAssignment(IntermediateRepresentation ir, Map<String, String> values, List<String> plannedHoles) {
        this.ir = ir;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.plannedHoles = List.copyOf(plannedHoles);
    }

    public Optional<String> valueOf(String holeId) {
        return Optional.ofNullable(values.get(holeId));
    }

    public boolean isAssigned(String holeId) {
        return values.containsKey(holeId);
    }

    public boolean assignsAll(Collection<String> holeIds) {
        return values.keySet().containsAll(holeIds);
    }

    /**
     * Every hole the planner is resolving, in IR order.
     */
    public List<String> plannedHoles() {
        return plannedHoles;
    }

    public boolean isComplete() {
        return assignsAll(plannedHoles);
    }

    public Map<String, String> values() {
        return values;
    }

    public Map<String, String> restrictTo(Collection<String> holeIds) {
        Map<String, String> restricted = new LinkedHashMap<>();
        holeIds.forEach(id -> restricted.put(id, values.get(id)));
        return restricted;
    }

    /**
     * The IR with every assigned placeholder substituted. Unassigned placeholders stay in place.
     */
    public IntermediateRepresentation resolve() {
        return PlaceholderSubstitution.apply(ir, values);
    }
}
