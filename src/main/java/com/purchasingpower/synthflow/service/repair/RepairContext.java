package com.purchasingpower.synthflow.service.repair;

import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopSearchType;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the repairer may know about the intended function.
 *
 * <p>All fields are optional. With an empty context only context-free passes run, on every method.
 */
@Value
@Builder
public class RepairContext {

    /** Target method; null means every method in the unit. */
    String methodName;

    @Builder.Default
    List<Constraint> constraints = List.of();

    public static RepairContext empty() {
        return RepairContext.builder().build();
    }

    public static RepairContext forIr(IntermediateRepresentation ir) {
        return RepairContext.builder()
                .methodName(ir.getSignature() == null ? null : ir.getSignature().getName())
                .constraints(ir.getConstraints())
                .build();
    }

    public boolean requiresFirstMatch() {
        return constraints.stream()
                .anyMatch(c -> c instanceof LoopBehaviorConstraint loop
                        && loop.getSearchType() == LoopSearchType.FIRST_MATCH);
    }

    public boolean targets(String candidateMethod) {
        return methodName == null || methodName.equals(candidateMethod);
    }
}
