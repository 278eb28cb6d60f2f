package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.PositionConstraint;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Drops constraints that do not apply to the function being generated.
 *
 * <p>Loop constraints need loop-like effects. Position constraints need concrete code entities
 * ("@", "idx"), not semantic phrases ("the input string").
 */
@Slf4j
@Component
public class ConstraintFilter {

    private static final List<String> LOOP_INDICATORS = List.of(
            "iterate", "loop", "for each", "traverse", "while", "find", "search",
            "check all", "check each", "accumulate", "collect", "filter", "map");

    private static final int MAX_ENTITY_LENGTH = 20;

    public List<Constraint> filterApplicable(List<Constraint> constraints, IntermediateRepresentation ir) {
        String effects = ir.effectDescriptions().stream()
                .filter(d -> d != null)
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));

        List<Constraint> applicable = constraints.stream()
                .filter(c -> isApplicable(c, effects))
                .collect(Collectors.toList());

        if (applicable.size() < constraints.size()) {
            log.info("Filtered out {} non-applicable constraints", constraints.size() - applicable.size());
        }
        return applicable;
    }

    public IntermediateRepresentation applyTo(IntermediateRepresentation ir) {
        return ir.withConstraints(filterApplicable(ir.getConstraints(), ir));
    }

    private boolean isApplicable(Constraint constraint, String effects) {
        if (constraint instanceof LoopBehaviorConstraint) {
            return LOOP_INDICATORS.stream().anyMatch(effects::contains);
        }
        if (constraint instanceof PositionConstraint position) {
            return position.getElements().stream().allMatch(ConstraintFilter::isCodeEntity);
        }
        return true;
    }

    /**
     * Short tokens without spaces are treated as literal code entities.
     */
    static boolean isCodeEntity(String element) {
        return element != null
                && !element.isEmpty()
                && !element.contains(" ")
                && element.length() <= MAX_ENTITY_LENGTH;
    }
}
