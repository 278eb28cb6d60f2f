package com.purchasingpower.synthflow.model.ir;

import com.purchasingpower.synthflow.model.constraint.Constraint;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Intermediate representation of a function specification.
 *
 * <p>Immutable. Attaching constraints or resolving holes always produces a new instance,
 * which lets the planner backtrack without undoing mutations.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class IntermediateRepresentation {

    IntentClause intent;

    SignatureClause signature;

    @Builder.Default
    List<EffectClause> effects = List.of();

    @Builder.Default
    List<AssertClause> assertions = List.of();

    @Builder.Default
    IrMetadata metadata = IrMetadata.builder().build();

    /**
     * Constraints in detection order. Duplicates are allowed.
     */
    @Builder.Default
    List<Constraint> constraints = List.of();

    /**
     * All typed holes: intent, signature, effects, then assertions.
     */
    public List<TypedHole> typedHoles() {
        List<TypedHole> holes = new ArrayList<>();
        if (intent != null) {
            holes.addAll(intent.getHoles());
        }
        if (signature != null) {
            holes.addAll(signature.getHoles());
        }
        effects.forEach(effect -> holes.addAll(effect.getHoles()));
        assertions.forEach(assertion -> holes.addAll(assertion.getHoles()));
        return holes;
    }

    public List<String> effectDescriptions() {
        return effects.stream()
                .map(EffectClause::getDescription)
                .collect(Collectors.toList());
    }

    public IntermediateRepresentation withConstraints(List<Constraint> replacement) {
        return toBuilder().constraints(List.copyOf(replacement)).build();
    }

    public IntermediateRepresentation withAdditionalConstraints(List<Constraint> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<Constraint> combined = new ArrayList<>(constraints);
        combined.addAll(extra);
        return withConstraints(combined);
    }
}
