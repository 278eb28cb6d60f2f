package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * An explicit, named unknown in the specification.
 *
 * <p>Holes are never mutated when resolved. The planner records the chosen value as an
 * assignment and builds a new IR with the placeholder substituted.
 *
 * <p>Placeholder syntax inside clause text: {@code <?identifier?>} or {@code <?identifier: type?>}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TypedHole {

    String identifier;

    String typeHint;

    String description;

    @Builder.Default
    HoleKind kind = HoleKind.IMPLEMENTATION;

    /**
     * Ordered candidate values. Empty means the hole has no enumerable domain.
     */
    @Builder.Default
    List<String> candidateDomain = List.of();

    public String label() {
        return "<?" + identifier + ": " + typeHint + "?>";
    }
}
