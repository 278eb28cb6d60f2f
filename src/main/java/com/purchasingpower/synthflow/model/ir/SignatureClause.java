package com.purchasingpower.synthflow.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * Function signature the generated code must implement.
 *
 * <p>{@code name} is the method the validator looks for in generated source.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SignatureClause {

    private static final Set<String> VOID_TYPES = Set.of("void", "none", "null", "unit");

    String name;

    @Builder.Default
    List<Parameter> parameters = List.of();

    /**
     * Declared return type, null when the function returns nothing.
     */
    String returns;

    @Builder.Default
    List<TypedHole> holes = List.of();

    public boolean declaresReturnValue() {
        return returns != null
                && !returns.isBlank()
                && !VOID_TYPES.contains(returns.trim().toLowerCase());
    }
}
