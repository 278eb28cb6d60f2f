package com.purchasingpower.synthflow.service.semantic;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Symbolic state after a forward pass over the effects.
 *
 * <p>Built by one analysis call and discarded afterwards; not shared between threads.
 */
@Getter
public class ExecutionTrace {

    private final Map<String, SymbolicValue> values = new LinkedHashMap<>();

    private final List<String> operations = new ArrayList<>();

    @Setter
    private SymbolicValue returnValue;

    public void addValue(SymbolicValue value) {
        values.put(value.getName(), value);
    }

    public Optional<SymbolicValue> value(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean returnsValue() {
        return returnValue != null;
    }

    public List<SymbolicValue> computedValues() {
        return values.values().stream()
                .filter(v -> v.getSource() == SymbolicValue.ValueSource.COMPUTED)
                .collect(Collectors.toList());
    }
}
