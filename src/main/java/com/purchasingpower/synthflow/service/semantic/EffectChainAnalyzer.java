package com.purchasingpower.synthflow.service.semantic;

import com.purchasingpower.synthflow.model.ir.EffectClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.Parameter;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Forward symbolic pass over the effect chain.
 *
 * <p>Parameters seed the trace. Each effect is classified by operation verb, may produce a named
 * value ("split text into words" produces {@code words}), and may denote the return.
 */
@Component
public class EffectChainAnalyzer {

    static final Map<String, List<String>> OPERATION_VERBS = new LinkedHashMap<>();

    static final Map<String, List<String>> TYPE_KEYWORDS = new LinkedHashMap<>();

    static final List<String> RETURN_KEYWORDS = List.of("return", "output", "yield", "give back", "send back");

    static {
        OPERATION_VERBS.put("split", List.of("split", "divide", "separate", "break"));
        OPERATION_VERBS.put("join", List.of("join", "combine", "concatenate", "merge"));
        OPERATION_VERBS.put("filter", List.of("filter", "select", "keep", "exclude"));
        OPERATION_VERBS.put("map", List.of("map", "transform", "convert", "apply"));
        OPERATION_VERBS.put("reduce", List.of("reduce", "aggregate", "accumulate"));
        OPERATION_VERBS.put("iterate", List.of("iterate", "loop", "traverse", "walk through", "go through"));
        OPERATION_VERBS.put("count", List.of("count", "tally", "sum", "total"));
        OPERATION_VERBS.put("calculate", List.of("calculate", "compute", "determine"));
        OPERATION_VERBS.put("check", List.of("check", "test", "verify", "validate"));
        OPERATION_VERBS.put("get", List.of("get", "retrieve", "fetch", "extract", "obtain"));
        OPERATION_VERBS.put("find", List.of("find", "search", "locate", "look for"));
        OPERATION_VERBS.put("return", RETURN_KEYWORDS);
        OPERATION_VERBS.put("if", List.of("if", "when", "in case"));
        OPERATION_VERBS.put("else", List.of("else", "otherwise"));

        TYPE_KEYWORDS.put("int", List.of("integer", "int", "number", "count", "index"));
        TYPE_KEYWORDS.put("str", List.of("string", "str", "text", "word"));
        TYPE_KEYWORDS.put("bool", List.of("boolean", "bool", "true", "false"));
        TYPE_KEYWORDS.put("float", List.of("float", "double", "decimal", "real number"));
        TYPE_KEYWORDS.put("list", List.of("list", "array", "collection", "elements"));
        TYPE_KEYWORDS.put("dict", List.of("dict", "dictionary", "map", "object"));
    }

    private static final Pattern INTO_VALUE = Pattern.compile("into\\s+(?:a\\s+)?(?:the\\s+)?(\\w+(?:\\s+\\w+)?)");

    private static final Pattern RETURNED_NAME = Pattern.compile(
            "(?:return|output|yield)\\s+(?:the\\s+|a\\s+|an\\s+)?(\\w+)");

    private static final Set<String> STOP_WORDS = Set.of("the", "a", "an", "this", "that", "new");

    public ExecutionTrace analyze(IntermediateRepresentation ir) {
        ExecutionTrace trace = new ExecutionTrace();

        if (ir.getSignature() != null) {
            for (Parameter parameter : ir.getSignature().getParameters()) {
                trace.addValue(SymbolicValue.builder()
                        .name(parameter.getName())
                        .typeHint(parameter.getTypeHint() == null ? SymbolicValue.ANY : parameter.getTypeHint())
                        .source(SymbolicValue.ValueSource.PARAMETER)
                        .build());
            }
        }

        List<EffectClause> effects = ir.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            String description = effects.get(i).getDescription();
            if (description != null) {
                analyzeEffect(description.toLowerCase(Locale.ROOT), i, trace);
            }
        }
        return trace;
    }

    private void analyzeEffect(String description, int index, ExecutionTrace trace) {
        OPERATION_VERBS.entrySet().stream()
                .filter(e -> e.getValue().stream().anyMatch(description::contains))
                .findFirst()
                .ifPresent(e -> trace.getOperations().add(e.getKey()));

        if (isReturnEffect(description)) {
            trace.setReturnValue(returnedValue(description, index, trace));
            return;
        }

        SymbolicValue produced = producedValue(description, index);
        if (produced != null) {
            trace.addValue(produced);
        }
    }

    static boolean isReturnEffect(String description) {
        return RETURN_KEYWORDS.stream().anyMatch(description::contains);
    }

    private SymbolicValue returnedValue(String description, int index, ExecutionTrace trace) {
        Matcher matcher = RETURNED_NAME.matcher(description);
        if (matcher.find()) {
            String name = matcher.group(1);
            if (trace.value(name).isPresent()) {
                return trace.value(name).get();
            }
        }
        return SymbolicValue.builder()
                .name("<return_value>")
                .typeHint(SymbolicValue.ANY)
                .source(SymbolicValue.ValueSource.COMPUTED)
                .effectIndex(index)
                .build();
    }

    private SymbolicValue producedValue(String description, int index) {
        Matcher into = INTO_VALUE.matcher(description);
        if (into.find()) {
            String phrase = into.group(1).trim();
            return computed(variableName(phrase), inferType(description + " " + phrase), index);
        }
        if (description.contains("count") && description.contains("the")) {
            return computed("count", "int", index);
        }
        if (description.contains("find")) {
            if (description.contains("index")) {
                return computed("index", "int", index);
            }
            if (description.contains("value")) {
                return computed("value", SymbolicValue.ANY, index);
            }
        }
        if (description.contains("calculate") || description.contains("compute")) {
            return computed("result", inferType(description + " result"), index);
        }
        return null;
    }

    private static SymbolicValue computed(String name, String type, int index) {
        return SymbolicValue.builder()
                .name(name)
                .typeHint(type)
                .source(SymbolicValue.ValueSource.COMPUTED)
                .effectIndex(index)
                .build();
    }

    private static String variableName(String phrase) {
        String name = Arrays.stream(phrase.split("\\s+"))
                .filter(w -> !STOP_WORDS.contains(w))
                .collect(Collectors.joining("_"))
                .replaceAll("[^\\w]", "");
        return name.isEmpty() ? "value" : name;
    }

    /**
     * Normalized type name ("int", "str", "list", ...) implied by the text, or {@code Any}.
     */
    static String inferType(String text) {
        for (Map.Entry<String, List<String>> entry : TYPE_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(text::contains)) {
                return entry.getKey();
            }
        }
        return SymbolicValue.ANY;
    }

    /**
     * Maps a declared Java (or loosely written) type to the normalized vocabulary of {@link #inferType}.
     */
    static String normalizeDeclaredType(String declared) {
        if (declared == null) {
            return SymbolicValue.ANY;
        }
        String type = declared.trim();
        String lower = type.toLowerCase(Locale.ROOT);
        if (type.endsWith("[]") || lower.startsWith("list") || lower.startsWith("arraylist")
                || lower.startsWith("collection") || lower.startsWith("set")) {
            return "list";
        }
        if (lower.startsWith("map") || lower.startsWith("hashmap") || lower.startsWith("dict")) {
            return "dict";
        }
        return switch (lower) {
            case "int", "integer", "long", "short", "byte" -> "int";
            case "string", "str", "char", "character", "charsequence" -> "str";
            case "boolean", "bool" -> "bool";
            case "double", "float", "bigdecimal", "number" -> "float";
            default -> SymbolicValue.ANY;
        };
    }

    static boolean typesCompatible(String expected, String actual) {
        if (expected.equals(actual) || SymbolicValue.ANY.equals(expected) || SymbolicValue.ANY.equals(actual)) {
            return true;
        }
        return expected.equals("float") && actual.equals("int");
    }
}
