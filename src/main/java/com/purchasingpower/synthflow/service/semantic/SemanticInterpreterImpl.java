package com.purchasingpower.synthflow.service.semantic;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.model.constraint.Severity;
import com.purchasingpower.synthflow.model.ir.AssertClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.Parameter;
import com.purchasingpower.synthflow.model.ir.SignatureClause;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks the effect chain symbolically and reports gaps between what the signature promises
 * and what the effects describe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticInterpreterImpl implements SemanticInterpreter {

    private static final List<String> RESULT_WORDS = List.of("result", "output", "computed", "calculated");

    private final EffectChainAnalyzer effectChainAnalyzer;
    private final LogicErrorDetector logicErrorDetector;

    @Override
    public List<SemanticIssue> interpret(IntermediateRepresentation ir) {
        Preconditions.checkNotNull(ir, "ir must not be null");

        ExecutionTrace trace = effectChainAnalyzer.analyze(ir);
        List<SemanticIssue> issues = new ArrayList<>();

        issues.addAll(checkReturn(ir.getSignature(), trace));
        issues.addAll(checkUnusedParameters(ir));
        issues.addAll(checkAssertionCoverage(ir, trace));
        issues.addAll(logicErrorDetector.detectAll(ir));

        List<SemanticIssue> unique = deduplicate(issues);
        long errors = unique.stream().filter(SemanticIssue::isBlocking).count();
        if (errors > 0) {
            log.warn("❌ Semantic pre-flight found {} blocking issue(s) in {}", errors, methodName(ir));
        } else {
            log.debug("✅ Semantic pre-flight passed for {} ({} warning(s))", methodName(ir), unique.size());
        }
        return unique;
    }

    List<SemanticIssue> checkReturn(SignatureClause signature, ExecutionTrace trace) {
        if (signature == null || !signature.declaresReturnValue()) {
            return List.of();
        }
        if (!trace.returnsValue()) {
            return List.of(SemanticIssue.builder()
                    .severity(Severity.ERROR)
                    .category("implicit_return")
                    .message(String.format("Signature declares return type '%s' but no effect returns a value",
                            signature.getReturns()))
                    .suggestion("Add an effect such as 'Return the computed " + signature.getReturns() + "'")
                    .build());
        }

        String expected = EffectChainAnalyzer.normalizeDeclaredType(signature.getReturns());
        String actual = trace.getReturnValue().getTypeHint();
        if (!EffectChainAnalyzer.typesCompatible(expected, actual)) {
            return List.of(SemanticIssue.builder()
                    .severity(Severity.WARNING)
                    .category("type_mismatch")
                    .message(String.format("Return value '%s' looks like %s but the signature declares %s",
                            trace.getReturnValue().getName(), actual, signature.getReturns()))
                    .suggestion("Align the returned value with the declared return type")
                    .effectIndex(trace.getReturnValue().getEffectIndex())
                    .build());
        }
        return List.of();
    }

    List<SemanticIssue> checkUnusedParameters(IntermediateRepresentation ir) {
        if (ir.getSignature() == null) {
            return List.of();
        }
        String mentioned = Stream.concat(
                        ir.effectDescriptions().stream(),
                        ir.getAssertions().stream().map(AssertClause::getPredicate))
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        List<SemanticIssue> issues = new ArrayList<>();
        for (Parameter parameter : ir.getSignature().getParameters()) {
            String name = parameter.getName();
            if (name != null && !LogicErrorDetector.containsWord(mentioned, name.toLowerCase(Locale.ROOT))) {
                issues.add(SemanticIssue.builder()
                        .severity(Severity.WARNING)
                        .category("unused_parameter")
                        .message("Parameter '" + name + "' is never used in effects or assertions")
                        .suggestion("Reference '" + name + "' in an effect, or remove it from the signature")
                        .build());
            }
        }
        return issues;
    }

    List<SemanticIssue> checkAssertionCoverage(IntermediateRepresentation ir, ExecutionTrace trace) {
        if (trace.returnsValue()) {
            return List.of();
        }
        Set<String> known = trace.getValues().keySet();
        List<SemanticIssue> issues = new ArrayList<>();
        for (AssertClause assertion : ir.getAssertions()) {
            String predicate = assertion.getPredicate() == null ? "" : assertion.getPredicate().toLowerCase(Locale.ROOT);
            boolean aboutResult = RESULT_WORDS.stream().anyMatch(predicate::contains);
            boolean namesKnownValue = known.stream()
                    .anyMatch(v -> LogicErrorDetector.containsWord(predicate, v.toLowerCase(Locale.ROOT)));
            if (aboutResult && !namesKnownValue) {
                issues.add(SemanticIssue.builder()
                        .severity(Severity.WARNING)
                        .category("assertion_coverage")
                        .message("Assertion '" + assertion.getPredicate()
                                + "' refers to a result that no effect produces")
                        .suggestion("Add an effect that computes and returns the asserted value")
                        .build());
            }
        }
        return issues;
    }

    private static List<SemanticIssue> deduplicate(List<SemanticIssue> issues) {
        Set<String> seen = new LinkedHashSet<>();
        return issues.stream()
                .filter(issue -> seen.add(issue.getCategory() + "|" + issue.getMessage()))
                .collect(Collectors.toList());
    }

    private static String methodName(IntermediateRepresentation ir) {
        return ir.getSignature() == null ? "<unnamed>" : ir.getSignature().getName();
    }
}
