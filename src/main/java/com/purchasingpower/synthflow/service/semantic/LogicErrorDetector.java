package com.purchasingpower.synthflow.service.semantic;

import com.purchasingpower.synthflow.model.constraint.PositionConstraint;
import com.purchasingpower.synthflow.model.constraint.PositionRequirement;
import com.purchasingpower.synthflow.model.constraint.Severity;
import com.purchasingpower.synthflow.model.ir.EffectClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Domain heuristics over the effect text. Everything here is a warning: the patterns are
 * common mistakes, not proof of one.
 */
@Component
public class LogicErrorDetector {

    static final List<String> LOOP_WORDS = List.of(
            "iterate", "loop", "for each", "traverse", "walk through", "go through", "while");

    private static final List<String> IMMEDIATE_WORDS = List.of("when", "if", "immediately", "as soon as");

    private static final List<String> FALLBACK_WORDS = List.of(
            "not found", "otherwise", "default", "-1", "none", "null", "else", "no match", "empty");

    private static final List<String> VALIDATION_WORDS = List.of("valid", "validate", "check", "verify", "ensure");

    public List<SemanticIssue> detectAll(IntermediateRepresentation ir) {
        String intent = intentText(ir);
        List<String> effects = ir.getEffects().stream()
                .map(EffectClause::getDescription)
                .map(d -> d == null ? "" : d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        String allEffects = String.join(" ", effects);

        List<SemanticIssue> issues = new ArrayList<>();
        if (LOOP_WORDS.stream().anyMatch(allEffects::contains)) {
            issues.addAll(detectLoopIssues(intent + " " + allEffects, effects, ir));
        }
        issues.addAll(detectInvalidValidation(intent, effects, allEffects));
        issues.addAll(detectUnreachableEffects(effects));
        issues.addAll(detectPositionOrdering(ir, allEffects));
        return issues;
    }

    /**
     * Termination and fallback checks for search loops.
     */
    List<SemanticIssue> detectLoopIssues(String text, List<String> effects, IntermediateRepresentation ir) {
        List<SemanticIssue> issues = new ArrayList<>();
        boolean immediateReturn = effects.stream().anyMatch(e ->
                (e.contains("return") && IMMEDIATE_WORDS.stream().anyMatch(e::contains))
                        || e.contains("break") || e.contains("stop"));

        if (containsWord(text, "first") && !immediateReturn) {
            issues.add(warning("loop_termination",
                    "Search for the FIRST match does not say the loop stops when found; it may return the LAST match",
                    "Add effect: 'Return immediately when the match is found'", null));
        }
        if (containsWord(text, "last") && immediateReturn && !containsWord(text, "first")) {
            issues.add(warning("off_by_one",
                    "Search for the LAST match returns immediately; it may return the FIRST match instead",
                    "Remove the immediate return, or store the position and return after the loop", null));
        }
        boolean search = text.contains("find") || text.contains("search") || containsWord(text, "first");
        boolean returnsValue = ir.getSignature() != null && ir.getSignature().declaresReturnValue();
        if (search && returnsValue && FALLBACK_WORDS.stream().noneMatch(text::contains)) {
            issues.add(warning("missing_fallback",
                    "Loop search does not say what to return when nothing matches",
                    "Add effect: 'Return -1 (or a default) if no element matches'", null));
        }
        return issues;
    }

    List<SemanticIssue> detectInvalidValidation(String intent, List<String> effects, String allEffects) {
        List<SemanticIssue> issues = new ArrayList<>();
        String subject = intent + " " + allEffects;
        if (VALIDATION_WORDS.stream().noneMatch(subject::contains)) {
            return issues;
        }

        if (subject.contains("email")) {
            boolean atCheck = allEffects.contains("@") || allEffects.contains("at sign");
            boolean dotCheck = allEffects.contains(".") || allEffects.contains("dot") || allEffects.contains("period");
            if (atCheck && dotCheck) {
                boolean ordered = effects.stream().anyMatch(e -> e.contains("after") && (e.contains("@") || e.contains("at")));
                if (!ordered) {
                    issues.add(warning("invalid_logic",
                            "Email validation checks for @ and . but not that the dot comes AFTER the @; "
                                    + "'test@.com' or 'test.@com' would be accepted",
                            "Add effect: 'Check that the dot position is after the @ position'", null));
                }
                if (effects.stream().noneMatch(e -> e.contains("domain") || e.contains("after @"))) {
                    issues.add(warning("invalid_logic",
                            "Email validation does not check the domain; 'test@domain.' would be accepted",
                            "Add effect: 'Check the domain has characters before and after the dot'", null));
                }
            } else if (atCheck) {
                issues.add(warning("invalid_logic",
                        "Email validation only checks for @, not for a dot; 'test@domain' would be accepted",
                        "Add effect: 'Check for a dot in the domain part after @'", null));
            } else if (dotCheck) {
                issues.add(warning("invalid_logic",
                        "Email validation only checks for a dot, not for @; 'test.domain.com' would be accepted",
                        "Add effect: 'Check for the @ symbol'", null));
            }
        }

        if (subject.contains("phone")
                && effects.stream().noneMatch(e -> e.contains("digit") || e.contains("number") || e.contains("length"))) {
            issues.add(warning("invalid_logic", "Phone validation does not check digits or length",
                    "Add effect: 'Check the phone number has only digits and the expected length'", null));
        }

        if (subject.contains("password") && effects.stream().noneMatch(e -> e.contains("length"))) {
            issues.add(warning("invalid_logic", "Password validation does not check a minimum length",
                    "Add effect: 'Check the password length is at least N characters'", null));
        }
        return issues;
    }

    /**
     * Effects after an unconditional return never execute.
     */
    List<SemanticIssue> detectUnreachableEffects(List<String> effects) {
        for (int i = 0; i < effects.size() - 1; i++) {
            String effect = effects.get(i);
            if (!EffectChainAnalyzer.isReturnEffect(effect)) {
                continue;
            }
            boolean conditional = List.of("if", "when", "else", "otherwise", "unless").stream()
                    .anyMatch(w -> containsWord(effect, w));
            if (!conditional) {
                return List.of(warning("unreachable_effect",
                        String.format("Effect %d returns a value, but %d effect(s) appear after it and will never execute",
                                i + 1, effects.size() - i - 1),
                        "Remove effects after the return, or make the return conditional", i));
            }
            return List.of();
        }
        return List.of();
    }

    /**
     * Multi-element position requirements should say how the elements are ordered or spaced.
     */
    List<SemanticIssue> detectPositionOrdering(IntermediateRepresentation ir, String allEffects) {
        List<SemanticIssue> issues = new ArrayList<>();
        boolean describesPlacement = List.of("after", "before", "order", "position", "adjacent", "distance", "between")
                .stream().anyMatch(allEffects::contains);
        ir.getConstraints().stream()
                .filter(PositionConstraint.class::isInstance)
                .map(PositionConstraint.class::cast)
                .filter(p -> p.getElements().size() > 1)
                .filter(p -> p.getRequirement() == PositionRequirement.ORDERED
                        || p.getRequirement() == PositionRequirement.NOT_ADJACENT)
                .filter(p -> !describesPlacement)
                .forEach(p -> issues.add(warning("position_ordering",
                        "Effects do not describe where " + String.join(" and ", p.getElements())
                                + " must appear relative to each other",
                        "Add effect stating the required order or spacing of the elements", null)));
        return issues;
    }

    private static String intentText(IntermediateRepresentation ir) {
        if (ir.getIntent() == null) {
            return "";
        }
        String summary = ir.getIntent().getSummary() == null ? "" : ir.getIntent().getSummary();
        String rationale = ir.getIntent().getRationale() == null ? "" : ir.getIntent().getRationale();
        return (summary + " " + rationale).toLowerCase(Locale.ROOT);
    }

    static boolean containsWord(String text, String word) {
        return text.matches("(?s).*\\b" + Pattern.quote(word) + "\\b.*");
    }

    private static SemanticIssue warning(String category, String message, String suggestion, Integer effectIndex) {
        return SemanticIssue.builder()
                .severity(Severity.WARNING)
                .category(category)
                .message(message)
                .suggestion(suggestion)
                .effectIndex(effectIndex)
                .build();
    }
}
