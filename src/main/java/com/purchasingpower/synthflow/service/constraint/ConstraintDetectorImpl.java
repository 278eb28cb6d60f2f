package com.purchasingpower.synthflow.service.constraint;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.ConstraintType;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopRequirement;
import com.purchasingpower.synthflow.model.constraint.LoopSearchType;
import com.purchasingpower.synthflow.model.constraint.PositionConstraint;
import com.purchasingpower.synthflow.model.constraint.PositionRequirement;
import com.purchasingpower.synthflow.model.constraint.ReturnConstraint;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.SignatureClause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword and phrase based constraint detection.
 *
 * <p>Runs a fixed, ordered list of matchers over the lower-cased effect text. Each matcher
 * inspects the whole effect list and contributes zero or more constraints.
 *
 * <p><b>Thread Safety:</b> Stateless and thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ConstraintDetectorImpl implements ConstraintDetector {

    private static final List<String> RETURN_KEYWORDS = List.of(
            "return", "compute", "calculate", "count", "sum", "result", "output");

    private static final List<String> VALUE_NAMES = List.of(
            "count", "index", "sum", "total", "result", "value", "output", "answer");

    private static final String DEFAULT_VALUE_NAME = "result";

    private static final List<String> LOOP_KEYWORDS = List.of(
            "loop", "iterate", "iteration", "for each", "traverse", "walk through", "go through");

    private static final List<String> FIRST_KEYWORDS = List.of("first", "earliest", "initial");

    private static final List<String> LAST_KEYWORDS = List.of("last", "final");

    private static final List<String> ALL_KEYWORDS = List.of("all", "every", "each", "filter", "sum");

    private static final List<String> POSITION_KEYWORDS = List.of(
            "adjacent", "next to", "immediately after", "immediately before", "distance",
            "position", "placement", "between", "separated", "before", "after", "order");

    private static final Pattern LOOP_VARIABLE = Pattern.compile(
            "(?:for each|iterate over|iterate through|traverse)\\s+(?:the\\s+)?(?:\\w+\\s+in\\s+)?([a-z_][a-z0-9_]*)");

    private static final Pattern QUOTED_NOT_ADJACENT = Pattern.compile(
            "'([^']+)'.*?not\\s+(?:be\\s+)?adjacent.*?'([^']+)'");

    private static final Pattern QUOTED_BEFORE = Pattern.compile("'([^']+)'\\s+(?:must\\s+)?(?:appear\\s+|come\\s+)?before\\s+'([^']+)'");

    private final List<BiFunction<List<String>, SignatureClause, List<Constraint>>> matchers = List.of(
            (effects, signature) -> matchReturn(effects, signature).map(List::<Constraint>of).orElse(List.of()),
            (effects, signature) -> matchLoop(effects).map(List::<Constraint>of).orElse(List.of()),
            (effects, signature) -> matchPositions(effects)
    );

    @Override
    public List<Constraint> detect(List<String> effects, SignatureClause signature) {
        Preconditions.checkNotNull(effects, "Effects cannot be null");

        List<String> normalized = effects.stream()
                .filter(e -> e != null && !e.isBlank())
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        if (normalized.isEmpty()) {
            return List.of();
        }

        List<Constraint> detected = new ArrayList<>();
        for (BiFunction<List<String>, SignatureClause, List<Constraint>> matcher : matchers) {
            detected.addAll(matcher.apply(normalized, signature));
        }

        log.debug("Detected {} constraints from {} effects", detected.size(), normalized.size());
        return detected;
    }

    @Override
    public IntermediateRepresentation detectAndApply(IntermediateRepresentation ir) {
        Preconditions.checkNotNull(ir, "IR cannot be null");

        Set<ConstraintType> present = ir.getConstraints().stream()
                .map(Constraint::getType)
                .collect(Collectors.toSet());

        List<Constraint> additions = detect(ir.effectDescriptions(), ir.getSignature()).stream()
                .filter(c -> !present.contains(c.getType()))
                .collect(Collectors.toList());

        if (!additions.isEmpty()) {
            log.info("✅ Attached {} detected constraints: {}", additions.size(),
                    additions.stream().map(Constraint::getDescription).collect(Collectors.joining("; ")));
        }
        return ir.withAdditionalConstraints(additions);
    }

    /**
     * Return intent: non-void signature, compute vocabulary, and no return already stated in the effects.
     */
    private Optional<Constraint> matchReturn(List<String> effects, SignatureClause signature) {
        if (signature == null || !signature.declaresReturnValue()) {
            return Optional.empty();
        }

        String combined = String.join(" ", effects);
        if (RETURN_KEYWORDS.stream().noneMatch(combined::contains)) {
            return Optional.empty();
        }

        // An effect that already says "return" states the intent explicitly
        if (containsWord(combined, List.of("return", "returns"))) {
            return Optional.empty();
        }

        return Optional.of(ReturnConstraint.of(inferValueName(combined)));
    }

    private String inferValueName(String text) {
        for (String name : VALUE_NAMES) {
            if (containsWord(text, List.of(name))) {
                return name;
            }
        }
        return DEFAULT_VALUE_NAME;
    }

    /**
     * Loop intent. Loop vocabulary gates the search-type words so that "first validate the input"
     * never becomes a loop constraint.
     */
    private Optional<Constraint> matchLoop(List<String> effects) {
        String combined = String.join(" ", effects);
        if (LOOP_KEYWORDS.stream().noneMatch(combined::contains)) {
            return Optional.empty();
        }

        LoopSearchType searchType;
        LoopRequirement requirement;
        if (containsWord(combined, FIRST_KEYWORDS)) {
            searchType = LoopSearchType.FIRST_MATCH;
            requirement = LoopRequirement.EARLY_RETURN;
        } else if (containsWord(combined, LAST_KEYWORDS)) {
            searchType = LoopSearchType.LAST_MATCH;
            requirement = LoopRequirement.ACCUMULATE;
        } else if (containsWord(combined, ALL_KEYWORDS)) {
            searchType = LoopSearchType.ALL_MATCHES;
            requirement = LoopRequirement.ACCUMULATE;
        } else {
            return Optional.empty();
        }

        return Optional.of(LoopBehaviorConstraint.builder()
                .searchType(searchType)
                .requirement(requirement)
                .loopVariable(extractLoopVariable(effects))
                .build());
    }

    private String extractLoopVariable(List<String> effects) {
        for (String effect : effects) {
            Matcher matcher = LOOP_VARIABLE.matcher(effect);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private List<Constraint> matchPositions(List<String> effects) {
        String combined = String.join(" ", effects);
        if (POSITION_KEYWORDS.stream().noneMatch(combined::contains)) {
            return List.of();
        }

        Set<Constraint> found = new LinkedHashSet<>();

        if (combined.contains("email") || combined.contains("e-mail")) {
            found.add(PositionConstraint.builder()
                    .elements(List.of("@", "."))
                    .requirement(PositionRequirement.NOT_ADJACENT)
                    .minDistance(1)
                    .build());
        }

        if (combined.contains("parenthes") || combined.contains("bracket")) {
            found.add(PositionConstraint.builder()
                    .elements(List.of("(", ")"))
                    .requirement(PositionRequirement.ORDERED)
                    .build());
        }

        for (String effect : effects) {
            Matcher adjacent = QUOTED_NOT_ADJACENT.matcher(effect);
            if (adjacent.find()) {
                found.add(PositionConstraint.builder()
                        .elements(List.of(adjacent.group(1), adjacent.group(2)))
                        .requirement(PositionRequirement.NOT_ADJACENT)
                        .minDistance(1)
                        .build());
            }
            Matcher ordered = QUOTED_BEFORE.matcher(effect);
            if (ordered.find()) {
                found.add(PositionConstraint.builder()
                        .elements(List.of(ordered.group(1), ordered.group(2)))
                        .requirement(PositionRequirement.ORDERED)
                        .build());
            }
        }

        return new ArrayList<>(found);
    }

    private static boolean containsWord(String text, List<String> words) {
        for (String word : words) {
            if (Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
