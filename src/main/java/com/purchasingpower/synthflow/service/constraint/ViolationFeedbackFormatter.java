package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopRequirement;
import com.purchasingpower.synthflow.model.constraint.PositionConstraint;
import com.purchasingpower.synthflow.model.constraint.ReturnConstraint;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns constraints and violations into text an LLM can act on.
 *
 * <p>Two uses:
 * <ul>
 *   <li>{@link #hint(Constraint)}: proactive guidance placed in the first generation prompt
 *   <li>{@link #suggestion(ViolationType, Constraint)}: the "how to fix" attached to each violation
 * </ul>
 */
@Component
public class ViolationFeedbackFormatter {

    public String hint(Constraint constraint) {
        if (constraint instanceof ReturnConstraint returnConstraint) {
            return "MUST explicitly return the computed '" + returnConstraint.getExpectedValueName()
                    + "' value (never null)";
        }
        if (constraint instanceof LoopBehaviorConstraint loop) {
            return loop.getRequirement() == LoopRequirement.EARLY_RETURN
                    ? "MUST return from inside the loop as soon as the FIRST match is found"
                    : "MUST iterate ALL elements and accumulate results; return only after the loop";
        }
        if (constraint instanceof PositionConstraint position) {
            return "MUST check the positions of " + quoted(position.getElements())
                    + " (" + position.getDescription() + ")";
        }
        return constraint.getDescription();
    }

    public String suggestion(ViolationType type, Constraint constraint) {
        return switch (type) {
            case SYNTAX_ERROR -> "Return a single syntactically valid Java class; fix the reported syntax error";
            case MISSING_FUNCTION -> "Define the required method with the exact name from the signature";
            case RETURN_CONSTRAINT -> returnSuggestion((ReturnConstraint) constraint);
            case LOOP_CONSTRAINT -> loopSuggestion((LoopBehaviorConstraint) constraint);
            case POSITION_CONSTRAINT -> positionSuggestion((PositionConstraint) constraint);
        };
    }

    /**
     * Multi-violation summary for logs and for the feedback prompt.
     */
    public String summary(List<ConstraintViolation> violations) {
        if (violations.isEmpty()) {
            return "All constraints satisfied ✓";
        }

        List<ConstraintViolation> errors = violations.stream()
                .filter(ConstraintViolation::isBlocking)
                .collect(Collectors.toList());
        List<ConstraintViolation> warnings = violations.stream()
                .filter(v -> !v.isBlocking())
                .collect(Collectors.toList());

        StringBuilder sb = new StringBuilder();
        if (!errors.isEmpty()) {
            sb.append("Found ").append(errors.size()).append(" ERROR(s) - must fix before code can be accepted:\n");
            for (int i = 0; i < errors.size(); i++) {
                ConstraintViolation error = errors.get(i);
                sb.append(String.format("%d. [%s] %s%n   How to fix: %s%n",
                        i + 1, error.getType(), error.getMessage(), error.getSuggestion()));
            }
        }
        if (!warnings.isEmpty()) {
            sb.append("Found ").append(warnings.size()).append(" WARNING(s) - recommended to fix:\n");
            warnings.forEach(w -> sb.append("- ").append(w.getMessage()).append('\n'));
        }
        return sb.toString();
    }

    private String returnSuggestion(ReturnConstraint constraint) {
        String name = constraint.getExpectedValueName();
        return "Compute '" + name + "' in a local variable and end the method with 'return " + name + ";'";
    }

    private String loopSuggestion(LoopBehaviorConstraint constraint) {
        if (constraint.getRequirement() == LoopRequirement.EARLY_RETURN) {
            return "Put the return statement inside the loop (inside the matching if), e.g. "
                    + "'for (int i = 0; i < items.size(); i++) { if (matches(items.get(i))) { return i; } } return -1;'";
        }
        return "Accumulate matches in a variable or collection inside the loop and return it after the loop completes; "
                + "do not return from inside the loop";
    }

    private String positionSuggestion(PositionConstraint constraint) {
        List<String> elements = constraint.getElements();
        String first = elements.isEmpty() ? "a" : elements.get(0);
        String second = elements.size() < 2 ? "b" : elements.get(1);
        String lookup = "int first = text.indexOf(\"" + first + "\"); int second = text.indexOf(\"" + second + "\");";
        return switch (constraint.getRequirement()) {
            case NOT_ADJACENT -> "Locate both elements and check their distance: " + lookup
                    + " return Math.abs(second - first) > " + constraint.getMinDistance() + ";";
            case ORDERED -> "Locate both elements and compare their positions: " + lookup
                    + " return first != -1 && second != -1 && first < second;";
            case MIN_DISTANCE -> "Add the check Math.abs(second - first) >= " + constraint.getMinDistance();
            case MAX_DISTANCE -> "Add the check Math.abs(second - first) <= " + constraint.getMaxDistance();
        };
    }

    private static String quoted(List<String> elements) {
        return elements.stream().map(e -> "'" + e + "'").collect(Collectors.joining(" and "));
    }
}
