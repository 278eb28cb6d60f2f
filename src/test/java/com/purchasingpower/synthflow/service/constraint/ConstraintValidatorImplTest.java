package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.exception.SourceParseException;
import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopRequirement;
import com.purchasingpower.synthflow.model.constraint.LoopSearchType;
import com.purchasingpower.synthflow.model.constraint.PositionConstraint;
import com.purchasingpower.synthflow.model.constraint.PositionRequirement;
import com.purchasingpower.synthflow.model.constraint.ReturnConstraint;
import com.purchasingpower.synthflow.model.constraint.Severity;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.SignatureClause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Constraint Validator Tests")
class ConstraintValidatorImplTest {

    private static final LoopBehaviorConstraint FIRST_MATCH =
            LoopBehaviorConstraint.of(LoopSearchType.FIRST_MATCH, LoopRequirement.EARLY_RETURN);

    private static final LoopBehaviorConstraint ALL_MATCHES =
            LoopBehaviorConstraint.of(LoopSearchType.ALL_MATCHES, LoopRequirement.ACCUMULATE);

    private ConstraintValidatorImpl validator;

    @BeforeEach
    void setUp() {
        validator = new ConstraintValidatorImpl(new ViolationFeedbackFormatter());
    }

    @Test
    @DisplayName("Missing return against a 'count' return constraint gives one ERROR")
    void testValidate_NoReturn_ShouldReportSingleReturnError() {
        // Given
        String code = """
                public class Solution {
                    public int countItems(java.util.List<String> items) {
                        int count = 0;
                        for (String item : items) {
                            count++;
                        }
                    }
                }
                """;
        IntermediateRepresentation ir = ir("countItems", "int", ReturnConstraint.of("count"));

        // When
        List<ConstraintViolation> violations = validator.validate(code, ir);

        // Then
        assertEquals(1, violations.size(), "Expected exactly one violation: " + violations);
        ConstraintViolation violation = violations.get(0);
        assertEquals(Severity.ERROR, violation.getSeverity());
        assertEquals(ViolationType.RETURN_CONSTRAINT, violation.getType());
        assertInstanceOf(ReturnConstraint.class, violation.getConstraint());
        assertNotNull(violation.getSuggestion());
    }

    @Test
    @DisplayName("Returning a value derived from the expected name satisfies the return constraint")
    void testValidate_DerivedReturn_ShouldPass() {
        String code = """
                public class Solution {
                    public int countItems(java.util.List<String> items) {
                        int count = 0;
                        for (String item : items) {
                            count++;
                        }
                        int total = count;
                        return total;
                    }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code, ir("countItems", "int", ReturnConstraint.of("count")));

        assertTrue(violations.isEmpty(), "Derived return should satisfy constraint: " + violations);
    }

    @Test
    @DisplayName("A counter updated in place satisfies the return constraint under any name")
    void testValidate_IncrementedCounterWithOtherName_ShouldPass() {
        // Given
        String code = """
                public class Solution {
                    public int countVowels(String text) {
                        int vowels = 0;
                        for (char c : text.toCharArray()) {
                            if ("aeiou".indexOf(c) >= 0) {
                                vowels++;
                            }
                        }
                        return vowels;
                    }
                }
                """;
        String accumulated = """
                public class Solution {
                    public int countVowels(String text) {
                        int found = 0;
                        for (char c : text.toCharArray()) {
                            found += "aeiou".indexOf(c) >= 0 ? 1 : 0;
                        }
                        return found;
                    }
                }
                """;
        IntermediateRepresentation ir = ir("countVowels", "int", ReturnConstraint.of("count"));

        // When / Then
        assertTrue(validator.validate(code, ir).isEmpty(), "vowels++ is a computed count");
        assertTrue(validator.validate(accumulated, ir).isEmpty(), "found += ... is a computed count");
    }

    @Test
    @DisplayName("A for-loop index copied into a local is not a computed value")
    void testValidate_LoopIndexOnly_ShouldFail() {
        String code = """
                public class Solution {
                    public int countVowels(String text) {
                        int last = 0;
                        for (int i = 0; i < text.length(); i++) {
                            last = i;
                        }
                        return last;
                    }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code,
                ir("countVowels", "int", ReturnConstraint.of("count")));

        assertEquals(1, violations.size());
        assertEquals(ViolationType.RETURN_CONSTRAINT, violations.get(0).getType());
        assertTrue(violations.get(0).getMessage().contains("derived from 'count'"), violations.get(0).getMessage());
    }

    @Test
    @DisplayName("Returning only null violates the return constraint")
    void testValidate_ReturnNull_ShouldFail() {
        String code = """
                public class Solution {
                    public Integer total(int[] values) {
                        return null;
                    }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code, ir("total", "Integer", ReturnConstraint.of("result")));

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).getMessage().contains("null"));
    }

    @Test
    @DisplayName("First-match loop returning only after the loop is a violation")
    void testValidate_FirstMatchReturnAfterLoop_ShouldFail() {
        String code = """
                public class Solution {
                    public String findFirst(java.util.List<String> names) {
                        String found = null;
                        for (String name : names) {
                            if (name.startsWith("a")) {
                                found = name;
                            }
                        }
                        return found;
                    }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code, ir("findFirst", "String", FIRST_MATCH));

        assertEquals(1, violations.size(), "Loop without early return should be flagged");
        assertEquals(ViolationType.LOOP_CONSTRAINT, violations.get(0).getType());
    }

    @Test
    @DisplayName("First-match loop returning inside a nested if passes")
    void testValidate_FirstMatchReturnInsideIf_ShouldPass() {
        String code = """
                public class Solution {
                    public String findFirst(java.util.List<String> names) {
                        for (String name : names) {
                            if (name.startsWith("a")) {
                                return name;
                            }
                        }
                        return null;
                    }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code, ir("findFirst", "String", FIRST_MATCH));

        assertTrue(violations.isEmpty(), "Return nested in if inside loop is an early return: " + violations);
    }

    @Test
    @DisplayName("Stream findFirst counts as an early-exit loop")
    void testValidate_StreamFindFirst_ShouldPass() {
        String code = """
                public class Solution {
                    public String findFirst(java.util.List<String> names) {
                        return names.stream().filter(n -> n.startsWith("a")).findFirst().orElse(null);
                    }
                }
                """;

        assertTrue(validator.validate(code, ir("findFirst", "String", FIRST_MATCH)).isEmpty());
    }

    @Test
    @DisplayName("Accumulating loop that returns early is a violation")
    void testValidate_AccumulateWithEarlyReturn_ShouldFail() {
        String code = """
                public class Solution {
                    public int sumAll(int[] values) {
                        int sum = 0;
                        for (int v : values) {
                            sum += v;
                            if (sum > 100) {
                                return sum;
                            }
                        }
                        return sum;
                    }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code, ir("sumAll", "int", ALL_MATCHES));

        assertEquals(1, violations.size());
        assertEquals(ViolationType.LOOP_CONSTRAINT, violations.get(0).getType());
    }

    @Test
    @DisplayName("Missing target method gives a single MISSING_FUNCTION error")
    void testValidate_MissingMethod_ShouldReportMissingFunction() {
        String code = """
                public class Solution {
                    public int other() { return 1; }
                }
                """;

        List<ConstraintViolation> violations = validator.validate(code, ir("countItems", "int", ReturnConstraint.of("count")));

        assertEquals(1, violations.size());
        assertEquals(ViolationType.MISSING_FUNCTION, violations.get(0).getType());
        assertNull(violations.get(0).getConstraint());
    }

    @Test
    @DisplayName("Unparseable code raises SourceParseException")
    void testValidate_SyntaxError_ShouldThrow() {
        String code = "public class Solution { public int broken( { return 1; } }";

        assertThrows(SourceParseException.class,
                () -> validator.validate(code, ir("broken", "int", ReturnConstraint.of("result"))));
    }

    @Test
    @DisplayName("Adding constraints never removes violations")
    void testValidate_AddingConstraints_ShouldBeMonotonic() {
        // Given
        String code = """
                public class Solution {
                    public int countItems(java.util.List<String> items) {
                        int count = 0;
                        for (String item : items) {
                            count++;
                        }
                        return count;
                    }
                }
                """;
        List<Constraint> constraints = List.of(
                ReturnConstraint.of("count"),
                FIRST_MATCH,
                ALL_MATCHES,
                PositionConstraint.builder().elements(List.of("@", ".")).requirement(PositionRequirement.NOT_ADJACENT).build());

        // When / Then
        List<Constraint> growing = new ArrayList<>();
        int previous = 0;
        for (Constraint constraint : constraints) {
            growing.add(constraint);
            List<ConstraintViolation> violations = validator.validate(code,
                    ir("countItems", "int", growing.toArray(new Constraint[0])));
            assertTrue(violations.size() >= previous,
                    "Violation count dropped after adding " + constraint.getDescription());
            previous = violations.size();
        }
        assertEquals(2, previous, "FIRST_MATCH and the position heuristic should both fail");
    }

    @Test
    @DisplayName("Position heuristic accepts a lookup combined with distance arithmetic")
    void testValidate_PositionWithIndexArithmetic_ShouldPass() {
        String code = """
                public class Solution {
                    public boolean isValidEmail(String email) {
                        int at = email.indexOf('@');
                        int dot = email.lastIndexOf('.');
                        return at > 0 && dot - at > 1;
                    }
                }
                """;
        PositionConstraint position = PositionConstraint.builder()
                .elements(List.of("@", "."))
                .requirement(PositionRequirement.NOT_ADJACENT)
                .minDistance(1)
                .build();

        assertTrue(validator.validate(code, ir("isValidEmail", "boolean", position)).isEmpty());
    }

    @Test
    @DisplayName("Position heuristic flags code with no position lookup")
    void testValidate_PositionWithoutLookup_ShouldFail() {
        String code = """
                public class Solution {
                    public boolean isValidEmail(String email) {
                        return email.contains("@") && email.contains(".");
                    }
                }
                """;
        PositionConstraint position = PositionConstraint.builder()
                .elements(List.of("@", "."))
                .requirement(PositionRequirement.NOT_ADJACENT)
                .build();

        List<ConstraintViolation> violations = validator.validate(code, ir("isValidEmail", "boolean", position));

        assertEquals(1, violations.size());
        assertEquals(ViolationType.POSITION_CONSTRAINT, violations.get(0).getType());
        assertTrue(violations.get(0).getMessage().startsWith("Heuristic"));
    }

    private static IntermediateRepresentation ir(String name, String returns, Constraint... constraints) {
        return IntermediateRepresentation.builder()
                .signature(SignatureClause.builder().name(name).returns(returns).build())
                .constraints(List.of(constraints))
                .build();
    }
}
