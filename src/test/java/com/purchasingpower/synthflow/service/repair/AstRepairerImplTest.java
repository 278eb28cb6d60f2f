package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopRequirement;
import com.purchasingpower.synthflow.model.constraint.LoopSearchType;
import com.purchasingpower.synthflow.parser.JavaSourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST Repairer Tests")
class AstRepairerImplTest {

    private static final String NESTED_FALLBACK = """
            public class Solution {
                public int indexOf(int[] values, int target) {
                    for (int i = 0; i < values.length; i++) {
                        if (values[i] == target) {
                            return i;
                        }
                        return -1;
                    }
                }
            }
            """;

    private static final String TYPE_INTROSPECTION = """
            public class Solution {
                public String classify(Object value) {
                    return value.getClass().getSimpleName();
                }
            }
            """;

    private static final String NESTED_MIN_MAX = """
            public class Solution {
                public int[] minMax(int[] values) {
                    int min = values[0];
                    int max = values[0];
                    for (int v : values) {
                        if (v < min) {
                            min = v;
                            if (v > max) {
                                max = v;
                            }
                        }
                    }
                    return new int[] { min, max };
                }
            }
            """;

    private static final String IF_CHAIN_WITHOUT_ELSE = """
            public class Solution {
                public String grade(int score) {
                    if (score >= 90) {
                        return "A";
                    } else if (score >= 80) {
                        return "B";
                    }
                }
            }
            """;

    private static final String TRAILING_LOOP = """
            public class Solution {
                public int total(int[] values) {
                    int total = 0;
                    for (int v : values) {
                        total += v;
                    }
                }
            }
            """;

    private static final String ACCUMULATE_TO_LAST = """
            public class Solution {
                public int findIndex(int[] values, int target) {
                    int result = -1;
                    for (int i = 0; i < values.length; i++) {
                        if (values[i] == target) {
                            result = i;
                        }
                    }
                    return result;
                }
            }
            """;

    private static final String MISSING_IMPORTS = """
            public class Solution {
                public List<String> copy(List<String> input) {
                    List<String> out = new ArrayList<>(input);
                    return out;
                }
            }
            """;

    private static final String EMAIL_ORDERING = """
            public class Solution {
                public static boolean isValidEmail(String email) {
                    if (!email.contains("@")) {
                        return false;
                    }
                    if (email.indexOf('@') > email.lastIndexOf('.')) {
                        return false;
                    }
                    return true;
                }

                public static boolean isValidMirrored(String email) {
                    if (email.lastIndexOf(".") < email.indexOf("@")) return false;
                    return email.length() > 3;
                }
            }
            """;

    private static final RepairContext FIRST_MATCH_CONTEXT = RepairContext.builder()
            .methodName("findIndex")
            .constraints(List.of(LoopBehaviorConstraint.of(LoopSearchType.FIRST_MATCH, LoopRequirement.EARLY_RETURN)))
            .build();

    private AstRepairerImpl repairer;

    @BeforeEach
    void setUp() {
        repairer = new AstRepairerImpl();
    }

    @Test
    @DisplayName("Fallback return nested in a search loop moves after the loop")
    void testRepair_NestedFallbackReturn_ShouldMoveAfterLoop() {
        // When
        String repaired = repairer.repair(NESTED_FALLBACK);

        // Then
        NodeList<Statement> body = bodyOf(repaired, "indexOf");
        assertEquals(2, body.size(), "Expected loop followed by fallback return:\n" + repaired);
        assertTrue(body.get(0).isForStmt());
        assertEquals("return -1;", body.get(1).toString());

        NodeList<Statement> loopBody = body.get(0).asForStmt().getBody().asBlockStmt().getStatements();
        assertEquals(1, loopBody.size(), "Loop body should keep only the conditional return");
    }

    @Test
    @DisplayName("getClass().getSimpleName() becomes literal instanceof branches")
    void testRepair_TypeIntrospection_ShouldUseLiteralBranches() {
        String repaired = repairer.repair(TYPE_INTROSPECTION);

        assertFalse(repaired.contains("getSimpleName"), repaired);
        assertTrue(repaired.contains("value instanceof Integer"));
        assertTrue(repaired.contains("return \"int\";"));
        assertTrue(repaired.contains("return \"other\";"));
    }

    @Test
    @DisplayName("A max check nested inside a min check is lifted to a sibling")
    void testRepair_NestedMinMax_ShouldUnnest() {
        String repaired = repairer.repair(NESTED_MIN_MAX);

        NodeList<Statement> body = bodyOf(repaired, "minMax");
        NodeList<Statement> loopBody = body.get(2).asForEachStmt().getBody().asBlockStmt().getStatements();
        assertEquals(2, loopBody.size(), "Min and max checks should be siblings:\n" + repaired);
        assertTrue(loopBody.get(0).isIfStmt());
        assertTrue(loopBody.get(1).isIfStmt());
        assertEquals(1, loopBody.get(0).asIfStmt().getThenStmt().asBlockStmt().getStatements().size());
    }

    @Test
    @DisplayName("Email ordering check also rejects '@' directly before the last '.'")
    void testRepair_EmailOrdering_ShouldRejectAdjacentAtAndDot() {
        // When
        String repaired = repairer.repair(EMAIL_ORDERING);

        // Then
        NodeList<Statement> body = bodyOf(repaired, "isValidEmail");
        assertEquals("email.indexOf('@') >= email.lastIndexOf('.') || email.lastIndexOf('.') - email.indexOf('@') == 1",
                body.get(1).asIfStmt().getCondition().toString(), repaired);
        assertEquals("return false;", body.get(1).asIfStmt().getThenStmt().asBlockStmt().getStatement(0).toString());

        NodeList<Statement> mirrored = bodyOf(repaired, "isValidMirrored");
        assertEquals("email.indexOf(\"@\") >= email.lastIndexOf(\".\") || email.lastIndexOf(\".\") - email.indexOf(\"@\") == 1",
                mirrored.get(0).asIfStmt().getCondition().toString(), repaired);
    }

    @Test
    @DisplayName("Email repair leaves other comparisons and other receivers alone")
    void testRepair_EmailLookalikes_ShouldNotChange() {
        String differentReceivers = """
                public class Solution {
                    public static boolean check(String user, String domain) {
                        if (user.indexOf('@') > domain.lastIndexOf('.')) {
                            return false;
                        }
                        return true;
                    }
                }
                """;
        String returnsTrue = """
                public class Solution {
                    public static boolean check(String email) {
                        if (email.indexOf('@') > email.lastIndexOf('.')) {
                            return true;
                        }
                        return false;
                    }
                }
                """;

        assertSame(differentReceivers, repairer.repair(differentReceivers));
        assertSame(returnsTrue, repairer.repair(returnsTrue));
    }

    @Test
    @DisplayName("An if/else-if chain without else gets a sentinel return")
    void testRepair_IfChainWithoutElse_ShouldAppendReturn() {
        String repaired = repairer.repair(IF_CHAIN_WITHOUT_ELSE);

        NodeList<Statement> body = bodyOf(repaired, "grade");
        assertEquals("return null;", body.get(body.size() - 1).toString());
    }

    @Test
    @DisplayName("A trailing accumulation loop returns the local of the return type")
    void testRepair_TrailingLoop_ShouldReturnAccumulator() {
        String repaired = repairer.repair(TRAILING_LOOP);

        NodeList<Statement> body = bodyOf(repaired, "total");
        assertEquals("return total;", body.get(body.size() - 1).toString());
    }

    @Test
    @DisplayName("Accumulate-to-last search becomes an early return under a first-match constraint")
    void testRepair_FirstMatchContext_ShouldReturnEarly() {
        // When
        String repaired = repairer.repair(ACCUMULATE_TO_LAST, FIRST_MATCH_CONTEXT);

        // Then
        NodeList<Statement> body = bodyOf(repaired, "findIndex");
        assertEquals(2, body.size(), "Sentinel declaration should be gone:\n" + repaired);
        assertTrue(body.get(0).isForStmt());
        assertTrue(body.get(0).toString().contains("return i;"));
        assertEquals("return -1;", body.get(1).toString());
        System.out.println("✅ Repaired first-match search:\n" + repaired);
    }

    @Test
    @DisplayName("Accumulate-to-last search is left alone without a first-match constraint")
    void testRepair_NoContext_ShouldKeepAccumulation() {
        assertSame(ACCUMULATE_TO_LAST, repairer.repair(ACCUMULATE_TO_LAST));
    }

    @Test
    @DisplayName("Referenced java.util types get imports")
    void testRepair_MissingImports_ShouldAddImports() {
        String repaired = repairer.repair(MISSING_IMPORTS);

        assertTrue(repaired.contains("import java.util.List;"), repaired);
        assertTrue(repaired.contains("import java.util.ArrayList;"), repaired);
    }

    @Test
    @DisplayName("Method-scoped passes skip methods other than the target")
    void testRepair_OtherTargetMethod_ShouldNotTouchMethod() {
        RepairContext context = RepairContext.builder().methodName("somethingElse").build();

        assertSame(IF_CHAIN_WITHOUT_ELSE, repairer.repair(IF_CHAIN_WITHOUT_ELSE, context));
    }

    @Test
    @DisplayName("Unparseable input is returned unchanged")
    void testRepair_Unparseable_ShouldReturnInput() {
        String broken = "public class Solution { int x( { }";

        assertSame(broken, repairer.repair(broken));
    }

    @Test
    @DisplayName("Repairing repaired output changes nothing")
    void testRepair_Idempotent_ShouldBeFixpoint() {
        List<String> corpus = List.of(NESTED_FALLBACK, TYPE_INTROSPECTION, NESTED_MIN_MAX,
                IF_CHAIN_WITHOUT_ELSE, TRAILING_LOOP, ACCUMULATE_TO_LAST, MISSING_IMPORTS, EMAIL_ORDERING);

        for (String source : corpus) {
            String once = repairer.repair(source);
            assertEquals(once, repairer.repair(once), "Second repair changed output for:\n" + source);

            String withContext = repairer.repair(source, FIRST_MATCH_CONTEXT);
            assertEquals(withContext, repairer.repair(withContext, FIRST_MATCH_CONTEXT),
                    "Second contextual repair changed output for:\n" + source);
        }
    }

    private static NodeList<Statement> bodyOf(String source, String methodName) {
        CompilationUnit cu = JavaSourceParser.parse(source);
        MethodDeclaration method = JavaSourceParser.findMethod(cu, methodName).orElseThrow();
        return method.getBody().orElseThrow().getStatements();
    }
}
