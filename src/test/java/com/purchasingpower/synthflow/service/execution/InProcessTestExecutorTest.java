package com.purchasingpower.synthflow.service.execution;

import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.exception.TestExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Process Test Executor Tests")
class InProcessTestExecutorTest {

    private SynthesisProperties properties;
    private InProcessTestExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new SynthesisProperties();
        properties.getExecution().setTimeoutMs(1000);
        executor = new InProcessTestExecutor(new InMemoryCompiler(), properties);
    }

    @Test
    @DisplayName("Static method results are compared with expected values")
    void testExecute_StaticMethod_ShouldScoreEachCase() {
        // Given
        String code = """
                public class Solution {
                    public static int add(int a, int b) {
                        return a + b;
                    }
                }
                """;
        List<TestCase> cases = List.of(TestCase.of(3, 1, 2), TestCase.of(0, -4, 4), TestCase.of(10, 2, 2));

        // When
        List<TestResult> results = executor.execute(code, "add", cases);

        // Then
        assertEquals(3, results.size());
        assertTrue(results.get(0).isPassed());
        assertTrue(results.get(1).isPassed());
        assertFalse(results.get(2).isPassed());
        assertEquals(4, results.get(2).getActual());
    }

    @Test
    @DisplayName("JSON-like inputs convert to generic parameter types")
    void testExecute_ListParameter_ShouldConvertInputs() {
        String code = """
                import java.util.List;

                public class Solution {
                    public static List<Integer> doubled(List<Integer> values) {
                        return values.stream().map(v -> v * 2).toList();
                    }
                }
                """;

        List<TestResult> results = executor.execute(code, "doubled",
                List.of(TestCase.of(List.of(2, 4, 6), List.of(1, 2, 3))));

        assertTrue(results.get(0).isPassed(), "actual: " + results.get(0).getActual());
    }

    @Test
    @DisplayName("Numbers compare by value across int, long and double")
    void testExecute_NumericWidening_ShouldMatch() {
        String code = """
                public class Solution {
                    public double average(int[] values) {
                        double sum = 0;
                        for (int v : values) {
                            sum += v;
                        }
                        return sum / values.length;
                    }
                }
                """;

        List<TestResult> results = executor.execute(code, "average",
                List.of(TestCase.of(2, List.of(1, 2, 3)), TestCase.of(2.5, List.of(2, 3))));

        assertTrue(results.get(0).isPassed(), "2.0 should equal 2");
        assertTrue(results.get(1).isPassed());
    }

    @Test
    @DisplayName("Null results match a null expectation")
    void testExecute_NullResult_ShouldMatchNull() {
        String code = """
                public class Solution {
                    public static String nothing(String input) {
                        return null;
                    }
                }
                """;
        TestCase expectNull = TestCase.builder().inputs(Collections.singletonList("x")).expected(null).build();

        assertTrue(executor.execute(code, "nothing", List.of(expectNull)).get(0).isPassed());
    }

    @Test
    @DisplayName("Exceptions thrown by the method fail only that case")
    void testExecute_ThrowingMethod_ShouldRecordError() {
        String code = """
                public class Solution {
                    public static int divide(int a, int b) {
                        return a / b;
                    }
                }
                """;

        List<TestResult> results = executor.execute(code, "divide",
                List.of(TestCase.of(1, 1, 0), TestCase.of(2, 4, 2)));

        assertFalse(results.get(0).isPassed());
        assertTrue(results.get(0).getError().startsWith("ArithmeticException"), results.get(0).getError());
        assertTrue(results.get(1).isPassed());
    }

    @Test
    @DisplayName("Non-terminating calls time out and later cases still run")
    void testExecute_InfiniteLoop_ShouldTimeOut() {
        properties.getExecution().setTimeoutMs(200);
        executor = new InProcessTestExecutor(new InMemoryCompiler(), properties);
        String code = """
                public class Solution {
                    public static int spin(int n) {
                        while (n > 0) {
                            n = n + 1 - 1;
                        }
                        return n;
                    }
                }
                """;

        List<TestResult> results = executor.execute(code, "spin", List.of(TestCase.of(0, 1), TestCase.of(0, 0)));

        assertTrue(results.get(0).getError().startsWith("Timed out"));
        assertTrue(results.get(1).isPassed());
    }

    @Test
    @DisplayName("Code that does not compile raises TestExecutionException with compiler output")
    void testExecute_CompileError_ShouldThrow() {
        String code = """
                public class Solution {
                    public static int add(int a, int b) {
                        return a + c;
                    }
                }
                """;

        TestExecutionException e = assertThrows(TestExecutionException.class,
                () -> executor.execute(code, "add", List.of(TestCase.of(3, 1, 2))));
        assertNotNull(e.getErrorLogs());
    }

    @Test
    @DisplayName("Missing method raises TestExecutionException")
    void testExecute_MissingMethod_ShouldThrow() {
        String code = "public class Solution { public static int other() { return 1; } }";

        assertThrows(TestExecutionException.class,
                () -> executor.execute(code, "add", List.of(TestCase.of(3, 1, 2))));
    }
}
