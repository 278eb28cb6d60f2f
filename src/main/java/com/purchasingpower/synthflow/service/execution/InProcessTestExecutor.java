package com.purchasingpower.synthflow.service.execution;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.exception.TestExecutionException;
import com.purchasingpower.synthflow.parser.JavaSourceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Compiles generated source in memory, loads it in a throwaway class loader and calls the target
 * method reflectively.
 *
 * <p>Arguments are converted from JSON-like values to the declared parameter types with Jackson;
 * results are compared as JSON trees with numeric values compared by magnitude, so {@code 3},
 * {@code 3L} and {@code 3.0} are equal. Each call runs on a daemon thread under the configured
 * timeout. This is isolation by class loader only, not a security sandbox.
 */
@Slf4j
@Service
public class InProcessTestExecutor implements TestExecutor {

    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private final InMemoryCompiler compiler;
    private final ObjectMapper mapper = new ObjectMapper();
    private final long timeoutMs;

    public InProcessTestExecutor(InMemoryCompiler compiler, SynthesisProperties properties) {
        this.compiler = compiler;
        this.timeoutMs = properties.getExecution().getTimeoutMs();
    }

    @Override
    public List<TestResult> execute(String sourceCode, String methodName, List<TestCase> testCases) {
        Preconditions.checkNotNull(sourceCode, "sourceCode must not be null");
        Preconditions.checkNotNull(methodName, "methodName must not be null");

        String className = primaryClassName(sourceCode);
        CompilationResult compilation = compiler.compile(sourceCode, className);
        if (!compilation.isSuccess()) {
            throw new TestExecutionException("Generated code does not compile", compilation.getDetailedErrors());
        }

        Class<?> type = load(className, compilation.getClasses());
        ExecutorService runner = newRunner();
        try {
            List<TestResult> results = new ArrayList<>();
            for (TestCase testCase : testCases) {
                TestResult result = runOne(type, methodName, testCase, runner);
                results.add(result);
                if (result.getError() != null && result.getError().startsWith("Timed out")) {
                    // The stuck thread cannot be reclaimed; give the rest a fresh one
                    runner.shutdownNow();
                    runner = newRunner();
                }
            }
            long passed = results.stream().filter(TestResult::isPassed).count();
            log.debug("Executed {} test(s) against {}.{}: {} passed", results.size(), className, methodName, passed);
            return results;
        } finally {
            runner.shutdownNow();
        }
    }

    private static ExecutorService newRunner() {
        return Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("test-exec-%d")
                .build());
    }

    private TestResult runOne(Class<?> type, String methodName, TestCase testCase, ExecutorService runner) {
        Optional<Method> method = findMethod(type, methodName, testCase.getInputs().size());
        if (method.isEmpty()) {
            throw new TestExecutionException("Method not found: " + methodName,
                    "No method " + methodName + " with " + testCase.getInputs().size() + " parameter(s) in " + type.getName());
        }

        long start = System.currentTimeMillis();
        Future<Object> future = runner.submit(() -> invoke(type, method.get(), testCase.getInputs()));
        try {
            Object actual = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            boolean passed = sameValue(actual, testCase.getExpected());
            return TestResult.builder()
                    .testCase(testCase)
                    .passed(passed)
                    .actual(actual)
                    .durationMs(System.currentTimeMillis() - start)
                    .build();
        } catch (TimeoutException e) {
            future.cancel(true);
            return TestResult.failed(testCase, "Timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof InvocationTargetException ite ? ite.getCause() : e.getCause();
            return TestResult.failed(testCase, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TestResult.failed(testCase, "Interrupted");
        }
    }

    private Object invoke(Class<?> type, Method method, List<Object> inputs) throws Exception {
        Object[] args = new Object[inputs.size()];
        for (int i = 0; i < args.length; i++) {
            JavaType target = mapper.getTypeFactory().constructType(method.getGenericParameterTypes()[i]);
            args[i] = mapper.convertValue(inputs.get(i), target);
        }
        method.setAccessible(true);
        Object receiver = Modifier.isStatic(method.getModifiers())
                ? null
                : instantiate(type);
        return method.invoke(receiver, args);
    }

    private static Object instantiate(Class<?> type) throws ReflectiveOperationException {
        var constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }

    boolean sameValue(Object actual, Object expected) {
        return tree(actual).equals(NUMERIC_AWARE, tree(expected));
    }

    private JsonNode tree(Object value) {
        return value == null ? NullNode.getInstance() : mapper.valueToTree(value);
    }

    private static Optional<Method> findMethod(Class<?> type, String name, int arity) {
        return Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.getName().equals(name) && m.getParameterCount() == arity)
                .findFirst();
    }

    private static String primaryClassName(String sourceCode) {
        CompilationUnit cu = JavaSourceParser.tryParse(sourceCode)
                .orElseThrow(() -> new TestExecutionException("Generated code does not parse", sourceCode));
        TypeDeclaration<?> type = cu.getTypes().stream()
                .filter(TypeDeclaration::isPublic)
                .findFirst()
                .or(() -> cu.getTypes().stream().findFirst())
                .orElseThrow(() -> new TestExecutionException("Generated code declares no type", sourceCode));
        return type.getFullyQualifiedName().orElse(type.getNameAsString());
    }

    private static Class<?> load(String className, Map<String, byte[]> classes) {
        ClassLoader loader = new ClassLoader(InProcessTestExecutor.class.getClassLoader()) {
            @Override
            protected Class<?> findClass(String name) throws ClassNotFoundException {
                byte[] bytes = classes.get(name);
                if (bytes == null) {
                    throw new ClassNotFoundException(name);
                }
                return defineClass(name, bytes, 0, bytes.length);
            }
        };
        try {
            return loader.loadClass(className);
        } catch (ClassNotFoundException e) {
            throw new TestExecutionException("Compiled class not found: " + className, String.join(", ", classes.keySet()));
        }
    }
}
