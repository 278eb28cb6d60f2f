package com.purchasingpower.synthflow.service.selection;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.configuration.MultiShotProperties;
import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import com.purchasingpower.synthflow.exception.CodeGenerationException;
import com.purchasingpower.synthflow.exception.TestExecutionException;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.service.execution.TestCase;
import com.purchasingpower.synthflow.service.execution.TestExecutor;
import com.purchasingpower.synthflow.service.execution.TestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Generates up to n candidates at spread temperatures, scores each on the test cases and keeps
 * the best.
 *
 * <p>Generations run on the candidate pool with at most {@code parallelism} in flight and are
 * joined in dispatch order. The first perfect candidate stops the run: nothing further is
 * dispatched and in-flight generations are cancelled.
 */
@Slf4j
@Service
public class MultiShotSelector {

    private final TestExecutor testExecutor;
    private final AsyncTaskExecutor candidateExecutor;
    private final MultiShotProperties properties;

    public MultiShotSelector(TestExecutor testExecutor,
                             @Qualifier("candidateExecutor") AsyncTaskExecutor candidateExecutor,
                             SynthesisProperties properties) {
        this.testExecutor = testExecutor;
        this.candidateExecutor = candidateExecutor;
        this.properties = properties.getMultishot();
    }

    /**
     * @throws CodeGenerationException only in single-shot passthrough, when the one generation fails
     */
    public SelectionResult select(IntermediateRepresentation ir,
                                  CandidateGenerator generator,
                                  List<TestCase> testCases,
                                  int n) {
        Preconditions.checkNotNull(ir, "ir must not be null");
        Preconditions.checkNotNull(generator, "generator must not be null");
        Preconditions.checkArgument(n >= 0, "n must be >= 0, got %s", n);

        if (n == 0 || testCases == null || testCases.isEmpty()) {
            return singleShot(ir, generator);
        }

        String methodName = ir.getSignature().getName();
        List<Double> temperatures = temperatures(n);
        int parallelism = Math.max(1, Math.min(properties.getParallelism(), n));
        log.info("🔵 Multi-shot for {}: {} candidate(s), {} test(s), parallelism {}",
                methodName, n, testCases.size(), parallelism);

        List<GenerationCandidate> candidates = new ArrayList<>();
        Deque<Future<GenerationCandidate>> inFlight = new ArrayDeque<>();
        int next = 0;
        boolean earlyExit = false;

        while (inFlight.size() < parallelism && next < n) {
            inFlight.add(dispatch(ir, generator, testCases, methodName, temperatures.get(next++)));
        }
        while (!inFlight.isEmpty()) {
            GenerationCandidate candidate = join(inFlight.poll(), testCases.size());
            candidates.add(candidate);
            log.info("Candidate {}/{} (temperature {}): {}/{} tests passed{}",
                    candidates.size(), n, String.format("%.2f", candidate.getTemperature()),
                    candidate.getPassedTests(), candidate.getTotalTests(),
                    candidate.isFailed() ? " [failed: " + candidate.getError() + "]" : "");

            if (candidate.isPerfect()) {
                inFlight.forEach(f -> f.cancel(true));
                inFlight.clear();
                earlyExit = candidates.size() < n;
                log.info("✅ Perfect candidate found after {} generation(s)", candidates.size());
                break;
            }
            if (next < n) {
                inFlight.add(dispatch(ir, generator, testCases, methodName, temperatures.get(next++)));
            }
        }

        GenerationCandidate best = best(candidates);
        return new SelectionResult(best, List.copyOf(candidates), earlyExit);
    }

    private SelectionResult singleShot(IntermediateRepresentation ir, CandidateGenerator generator) {
        double temperature = properties.singleShotTemperature();
        String code = generator.generate(ir, temperature);
        GenerationCandidate candidate = GenerationCandidate.builder()
                .sourceCode(code)
                .temperature(temperature)
                .build();
        return new SelectionResult(candidate, List.of(candidate), false);
    }

    /**
     * n temperatures evenly spaced over the configured range; the midpoint when n is 1.
     */
    List<Double> temperatures(int n) {
        double min = properties.getTemperatureMin();
        double max = properties.getTemperatureMax();
        List<Double> temperatures = new ArrayList<>(n);
        if (n == 1) {
            temperatures.add(properties.singleShotTemperature());
            return temperatures;
        }
        double step = (max - min) / (n - 1);
        for (int i = 0; i < n; i++) {
            temperatures.add(min + step * i);
        }
        return temperatures;
    }

    private Future<GenerationCandidate> dispatch(IntermediateRepresentation ir,
                                                 CandidateGenerator generator,
                                                 List<TestCase> testCases,
                                                 String methodName,
                                                 double temperature) {
        return candidateExecutor.submit(() -> evaluate(ir, generator, testCases, methodName, temperature));
    }

    private GenerationCandidate evaluate(IntermediateRepresentation ir,
                                         CandidateGenerator generator,
                                         List<TestCase> testCases,
                                         String methodName,
                                         double temperature) {
        String code;
        try {
            code = generator.generate(ir, temperature);
        } catch (CodeGenerationException e) {
            return GenerationCandidate.failed(temperature, testCases.size(), e.getMessage());
        }

        int passed;
        try {
            List<TestResult> results = testExecutor.execute(code, methodName, testCases);
            passed = (int) results.stream().filter(TestResult::isPassed).count();
        } catch (TestExecutionException e) {
            log.debug("Candidate at temperature {} could not be executed: {}", temperature, e.getMessage());
            passed = 0;
        }

        return GenerationCandidate.builder()
                .sourceCode(code)
                .passedTests(passed)
                .totalTests(testCases.size())
                .score((double) passed / testCases.size())
                .temperature(temperature)
                .build();
    }

    private GenerationCandidate join(Future<GenerationCandidate> future, int totalTests) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GenerationCandidate.failed(0, totalTests, "interrupted");
        } catch (ExecutionException e) {
            log.error("❌ Candidate generation crashed", e.getCause());
            return GenerationCandidate.failed(0, totalTests, String.valueOf(e.getCause().getMessage()));
        }
    }

    /**
     * Highest score among usable candidates, earliest on ties. Falls back to the first failure.
     */
    static GenerationCandidate best(List<GenerationCandidate> candidates) {
        GenerationCandidate best = null;
        for (GenerationCandidate candidate : candidates) {
            if (candidate.isFailed()) {
                continue;
            }
            if (best == null || candidate.getScore() > best.getScore()) {
                best = candidate;
            }
        }
        return best != null ? best : candidates.get(0);
    }
}
