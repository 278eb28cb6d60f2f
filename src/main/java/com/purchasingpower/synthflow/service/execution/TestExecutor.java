package com.purchasingpower.synthflow.service.execution;

import com.purchasingpower.synthflow.exception.TestExecutionException;

import java.util.List;

/**
 * Runs generated code against example test cases.
 */
public interface TestExecutor {

    /**
     * @return one result per test case, in order
     * @throws TestExecutionException when the source cannot be compiled or the method cannot be found
     */
    List<TestResult> execute(String sourceCode, String methodName, List<TestCase> testCases);
}
