package io.ragweave.core.execution.runner;

/// One attempt of a node's step.
@FunctionalInterface
public interface StepInvocation {

    /// Runs the step.
    ///
    /// @param attempt 1-based attempt number
    /// @return step output, may be null
    /// @throws Exception any failure; classified by {@link FailureClassifier}
    Object invoke(int attempt) throws Exception;
}
