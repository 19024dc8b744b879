package io.ragweave.core.token;

/// Estimates how many model tokens a text occupies.
///
/// Retrieval budgets and prompt budgets are both measured with the same
/// estimator, so the numbers they report are comparable.
@FunctionalInterface
public interface TokenEstimator {

    /// Estimates the token count of `text`.
    ///
    /// @param text text to measure, not null
    /// @return non-negative token estimate
    int estimate(String text);
}
