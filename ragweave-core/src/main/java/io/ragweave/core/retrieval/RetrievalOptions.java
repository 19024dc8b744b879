package io.ragweave.core.retrieval;

/// Per-call retrieval limits.
///
/// @param minSimilarity vector matches scoring below this are discarded
/// @param contextTokenBudget maximum tokens the selected chunks may occupy, non-negative
public record RetrievalOptions(double minSimilarity, int contextTokenBudget) {

    public RetrievalOptions {
        if (contextTokenBudget < 0) {
            throw new IllegalArgumentException("contextTokenBudget must not be negative");
        }
    }
}
