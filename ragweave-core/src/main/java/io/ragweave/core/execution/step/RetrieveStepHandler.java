package io.ragweave.core.execution.step;

import io.ragweave.core.RagweaveConfig;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.prompt.PlaceholderRenderer;
import io.ragweave.core.retrieval.RetrievalOptions;
import io.ragweave.core.retrieval.RetrievalPipeline;
import io.ragweave.core.retrieval.RetrievalResult;
import java.util.Objects;

/// Built-in handler for `RETRIEVE` nodes.
///
/// ### Node config
/// - `query`: template rendered over run inputs and upstream text outputs;
///   when absent the run input `query` is used
/// - `top_k`: neighbours to fetch, default {@link RagweaveConfig#getRetrievalTopK()}
/// - `min_similarity`: similarity floor, default {@link RagweaveConfig#getMinSimilarity()}
/// - `context_token_budget`: token budget, default {@link RagweaveConfig#getContextTokenBudget()}
///
/// Output: {@link RetrievalResult}.
public final class RetrieveStepHandler implements StepHandler {

    public static final String QUERY = "query";
    public static final String TOP_K = "top_k";
    public static final String MIN_SIMILARITY = "min_similarity";
    public static final String CONTEXT_TOKEN_BUDGET = "context_token_budget";

    private final RetrievalPipeline pipeline;

    public RetrieveStepHandler(RetrievalPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @Override
    public RetrievalResult execute(StepContext context) {
        RagweaveConfig config = context.config();
        String query = resolveQuery(context);
        int topK = intConfig(context, TOP_K, config.getRetrievalTopK());
        int budget = intConfig(context, CONTEXT_TOKEN_BUDGET, config.getContextTokenBudget());
        double minSimilarity =
                context.nodeConfig(MIN_SIMILARITY)
                        .filter(Number.class::isInstance)
                        .map(v -> ((Number) v).doubleValue())
                        .orElse(config.getMinSimilarity());

        return pipeline.retrieve(query, topK, new RetrievalOptions(minSimilarity, budget));
    }

    private static String resolveQuery(StepContext context) {
        Object template = context.node().getConfig().get(QUERY);
        if (template != null) {
            return PlaceholderRenderer.render(template.toString(), context.textVariables());
        }
        Object input = context.initialInputs().get(QUERY);
        if (input == null) {
            throw new ValidationException(
                    "RETRIEVE node '"
                            + context.node().getId()
                            + "' needs a 'query' config template or a 'query' run input");
        }
        return input.toString();
    }

    private static int intConfig(StepContext context, String key, int defaultValue) {
        Object value = context.node().getConfig().get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new ValidationException(
                "Node '" + context.node().getId() + "' config '" + key + "' must be a number, got " + value);
    }
}
