package io.ragweave.core.execution.step;

import io.ragweave.core.adapter.GenerationParameters;
import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.prompt.AssembledPrompt;
import io.ragweave.core.prompt.PlaceholderRenderer;
import java.util.List;
import java.util.Objects;

/// Built-in handler for `GENERATE` nodes.
///
/// ### Node config
/// - `prompt`: template used when no upstream {@link AssembledPrompt} exists
/// - `temperature`, `max_tokens`, `top_p`, `stop`: generation parameters
/// - `cache`: `false` to bypass the response cache
///
/// The adapter passed in is expected to be a
/// {@link io.ragweave.core.cache.CachingLlmAdapter}; the `cache` flag is carried
/// on the request as {@link LlmRequest#cacheable()}.
///
/// Output: {@link LlmResponse}.
public final class GenerateStepHandler implements StepHandler {

    public static final String PROMPT = "prompt";
    public static final String CACHE = "cache";

    private final LlmAdapter llm;

    public GenerateStepHandler(LlmAdapter llm) {
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
    }

    @Override
    public LlmResponse execute(StepContext context) {
        String prompt = resolvePrompt(context);
        GenerationParameters parameters = GenerationParameters.fromConfig(context.node().getConfig());
        boolean cacheable = !"false".equalsIgnoreCase(String.valueOf(context.node().getConfig().get(CACHE)));
        return llm.generate(new LlmRequest(prompt, parameters, cacheable));
    }

    private static String resolvePrompt(StepContext context) {
        List<AssembledPrompt> prompts = context.upstream(AssembledPrompt.class);
        if (!prompts.isEmpty()) {
            return prompts.get(0).text();
        }
        Object template = context.node().getConfig().get(PROMPT);
        if (template == null) {
            throw new ValidationException(
                    "GENERATE node '"
                            + context.node().getId()
                            + "' needs an upstream ASSEMBLE_PROMPT node or a 'prompt' config template");
        }
        return PlaceholderRenderer.render(template.toString(), context.textVariables());
    }
}
