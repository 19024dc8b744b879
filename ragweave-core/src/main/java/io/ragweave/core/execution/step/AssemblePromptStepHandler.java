package io.ragweave.core.execution.step;

import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.prompt.AssembledPrompt;
import io.ragweave.core.prompt.ConversationTurn;
import io.ragweave.core.prompt.PromptAssembler;
import io.ragweave.core.prompt.PromptTemplate;
import io.ragweave.core.prompt.PromptTemplateRegistry;
import io.ragweave.core.retrieval.RetrievalResult;
import io.ragweave.core.token.TokenEstimator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Built-in handler for `ASSEMBLE_PROMPT` nodes.
///
/// ### Node config
/// - `template` (required): name of a registered {@link PromptTemplate}
///
/// Context is the merge of every upstream {@link RetrievalResult}; history is
/// the run input `history` (a list of {@link ConversationTurn}s or of maps with
/// `role` and `text`); variables are run inputs plus upstream text outputs.
///
/// Output: {@link AssembledPrompt}.
public final class AssemblePromptStepHandler implements StepHandler {

    public static final String TEMPLATE = "template";
    public static final String HISTORY_INPUT = "history";

    private final PromptTemplateRegistry templates;
    private final PromptAssembler assembler;
    private final TokenEstimator tokenEstimator;

    public AssemblePromptStepHandler(
            PromptTemplateRegistry templates, PromptAssembler assembler, TokenEstimator tokenEstimator) {
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    }

    @Override
    public AssembledPrompt execute(StepContext context) {
        String nodeId = context.node().getId();
        Object templateName = context.node().getConfig().get(TEMPLATE);
        if (templateName == null) {
            throw new ValidationException(
                    "ASSEMBLE_PROMPT node '" + nodeId + "' must set config '" + TEMPLATE + "'");
        }
        PromptTemplate template =
                templates
                        .find(templateName.toString())
                        .orElseThrow(
                                () ->
                                        new ValidationException(
                                                "Unknown prompt template '"
                                                        + templateName
                                                        + "' in node '"
                                                        + nodeId
                                                        + "'"));

        List<RetrievalResult> retrievals = context.upstream(RetrievalResult.class);
        RetrievalResult merged =
                retrievals.isEmpty()
                        ? RetrievalResult.empty()
                        : RetrievalResult.merge(retrievals, tokenEstimator);

        return assembler.assemble(
                template, merged, history(context), context.textVariables());
    }

    static List<ConversationTurn> history(StepContext context) {
        Object raw = context.initialInputs().get(HISTORY_INPUT);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> entries)) {
            throw new ValidationException("Run input 'history' must be a list, got " + raw.getClass().getName());
        }
        List<ConversationTurn> turns = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (entry instanceof ConversationTurn turn) {
                turns.add(turn);
            } else if (entry instanceof Map<?, ?> map
                    && map.get("role") != null
                    && map.get("text") != null) {
                turns.add(new ConversationTurn(map.get("role").toString(), map.get("text").toString()));
            } else {
                throw new ValidationException("Invalid history entry: " + entry);
            }
        }
        return turns;
    }
}
