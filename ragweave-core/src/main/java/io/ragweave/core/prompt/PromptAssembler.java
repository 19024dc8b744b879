package io.ragweave.core.prompt;

import io.ragweave.core.exception.BudgetExceededException;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.retrieval.Chunk;
import io.ragweave.core.retrieval.RetrievalResult;
import io.ragweave.core.token.TokenEstimator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Renders a {@link PromptTemplate} with retrieved context, history and variables
/// under the template's token budget.
///
/// ### Rendering
/// - `{context}`: one line per chunk, `[documentId:start-end] text`, best first
/// - `{history}`: one line per turn, `role: text`, oldest first
/// - any other placeholder: the variable of that name
///
/// ### Trimming
/// While the rendered prompt exceeds the budget, the oldest history turn is
/// dropped; once history is exhausted, the lowest-scored chunk is dropped. Only
/// content the template actually renders is dropped. When nothing droppable
/// remains and the prompt is still over budget, {@link BudgetExceededException}
/// is raised.
///
/// Output is a pure function of the inputs.
public final class PromptAssembler {

    private static final Logger logger = Logger.getLogger(PromptAssembler.class.getName());

    private final TokenEstimator tokenEstimator;

    public PromptAssembler(TokenEstimator tokenEstimator) {
        this.tokenEstimator =
                Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    }

    /// Assembles a prompt.
    ///
    /// @param template template to render, not null
    /// @param retrieval context chunks, may be null for none
    /// @param history prior conversation oldest first, may be null for none
    /// @param variables values for the non-reserved placeholders, not null
    /// @return prompt within budget, never null
    /// @throws ValidationException if a required variable is missing
    /// @throws BudgetExceededException if the prompt cannot be made to fit
    public AssembledPrompt assemble(
            PromptTemplate template,
            RetrievalResult retrieval,
            List<ConversationTurn> history,
            Map<String, ?> variables) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(variables, "variables must not be null");

        List<String> missing =
                template.placeholders().stream()
                        .filter(n -> !n.equals(PromptTemplate.CONTEXT) && !n.equals(PromptTemplate.HISTORY))
                        .filter(n -> variables.get(n) == null)
                        .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException(
                    "Prompt template '" + template.name() + "' is missing variables: " + missing);
        }

        List<Chunk> chunks =
                template.usesContext() && retrieval != null
                        ? new ArrayList<>(retrieval.chunks())
                        : new ArrayList<>();
        List<ConversationTurn> turns =
                template.usesHistory() && history != null ? new ArrayList<>(history) : new ArrayList<>();
        int initialChunks = chunks.size();
        int initialTurns = turns.size();

        while (true) {
            String text = render(template, chunks, turns, variables);
            int tokens = tokenEstimator.estimate(text);
            if (tokens <= template.tokenBudget()) {
                int droppedChunks = initialChunks - chunks.size();
                int droppedTurns = initialTurns - turns.size();
                if (droppedChunks > 0 || droppedTurns > 0) {
                    logger.fine(
                            "Prompt '"
                                    + template.name()
                                    + "' trimmed to budget: dropped "
                                    + droppedTurns
                                    + " history turns and "
                                    + droppedChunks
                                    + " chunks");
                }
                return new AssembledPrompt(
                        template.name(), text, tokens, chunks, droppedChunks, turns, droppedTurns);
            }
            if (!turns.isEmpty()) {
                turns.remove(0);
            } else if (!chunks.isEmpty()) {
                chunks.remove(chunks.size() - 1);
            } else {
                throw new BudgetExceededException(template.name(), tokens, template.tokenBudget());
            }
        }
    }

    static String renderContext(List<Chunk> chunks) {
        return chunks.stream()
                .map(c -> "[" + c.identity() + "] " + c.text())
                .collect(Collectors.joining("\n"));
    }

    static String renderHistory(List<ConversationTurn> turns) {
        return turns.stream().map(t -> t.role() + ": " + t.text()).collect(Collectors.joining("\n"));
    }

    private static String render(
            PromptTemplate template,
            List<Chunk> chunks,
            List<ConversationTurn> turns,
            Map<String, ?> variables) {
        Map<String, Object> values = new HashMap<>(variables);
        values.put(PromptTemplate.CONTEXT, renderContext(chunks));
        values.put(PromptTemplate.HISTORY, renderHistory(turns));
        return PlaceholderRenderer.render(template.text(), values);
    }
}
