package io.ragweave.core.prompt;

import io.ragweave.core.retrieval.Chunk;
import java.util.List;
import java.util.Objects;

/// Rendered prompt that fits its template's token budget.
///
/// @param templateName name of the template rendered, not null
/// @param text final prompt text, not null
/// @param tokenCount estimated tokens of `text`
/// @param keptChunks context chunks included, best first, never null
/// @param droppedChunks number of chunks removed to fit the budget
/// @param keptTurns history turns included, oldest first, never null
/// @param droppedTurns number of history turns removed to fit the budget
public record AssembledPrompt(
        String templateName,
        String text,
        int tokenCount,
        List<Chunk> keptChunks,
        int droppedChunks,
        List<ConversationTurn> keptTurns,
        int droppedTurns) {

    public AssembledPrompt {
        Objects.requireNonNull(templateName, "templateName must not be null");
        Objects.requireNonNull(text, "text must not be null");
        keptChunks = List.copyOf(keptChunks);
        keptTurns = List.copyOf(keptTurns);
    }

    @Override
    public String toString() {
        return text;
    }
}
