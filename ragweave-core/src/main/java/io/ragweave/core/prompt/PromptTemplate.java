package io.ragweave.core.prompt;

import io.ragweave.core.exception.ValidationException;
import java.util.Objects;
import java.util.Set;

/// Named prompt text with `{placeholder}` markers and a token ceiling.
///
/// `{context}` and `{history}` are filled by the {@link PromptAssembler}; every
/// other placeholder is a required variable.
///
/// @param name template name used for lookup and error messages, not null
/// @param text template text, not null
/// @param tokenBudget maximum tokens of the rendered prompt, positive
public record PromptTemplate(String name, String text, int tokenBudget) {

    public static final String CONTEXT = "context";
    public static final String HISTORY = "history";

    public PromptTemplate {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (name.isBlank()) {
            throw new ValidationException("Prompt template name must not be blank");
        }
        if (tokenBudget <= 0) {
            throw new ValidationException(
                    "Prompt template '" + name + "' must have a positive token budget");
        }
    }

    /// Returns every placeholder name in order of first appearance.
    ///
    /// @return placeholder names, never null
    public Set<String> placeholders() {
        return PlaceholderRenderer.placeholders(text);
    }

    public boolean usesContext() {
        return placeholders().contains(CONTEXT);
    }

    public boolean usesHistory() {
        return placeholders().contains(HISTORY);
    }
}
