package io.ragweave.core.prompt;

import java.util.Objects;

/// One message of prior conversation. History lists are ordered oldest first.
///
/// @param role speaker role (e.g. "user", "assistant"), not null
/// @param text message text, not null
public record ConversationTurn(String role, String text) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static ConversationTurn user(String text) {
        return new ConversationTurn("user", text);
    }

    public static ConversationTurn assistant(String text) {
        return new ConversationTurn("assistant", text);
    }
}
