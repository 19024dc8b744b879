package io.ragweave.core.exception;

import java.io.Serial;

/// Thrown when a prompt cannot fit its token budget even after every droppable
/// history turn and context chunk has been removed.
public class BudgetExceededException extends RagweaveException {

    @Serial private static final long serialVersionUID = 5020791380398318541L;

    private final int requiredTokens;
    private final int budget;

    public BudgetExceededException(String templateName, int requiredTokens, int budget) {
        super(
                "Prompt template '"
                        + templateName
                        + "' needs at least "
                        + requiredTokens
                        + " tokens but the budget is "
                        + budget);
        this.requiredTokens = requiredTokens;
        this.budget = budget;
    }

    /// Returns the token count of the smallest prompt that could be produced.
    ///
    /// @return minimum required tokens
    public int getRequiredTokens() {
        return requiredTokens;
    }

    /// Returns the configured budget ceiling.
    ///
    /// @return token budget
    public int getBudget() {
        return budget;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.BUDGET_EXCEEDED;
    }
}
