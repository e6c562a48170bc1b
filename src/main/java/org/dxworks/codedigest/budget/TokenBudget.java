package org.dxworks.codedigest.budget;

/**
 * Token allowances for one summarization attempt. Recomputed per attempt, never stored.
 */
public final class TokenBudget {
    private final int contextWindow;
    private final int reservedSystemCost;
    private final int safetyMargin;
    private final int allowedPromptTokens;
    private final int allowedResponseTokens;

    private TokenBudget(int contextWindow, int reservedSystemCost, int safetyMargin,
                        int allowedPromptTokens, int allowedResponseTokens) {
        this.contextWindow = contextWindow;
        this.reservedSystemCost = reservedSystemCost;
        this.safetyMargin = safetyMargin;
        this.allowedPromptTokens = allowedPromptTokens;
        this.allowedResponseTokens = allowedResponseTokens;
    }

    /** Budget before any prompt tokens are spent. */
    public static TokenBudget of(BudgetConfig config) {
        return of(config, 0);
    }

    public static TokenBudget of(BudgetConfig config, int promptTokensUsed) {
        int allowedPrompt = config.getContextWindow() - config.getReservedSystemCost() - config.getSafetyMargin();
        int allowedResponse = Math.max(0, Math.min(config.getResponseCap(), allowedPrompt - promptTokensUsed));
        return new TokenBudget(config.getContextWindow(), config.getReservedSystemCost(), config.getSafetyMargin(),
                allowedPrompt, allowedResponse);
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public int getReservedSystemCost() {
        return reservedSystemCost;
    }

    public int getSafetyMargin() {
        return safetyMargin;
    }

    /** {@code contextWindow - reservedSystemCost - safetyMargin}; may be negative for tiny windows. */
    public int getAllowedPromptTokens() {
        return allowedPromptTokens;
    }

    public int getAllowedResponseTokens() {
        return allowedResponseTokens;
    }

    public boolean fits(int promptTokens) {
        return promptTokens <= allowedPromptTokens;
    }

    @Override
    public String toString() {
        return "TokenBudget{allowedPrompt=" + allowedPromptTokens + ", allowedResponse=" + allowedResponseTokens + "}";
    }
}
