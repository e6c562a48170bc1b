package org.dxworks.codedigest.budget;

/**
 * Size limits of the downstream model. Defaults follow an 8k context model with room kept for the
 * system preamble and the answer.
 */
public final class BudgetConfig {
    public static final int DEFAULT_CONTEXT_WINDOW = 8192;
    public static final int DEFAULT_RESERVED_SYSTEM_COST = 500;
    public static final int DEFAULT_SAFETY_MARGIN = 1000;
    public static final int DEFAULT_RESPONSE_CAP = 4000;
    public static final int DEFAULT_MINIMUM_PROMPT_TOKENS = 256;
    public static final int DEFAULT_MAX_SHRINK_ITERATIONS = 4;
    public static final int DEFAULT_REDUCED_EXAMPLE_CAP = 1;

    private final int contextWindow;
    private final int reservedSystemCost;
    private final int safetyMargin;
    private final int responseCap;
    private final int minimumPromptTokens;
    private final int maxShrinkIterations;
    private final int reducedExampleCap;
    private final double charsPerToken;

    private BudgetConfig(Builder builder) {
        this.contextWindow = requireNonNegative("contextWindow", builder.contextWindow);
        this.reservedSystemCost = requireNonNegative("reservedSystemCost", builder.reservedSystemCost);
        this.safetyMargin = requireNonNegative("safetyMargin", builder.safetyMargin);
        this.responseCap = requireNonNegative("responseCap", builder.responseCap);
        this.minimumPromptTokens = requireNonNegative("minimumPromptTokens", builder.minimumPromptTokens);
        this.maxShrinkIterations = requireNonNegative("maxShrinkIterations", builder.maxShrinkIterations);
        this.reducedExampleCap = requireNonNegative("reducedExampleCap", builder.reducedExampleCap);
        if (!(builder.charsPerToken > 0)) {
            throw new IllegalArgumentException("charsPerToken must be positive, was " + builder.charsPerToken);
        }
        this.charsPerToken = builder.charsPerToken;
    }

    public static BudgetConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .contextWindow(contextWindow)
                .reservedSystemCost(reservedSystemCost)
                .safetyMargin(safetyMargin)
                .responseCap(responseCap)
                .minimumPromptTokens(minimumPromptTokens)
                .maxShrinkIterations(maxShrinkIterations)
                .reducedExampleCap(reducedExampleCap)
                .charsPerToken(charsPerToken);
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

    public int getResponseCap() {
        return responseCap;
    }

    public int getMinimumPromptTokens() {
        return minimumPromptTokens;
    }

    public int getMaxShrinkIterations() {
        return maxShrinkIterations;
    }

    public int getReducedExampleCap() {
        return reducedExampleCap;
    }

    public double getCharsPerToken() {
        return charsPerToken;
    }

    private static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was " + value);
        }
        return value;
    }

    public static final class Builder {
        private int contextWindow = DEFAULT_CONTEXT_WINDOW;
        private int reservedSystemCost = DEFAULT_RESERVED_SYSTEM_COST;
        private int safetyMargin = DEFAULT_SAFETY_MARGIN;
        private int responseCap = DEFAULT_RESPONSE_CAP;
        private int minimumPromptTokens = DEFAULT_MINIMUM_PROMPT_TOKENS;
        private int maxShrinkIterations = DEFAULT_MAX_SHRINK_ITERATIONS;
        private int reducedExampleCap = DEFAULT_REDUCED_EXAMPLE_CAP;
        private double charsPerToken = TokenEstimator.DEFAULT_CHARS_PER_TOKEN;

        private Builder() {
        }

        public Builder contextWindow(int value) {
            this.contextWindow = value;
            return this;
        }

        public Builder reservedSystemCost(int value) {
            this.reservedSystemCost = value;
            return this;
        }

        public Builder safetyMargin(int value) {
            this.safetyMargin = value;
            return this;
        }

        public Builder responseCap(int value) {
            this.responseCap = value;
            return this;
        }

        public Builder minimumPromptTokens(int value) {
            this.minimumPromptTokens = value;
            return this;
        }

        public Builder maxShrinkIterations(int value) {
            this.maxShrinkIterations = value;
            return this;
        }

        public Builder reducedExampleCap(int value) {
            this.reducedExampleCap = value;
            return this;
        }

        public Builder charsPerToken(double value) {
            this.charsPerToken = value;
            return this;
        }

        public BudgetConfig build() {
            return new BudgetConfig(this);
        }
    }
}
