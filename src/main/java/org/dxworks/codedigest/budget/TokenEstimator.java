package org.dxworks.codedigest.budget;

/**
 * Approximates token counts from character counts. Not a tokenizer: with the default ratio of
 * 3.5 characters per token the estimate stays within roughly 25% of real tokenizers on
 * COBOL-flavoured JSON, erring towards overestimation.
 */
public final class TokenEstimator {
    public static final double DEFAULT_CHARS_PER_TOKEN = 3.5;

    private static final TokenEstimator DEFAULT = new TokenEstimator(DEFAULT_CHARS_PER_TOKEN);

    private final double charsPerToken;

    public TokenEstimator(double charsPerToken) {
        if (!(charsPerToken > 0)) {
            throw new IllegalArgumentException("charsPerToken must be positive, was " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    public static TokenEstimator defaults() {
        return DEFAULT;
    }

    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / charsPerToken);
    }

    /** Longest text length whose estimate does not exceed {@code tokens}. */
    public int maxCharsFor(int tokens) {
        if (tokens <= 0) {
            return 0;
        }
        return (int) Math.floor(tokens * charsPerToken);
    }

    public double getCharsPerToken() {
        return charsPerToken;
    }
}
