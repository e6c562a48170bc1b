package org.dxworks.codedigest.budget;

/**
 * Last rung: cuts the serialized payload to the character budget and flags the summary as
 * truncated. Leaves the candidate untouched when no valid cut fits.
 */
public final class TruncatePayloadStep implements ShrinkStep {
    private final TokenEstimator estimator;

    public TruncatePayloadStep(TokenEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public String name() {
        return "truncate-payload";
    }

    @Override
    public SummaryCandidate apply(SummaryCandidate candidate, TokenBudget budget) {
        // the flag must be part of the text that gets cut
        SummaryCandidate flagged = SummaryCandidate.of(candidate.getSummary().asTruncated());
        int maxChars = estimator.maxCharsFor(budget.getAllowedPromptTokens());
        String cut = JsonPayloadTruncator.truncate(flagged.getPayload(), maxChars);
        if (cut == null) {
            return candidate;
        }
        return new SummaryCandidate(flagged.getSummary(), cut);
    }
}
