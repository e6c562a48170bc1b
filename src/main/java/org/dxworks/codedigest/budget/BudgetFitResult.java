package org.dxworks.codedigest.budget;

import org.dxworks.codedigest.model.summary.HierarchicalSummary;

import java.util.List;

/**
 * Outcome of fitting a summary to a token budget: either a payload that fits, or the verdict that
 * the unit cannot be summarized within the budget.
 */
public abstract class BudgetFitResult {

    private BudgetFitResult() {
    }

    public abstract boolean fits();

    public static final class Fitted extends BudgetFitResult {
        private final HierarchicalSummary summary;
        private final String payload;
        private final int estimatedTokens;
        private final List<String> stepsApplied;
        private final int allowedResponseTokens;

        Fitted(HierarchicalSummary summary, String payload, int estimatedTokens, List<String> stepsApplied,
               int allowedResponseTokens) {
            this.summary = summary;
            this.payload = payload;
            this.estimatedTokens = estimatedTokens;
            this.stepsApplied = List.copyOf(stepsApplied);
            this.allowedResponseTokens = allowedResponseTokens;
        }

        @Override
        public boolean fits() {
            return true;
        }

        public HierarchicalSummary getSummary() {
            return summary;
        }

        /** Compact JSON to send downstream; may be a cut version of the serialized summary. */
        public String getPayload() {
            return payload;
        }

        public int getEstimatedTokens() {
            return estimatedTokens;
        }

        /** Names of the ladder steps applied, in order; empty when the summary fit as is. */
        public List<String> getStepsApplied() {
            return stepsApplied;
        }

        public int getAllowedResponseTokens() {
            return allowedResponseTokens;
        }

        public boolean isTruncated() {
            return summary.truncated();
        }
    }

    public static final class InputTooLarge extends BudgetFitResult {
        private final String reason;
        private final int estimatedTokens;
        private final int allowedPromptTokens;

        InputTooLarge(String reason, int estimatedTokens, int allowedPromptTokens) {
            this.reason = reason;
            this.estimatedTokens = estimatedTokens;
            this.allowedPromptTokens = allowedPromptTokens;
        }

        @Override
        public boolean fits() {
            return false;
        }

        public String getReason() {
            return reason;
        }

        /** Estimate of the smallest candidate reached, or -1 when the budget was rejected up front. */
        public int getEstimatedTokens() {
            return estimatedTokens;
        }

        public int getAllowedPromptTokens() {
            return allowedPromptTokens;
        }

        @Override
        public String toString() {
            return "InputTooLarge{" + reason + ", estimate=" + estimatedTokens + ", allowed=" + allowedPromptTokens + "}";
        }
    }
}
