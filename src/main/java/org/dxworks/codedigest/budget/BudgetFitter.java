package org.dxworks.codedigest.budget;

import org.dxworks.codedigest.model.summary.HierarchicalSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives a summary through the truncation ladder until its payload fits the prompt budget.
 * <p>
 * Checks the budget, then applies one shrink step at a time and checks again, for at most
 * {@link BudgetConfig#getMaxShrinkIterations()} steps. A payload over budget is never returned:
 * when the ladder runs out the result is {@link BudgetFitResult.InputTooLarge}.
 */
public class BudgetFitter {

    private final BudgetConfig config;
    private final TokenEstimator estimator;
    private final List<ShrinkStep> ladder;

    public BudgetFitter(BudgetConfig config) {
        this(config, defaultLadder(config));
    }

    public BudgetFitter(BudgetConfig config, List<ShrinkStep> ladder) {
        this.config = Objects.requireNonNull(config, "config");
        this.estimator = new TokenEstimator(config.getCharsPerToken());
        this.ladder = List.copyOf(ladder);
    }

    public static List<ShrinkStep> defaultLadder(BudgetConfig config) {
        return List.of(
                new ReduceExampleCapStep(config.getReducedExampleCap()),
                new DropVariableExamplesStep(),
                new DropProcedureNamesStep(),
                new TruncatePayloadStep(new TokenEstimator(config.getCharsPerToken())));
    }

    public BudgetFitResult fit(HierarchicalSummary summary) {
        Objects.requireNonNull(summary, "summary");
        TokenBudget budget = TokenBudget.of(config);
        if (budget.getAllowedPromptTokens() < config.getMinimumPromptTokens()) {
            return new BudgetFitResult.InputTooLarge(
                    "allowed prompt tokens " + budget.getAllowedPromptTokens()
                            + " below minimum " + config.getMinimumPromptTokens(),
                    -1, budget.getAllowedPromptTokens());
        }

        SummaryCandidate candidate = SummaryCandidate.of(summary);
        int estimate = estimator.estimateTokens(candidate.getPayload());
        List<String> applied = new ArrayList<>();

        int iterations = Math.min(config.getMaxShrinkIterations(), ladder.size());
        for (int i = 0; i < iterations && !budget.fits(estimate); i++) {
            ShrinkStep step = ladder.get(i);
            candidate = step.apply(candidate, budget);
            estimate = estimator.estimateTokens(candidate.getPayload());
            applied.add(step.name());
        }

        if (!budget.fits(estimate)) {
            return new BudgetFitResult.InputTooLarge(
                    "summary still estimated at " + estimate + " tokens after " + applied.size() + " shrink steps",
                    estimate, budget.getAllowedPromptTokens());
        }
        TokenBudget spent = TokenBudget.of(config, estimate);
        return new BudgetFitResult.Fitted(candidate.getSummary(), candidate.getPayload(), estimate, applied,
                spent.getAllowedResponseTokens());
    }

    public int estimateTokens(String text) {
        return estimator.estimateTokens(text);
    }

    public BudgetConfig getConfig() {
        return config;
    }
}
