package org.dxworks.codedigest.budget;

import org.dxworks.codedigest.model.summary.HierarchicalSummary;

public final class ReduceExampleCapStep implements ShrinkStep {
    private final int exampleCap;

    public ReduceExampleCapStep(int exampleCap) {
        this.exampleCap = exampleCap;
    }

    @Override
    public String name() {
        return "reduce-example-cap";
    }

    @Override
    public SummaryCandidate apply(SummaryCandidate candidate, TokenBudget budget) {
        HierarchicalSummary reduced = candidate.getSummary().withStatementGroups(group -> group.withExampleCap(exampleCap));
        return SummaryCandidate.of(reduced);
    }
}
