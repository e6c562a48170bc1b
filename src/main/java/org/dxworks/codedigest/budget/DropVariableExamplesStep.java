package org.dxworks.codedigest.budget;

import org.dxworks.codedigest.model.summary.VariableGroup;

public final class DropVariableExamplesStep implements ShrinkStep {

    @Override
    public String name() {
        return "drop-variable-examples";
    }

    @Override
    public SummaryCandidate apply(SummaryCandidate candidate, TokenBudget budget) {
        return SummaryCandidate.of(candidate.getSummary().withVariableGroups(VariableGroup::withoutExamples));
    }
}
