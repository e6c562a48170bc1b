package org.dxworks.codedigest.budget;

import org.dxworks.codedigest.model.summary.ProcedureGroup;

public final class DropProcedureNamesStep implements ShrinkStep {

    @Override
    public String name() {
        return "drop-procedure-names";
    }

    @Override
    public SummaryCandidate apply(SummaryCandidate candidate, TokenBudget budget) {
        return SummaryCandidate.of(candidate.getSummary().withProcedureGroups(ProcedureGroup::withoutNames));
    }
}
