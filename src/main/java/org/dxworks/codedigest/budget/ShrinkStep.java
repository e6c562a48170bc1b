package org.dxworks.codedigest.budget;

/**
 * One rung of the truncation ladder: a pure transform that never modifies its input.
 */
public interface ShrinkStep {

    String name();

    SummaryCandidate apply(SummaryCandidate candidate, TokenBudget budget);
}
