package org.dxworks.codedigest.pipeline;

import org.dxworks.codedigest.budget.BudgetFitResult;
import org.dxworks.codedigest.model.Diagnostic;
import org.dxworks.codedigest.model.summary.HierarchicalSummary;

import java.util.List;

/**
 * Everything the pipeline produced for one unit. {@link #getSummary()} is the full summary; the
 * budgeted form, if any, is in {@link #getFitResult()}.
 */
public final class DigestResult {
    private final String unitName;
    private final String languageVariant;
    private final HierarchicalSummary summary;
    private final BudgetFitResult fitResult;
    private final ProgramMetrics metrics;
    private final List<Diagnostic> diagnostics;

    public DigestResult(String unitName, String languageVariant, HierarchicalSummary summary,
                        BudgetFitResult fitResult, ProgramMetrics metrics, List<Diagnostic> diagnostics) {
        this.unitName = unitName;
        this.languageVariant = languageVariant;
        this.summary = summary;
        this.fitResult = fitResult;
        this.metrics = metrics;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getUnitName() {
        return unitName;
    }

    public String getLanguageVariant() {
        return languageVariant;
    }

    public HierarchicalSummary getSummary() {
        return summary;
    }

    public BudgetFitResult getFitResult() {
        return fitResult;
    }

    public ProgramMetrics getMetrics() {
        return metrics;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
