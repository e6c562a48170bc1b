package org.dxworks.codedigest.analysis;

/**
 * Downstream text-generation collaborator. Implementations own retries and provider selection;
 * they report failures as {@link AnalysisOutcome#failure(String)} instead of throwing.
 */
public interface AnalysisClient {
    AnalysisOutcome analyze(String serializedSummary, String systemPreamble);
}
