package org.dxworks.codedigest.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Offline stand-in for a real model. Answers deterministically from the totals of the payload.
 */
public class MockAnalysisClient implements AnalysisClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public AnalysisOutcome analyze(String serializedSummary, String systemPreamble) {
        JsonNode summary;
        try {
            summary = MAPPER.readTree(serializedSummary);
        } catch (JsonProcessingException e) {
            return AnalysisOutcome.failure("Summary is not valid JSON: " + e.getOriginalMessage());
        }
        if (summary == null || !summary.isObject()) {
            return AnalysisOutcome.failure("Summary is not a JSON object");
        }

        String name = summary.path("name").asText("Unknown");
        StringBuilder text = new StringBuilder()
                .append("Program '").append(name).append("' contains ")
                .append(summary.path("total_statements").asInt()).append(" statements, ")
                .append(summary.path("total_procedures").asInt()).append(" procedures and ")
                .append(summary.path("total_variables").asInt()).append(" variables.");
        if (summary.path("truncated").asBoolean(false)) {
            text.append(" The summary was truncated.");
        }
        text.append(" Mock program analysis.");
        return AnalysisOutcome.text(text.toString());
    }
}
