package org.dxworks.codedigest.analysis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockAnalysisClientTest {

    private final AnalysisClient client = new MockAnalysisClient();

    @Test
    void answersFromSummaryTotals() {
        AnalysisOutcome outcome = client.analyze(
                "{\"name\":\"PAYCALC\",\"total_statements\":8,\"total_procedures\":3,\"total_variables\":3}",
                AnalysisPrompts.SYSTEM_PREAMBLE);

        assertTrue(outcome.isSuccess());
        assertEquals("Program 'PAYCALC' contains 8 statements, 3 procedures and 3 variables. Mock program analysis.",
                outcome.getText());
    }

    @Test
    void mentionsTruncation() {
        AnalysisOutcome outcome = client.analyze(
                "{\"name\":\"BIG\",\"truncated\":true,\"total_statements\":90000,\"_truncated\":\"[TRUNCATED: 10 chars omitted]\"}",
                AnalysisPrompts.SYSTEM_PREAMBLE);

        assertTrue(outcome.getText().contains("The summary was truncated."));
    }

    @Test
    void invalidPayloadIsAFailureNotAnException() {
        AnalysisOutcome outcome = client.analyze("{\"name\":", AnalysisPrompts.SYSTEM_PREAMBLE);

        assertFalse(outcome.isSuccess());
        assertNull(outcome.getText());
        assertTrue(outcome.getFailure().startsWith("Summary is not valid JSON"));
    }
}
