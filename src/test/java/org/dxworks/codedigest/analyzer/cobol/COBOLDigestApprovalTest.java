package org.dxworks.codedigest.analyzer.cobol;

import org.approvaltests.Approvals;
import org.dxworks.codedigest.LanguageVariant;
import org.dxworks.codedigest.TestUtils;
import org.dxworks.codedigest.budget.BudgetFitResult;
import org.dxworks.codedigest.model.SourceUnit;
import org.dxworks.codedigest.pipeline.CodeDigester;
import org.dxworks.codedigest.pipeline.DigestResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class COBOLDigestApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/cobol/";

    @Test
    void digest_COBOL_PayrollCalculation() throws Exception {
        DigestResult result = digest("paycalc.cbl", LanguageVariant.COBOL_FIXED);

        assertTrue(result.getDiagnostics().isEmpty());
        assertEquals(3, result.getMetrics().getCyclomaticComplexity());
        assertEquals(1, result.getMetrics().getNestingDepth());

        BudgetFitResult.Fitted fitted = assertInstanceOf(BudgetFitResult.Fitted.class, result.getFitResult());
        assertTrue(fitted.getStepsApplied().isEmpty());
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(fitted.getSummary()));
    }

    private static DigestResult digest(String fileName, LanguageVariant variant) throws Exception {
        byte[] bytes = Files.readAllBytes(Paths.get(SAMPLES_BASE_PATH + fileName));
        return new CodeDigester().digest(new SourceUnit(fileName, variant, bytes, null));
    }
}
