package org.dxworks.codedigest.pipeline;

import org.dxworks.codedigest.LanguageVariant;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;
import org.dxworks.codedigest.budget.BudgetFitResult;
import org.dxworks.codedigest.model.DiagnosticKind;
import org.dxworks.codedigest.model.SourceUnit;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class CodeDigesterTest {

    private final CodeDigester digester = new CodeDigester();

    @Test
    void sniffsFormatWhenNoVariantIsDeclared() throws Exception {
        byte[] source = ("       IDENTIFICATION DIVISION.\n"
                + "       PROGRAM-ID. HELLO.\n"
                + "       PROCEDURE DIVISION.\n"
                + "           DISPLAY 'HELLO'.\n").getBytes(StandardCharsets.UTF_8);

        DigestResult result = digester.digest(new SourceUnit("hello.cbl", null, source, null));

        assertEquals("cobol-fixed", result.getLanguageVariant());
        assertEquals("HELLO", result.getSummary().getName());
        assertEquals("hello.cbl", result.getUnitName());
        assertInstanceOf(BudgetFitResult.Fitted.class, result.getFitResult());
    }

    @Test
    void unitNameStandsInForMissingProgramId() throws Exception {
        DigestResult result = digester.digest(new SourceUnit("copybook.cpy", LanguageVariant.COBOL_FREE,
                "01 WS-REC PIC X(10).".getBytes(StandardCharsets.UTF_8), null));

        assertEquals("copybook.cpy", result.getSummary().getName());
        assertEquals("cobol-free", result.getSummary().getLanguageVariant());
        assertEquals(1, result.getSummary().getTotalVariables());
    }

    @Test
    void decoderDiagnosticsReachTheResult() throws Exception {
        byte[] source = "DISPLAY 'CAFÉ'.".getBytes(StandardCharsets.ISO_8859_1);

        ParseResult parsed = digester.parse(source, "no-such-charset", CobolSourceFormat.FREE);

        assertEquals(StandardCharsets.ISO_8859_1, parsed.getCharset());
        assertEquals(DiagnosticKind.UNKNOWN_ENCODING_HINT, parsed.getDiagnostics().get(0).getKind());
        assertEquals(DiagnosticKind.ENCODING_FALLBACK, parsed.getDiagnostics().get(1).getKind());
        assertEquals("DISPLAY 'CAFÉ'.", parsed.getRawAst().getStatements().get(0).getRawText());
    }

    @Test
    void estimatesWithConfiguredRatio() {
        assertEquals(2, digester.estimateTokens("1234567"));
    }
}
