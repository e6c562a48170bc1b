package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.model.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CobolSourceNormalizerTest {

    private final CobolSourceNormalizer normalizer = new CobolSourceNormalizer();

    @Test
    void cutsSequenceAndIdentificationAreas() {
        String line = String.format("%-72s%s", "000100     MOVE A TO B.", "PAYROLL1");

        NormalizedSource source = normalizer.normalize(line, CobolSourceFormat.FIXED);

        assertEquals(1, source.getLines().size());
        assertEquals("MOVE A TO B.", source.getLines().get(0).getText());
        assertTrue(source.getDiagnostics().isEmpty());
    }

    @Test
    void commentsAreKeptAsCommentLines() {
        NormalizedSource source = normalizer.normalize(
                "      * CALCULATE THE TOTAL\n"
                        + "      / NEW PAGE\n"
                        + "           ADD 1 TO WS-COUNT.\n",
                CobolSourceFormat.FIXED);

        List<LogicalLine> lines = source.getLines();
        assertEquals(3, lines.size());
        assertEquals(LogicalLineKind.COMMENT, lines.get(0).getKind());
        assertEquals(LogicalLineKind.COMMENT, lines.get(1).getKind());
        assertEquals(LogicalLineKind.CODE, lines.get(2).getKind());
        assertEquals(3, lines.get(2).getFirstLine());
    }

    @Test
    void joinsContinuedLiteral() {
        NormalizedSource source = normalizer.normalize(
                "       01 WS-MSG PIC X(40) VALUE 'HELLO\n"
                        + "      -    'WORLD'.\n",
                CobolSourceFormat.FIXED);

        assertEquals(1, source.getLines().size());
        LogicalLine line = source.getLines().get(0);
        assertEquals("01 WS-MSG PIC X(40) VALUE 'HELLOWORLD'.", line.getText());
        assertEquals(1, line.getFirstLine());
        assertEquals(2, line.getLastLine());
    }

    @Test
    void joinsContinuedWordAcrossComment() {
        NormalizedSource source = normalizer.normalize(
                "           MOVE WS-TOTAL-\n"
                        + "      * NOTE\n"
                        + "      -    AMOUNT TO WS-OUT.\n",
                CobolSourceFormat.FIXED);

        List<LogicalLine> lines = source.getLines();
        assertEquals(2, lines.size());
        assertEquals("MOVE WS-TOTAL-AMOUNT TO WS-OUT.", lines.get(0).getText());
        assertEquals(LogicalLineKind.COMMENT, lines.get(1).getKind());
    }

    @Test
    void invalidIndicatorGivesOpaqueLine() {
        NormalizedSource source = normalizer.normalize("000100X    MOVE A TO B.\n", CobolSourceFormat.FIXED);

        assertEquals(LogicalLineKind.OPAQUE, source.getLines().get(0).getKind());
        assertEquals(1, source.getDiagnostics().size());
        assertEquals(DiagnosticKind.INVALID_INDICATOR, source.getDiagnostics().get(0).getKind());
        assertEquals(1, source.getDiagnostics().get(0).getLine());
    }

    @Test
    void continuationWithoutCodeLineIsOrphan() {
        NormalizedSource source = normalizer.normalize(
                "      -    'DANGLING'.\n"
                        + "           STOP RUN.\n",
                CobolSourceFormat.FIXED);

        assertEquals(LogicalLineKind.OPAQUE, source.getLines().get(0).getKind());
        assertEquals("STOP RUN.", source.getLines().get(1).getText());
        assertEquals(DiagnosticKind.ORPHAN_CONTINUATION, source.getDiagnostics().get(0).getKind());
    }

    @Test
    void controlCharactersAreReported() {
        NormalizedSource source = normalizer.normalize("           MOVE A\u0001 TO B.\n", CobolSourceFormat.FIXED);

        assertEquals(LogicalLineKind.OPAQUE, source.getLines().get(0).getKind());
        assertEquals(DiagnosticKind.CONTROL_CHARACTERS, source.getDiagnostics().get(0).getKind());
    }

    @Test
    void freeFormatStripsFloatingComments() {
        NormalizedSource source = normalizer.normalize(
                "*> whole line comment\n"
                        + "MOVE '*>' TO WS-MARK. *> trailing\n",
                CobolSourceFormat.FREE);

        List<LogicalLine> lines = source.getLines();
        assertEquals(LogicalLineKind.COMMENT, lines.get(0).getKind());
        assertEquals("MOVE '*>' TO WS-MARK.", lines.get(1).getText());
    }

    @Test
    void decodesAndSniffsFormatFromBytes() throws Exception {
        byte[] bytes = ">>SOURCE FORMAT FREE\nDISPLAY 'HI'.\n".getBytes(java.nio.charset.StandardCharsets.UTF_8);

        NormalizedSource source = normalizer.normalize(bytes, null, null);

        assertEquals(CobolSourceFormat.FREE, source.getFormat());
        assertEquals(LogicalLineKind.DIRECTIVE, source.getLines().get(0).getKind());
        assertEquals("DISPLAY 'HI'.", source.getLines().get(1).getText());
    }

    @Test
    void heuristicsDefaultToFixed() {
        assertEquals(CobolSourceFormat.FIXED, SourceFormatHeuristics.detect("       IDENTIFICATION DIVISION.\n"));
        assertEquals(CobolSourceFormat.FIXED, SourceFormatHeuristics.detect(""));
        assertEquals(CobolSourceFormat.FREE, SourceFormatHeuristics.detect("IDENTIFICATION DIVISION.\nPROGRAM-ID. X.\n"));
    }
}
