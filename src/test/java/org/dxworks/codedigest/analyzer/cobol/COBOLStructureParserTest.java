package org.dxworks.codedigest.analyzer.cobol;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceNormalizer;
import org.dxworks.codedigest.classifier.CategoryClassifier;
import org.dxworks.codedigest.model.Diagnostic;
import org.dxworks.codedigest.model.DiagnosticKind;
import org.dxworks.codedigest.model.Procedure;
import org.dxworks.codedigest.model.ProcedureKind;
import org.dxworks.codedigest.model.RawAST;
import org.dxworks.codedigest.model.Statement;
import org.dxworks.codedigest.model.StatementType;
import org.dxworks.codedigest.model.Variable;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class COBOLStructureParserTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/cobol/";

    private final CobolSourceNormalizer normalizer = new CobolSourceNormalizer();
    private final COBOLStructureParser parser = new COBOLStructureParser(CategoryClassifier.defaults());

    @Test
    void singleUnknownLineBecomesUnknownStatement() {
        RawAST ast = parseFree("FROBNICATE THE WIDGETS.");

        assertEquals(1, ast.getStatements().size());
        Statement statement = ast.getStatements().get(0);
        assertEquals(StatementType.UNKNOWN, statement.getType());
        assertEquals("FROBNICATE THE WIDGETS.", statement.getRawText());
        assertEquals(-1, statement.getProcedureIndex());
        assertEquals(List.of(DiagnosticKind.UNRECOGNIZED_STATEMENT), kinds(ast.getDiagnostics()));
    }

    @Test
    void emptySourceGivesEmptyTree() {
        RawAST ast = parseFree("");

        assertTrue(ast.getStatements().isEmpty());
        assertTrue(ast.getProcedures().isEmpty());
        assertTrue(ast.getVariables().isEmpty());
        assertNull(ast.getProgramId());
    }

    @Test
    void statementsBelongToTheOpenParagraph() {
        RawAST ast = parseFree(
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    PERFORM SUB-PARA.",
                "    STOP RUN.",
                "SUB-PARA. DISPLAY 'IN SUB'.");

        List<Procedure> procedures = ast.getProcedures();
        assertEquals(2, procedures.size());
        assertEquals("MAIN-PARA", procedures.get(0).getName());
        assertEquals(ProcedureKind.PARAGRAPH, procedures.get(0).getKind());
        assertEquals(List.of(0, 1), procedures.get(0).getStatementIndices());
        assertEquals(List.of(2), procedures.get(1).getStatementIndices());

        Statement display = ast.getStatements().get(2);
        assertEquals(StatementType.IO, display.getType());
        assertEquals(5, display.getLine());
        assertEquals(1, display.getProcedureIndex());
    }

    @Test
    void oversizedOccursCountIsKeptAsMalformedVariable() {
        RawAST ast = parseFree(
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "05 WS-X PIC X OCCURS 99999999999 TIMES.",
                "05 WS-Y PIC 9.");

        assertEquals(2, ast.getVariables().size());
        Variable broken = ast.getVariables().get(0);
        assertEquals("WS-X", broken.getName());
        assertEquals(Variable.MALFORMED, broken.getCategory());
        assertNull(broken.getOccurs());
        assertEquals(List.of(DiagnosticKind.MALFORMED_DECLARATION), kinds(ast.getDiagnostics()));
        assertEquals("Malformed declaration of WS-X: OCCURS count is not an integer: 99999999999",
                ast.getDiagnostics().get(0).getMessage());
    }

    @Test
    void clauseOnNextLineContinuesStatement() {
        RawAST ast = parseFree(
                "PROCEDURE DIVISION.",
                "    MOVE WS-A",
                "        TO WS-B.",
                "    COMPUTE WS-C =",
                "        WS-A + WS-B.");

        assertEquals(2, ast.getStatements().size());
        Statement move = ast.getStatements().get(0);
        assertEquals("MOVE WS-A TO WS-B.", move.getRawText());
        assertEquals("WS-B", move.field(Statement.TARGET));
        assertEquals(2, move.getLine());
        assertEquals("WS-C", ast.getStatements().get(1).field(Statement.TARGET));
    }

    @Test
    void multiLineExecBlockIsOneEmbeddedStatement() {
        RawAST ast = parseFree(
                "PROCEDURE DIVISION.",
                "    EXEC SQL",
                "        SELECT NAME INTO :WS-NAME FROM CUSTOMER",
                "    END-EXEC.",
                "    GOBACK.");

        assertEquals(2, ast.getStatements().size());
        Statement exec = ast.getStatements().get(0);
        assertEquals(StatementType.EMBEDDED, exec.getType());
        assertEquals("SQL", exec.field(Statement.KIND));
        assertEquals(2, exec.getLine());
        assertEquals(StatementType.TERMINATE, ast.getStatements().get(1).getType());
        assertTrue(ast.getDiagnostics().isEmpty());
    }

    @Test
    void unterminatedExecBlockIsReported() {
        RawAST ast = parseFree(
                "PROCEDURE DIVISION.",
                "    EXEC CICS",
                "        RETURN");

        assertEquals(1, ast.getStatements().size());
        assertEquals(StatementType.EMBEDDED, ast.getStatements().get(0).getType());
        assertEquals(List.of(DiagnosticKind.UNTERMINATED_BLOCK), kinds(ast.getDiagnostics()));
        assertEquals(2, ast.getDiagnostics().get(0).getLine());
    }

    @Test
    void headerlessCopybookKeepsDataEntries() {
        RawAST ast = parseFree(
                "01 CUST-REC.",
                "   05 CUST-ID PIC 9(6).",
                "   05 CUST-BAD PIC.");

        List<Variable> variables = ast.getVariables();
        assertEquals(3, variables.size());
        assertEquals("identifier", variables.get(1).getCategory());
        assertEquals("9(6)", variables.get(1).getPicture());
        assertTrue(variables.get(2).isMalformed());
        assertEquals(List.of(DiagnosticKind.MALFORMED_DECLARATION), kinds(ast.getDiagnostics()));
    }

    @Test
    void opaqueLineIsKeptAsUnknownStatement() {
        String source = "       PROCEDURE DIVISION.\n"
                + "000200X    MOVE A TO B.\n"
                + "           STOP RUN.\n";
        RawAST ast = parser.parse(normalizer.normalize(source, CobolSourceFormat.FIXED));

        assertEquals(2, ast.getStatements().size());
        assertEquals(StatementType.UNKNOWN, ast.getStatements().get(0).getType());
        assertEquals(2, ast.getStatements().get(0).getLine());
        assertEquals(List.of(DiagnosticKind.INVALID_INDICATOR), kinds(ast.getDiagnostics()));
    }

    @Test
    void parsesFileHandlingProgram() throws Exception {
        String source = Files.readString(Paths.get(SAMPLES_BASE_PATH + "custfile.cbl"));
        RawAST ast = parser.parse(normalizer.normalize(source, CobolSourceFormat.FIXED));

        assertEquals("CUSTFILE", ast.getProgramId());
        assertEquals(List.of("CUSTOMER-FILE"), ast.getFileNames());
        assertEquals(List.of("CUSTCOPY"), ast.getCopybooks());

        assertEquals(List.of("MAIN-LOGIC", "0100-OPEN-FILES", "0200-READ-LOOP", "0900-EXIT"),
                ast.getProcedures().stream().map(Procedure::getName).collect(Collectors.toList()));
        assertEquals(ProcedureKind.SECTION, ast.getProcedures().get(0).getKind());
        assertEquals("MAIN-LOGIC", ast.getProcedures().get(2).getSection());
        assertEquals(List.of("control", "initialization", "file-handling", "exit"),
                ast.getProcedures().stream().map(Procedure::getCategory).collect(Collectors.toList()));

        assertEquals(List.of("CUSTOMER-RECORD", "CUST-ID", "CUST-NAME", "WS-EOF-SW", "END-OF-FILE",
                        "WS-READ-CNT", "WS-BAD-ITEM", "WS-MESSAGE"),
                ast.getVariables().stream().map(Variable::getName).collect(Collectors.toList()));
        Variable readCount = ast.getVariables().get(5);
        assertEquals("COMP-3", readCount.getUsage());
        assertEquals("WORKING-STORAGE", readCount.getSection());
        assertEquals("counter", readCount.getCategory());
        assertEquals("FILE", ast.getVariables().get(0).getSection());
        assertTrue(ast.getVariables().get(6).isMalformed());

        assertEquals(List.of(StatementType.COPY, StatementType.IO, StatementType.LOOP, StatementType.IO,
                        StatementType.OTHER, StatementType.OTHER, StatementType.OTHER, StatementType.OTHER,
                        StatementType.EMBEDDED, StatementType.IO, StatementType.CALL, StatementType.UNKNOWN,
                        StatementType.IO, StatementType.TERMINATE),
                ast.getStatements().stream().map(Statement::getType).collect(Collectors.toList()));
        Statement call = ast.getStatements().get(10);
        assertEquals("AUDITLOG", call.field(Statement.TARGET));
        assertEquals("STATIC", call.field(Statement.KIND));
        assertEquals(38, call.getLine());

        assertEquals(List.of(new Diagnostic(DiagnosticKind.MALFORMED_DECLARATION, 19,
                                "Malformed declaration of WS-BAD-ITEM: PIC without operand"),
                        new Diagnostic(DiagnosticKind.UNRECOGNIZED_STATEMENT, 39,
                                "Unrecognized statement: FROBNICATE THE WIDGETS.")),
                ast.getDiagnostics());
    }

    private RawAST parseFree(String... lines) {
        return parser.parse(normalizer.normalize(String.join("\n", lines), CobolSourceFormat.FREE));
    }

    private static List<DiagnosticKind> kinds(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::getKind).collect(Collectors.toList());
    }
}
