package org.dxworks.codedigest.analyzer.cobol;

import org.dxworks.codedigest.analyzer.LanguageParser;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.LogicalLine;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.NormalizedSource;
import org.dxworks.codedigest.classifier.CategoryClassifier;
import org.dxworks.codedigest.classifier.NameKind;
import org.dxworks.codedigest.model.Diagnostic;
import org.dxworks.codedigest.model.DiagnosticKind;
import org.dxworks.codedigest.model.Procedure;
import org.dxworks.codedigest.model.ProcedureKind;
import org.dxworks.codedigest.model.RawAST;
import org.dxworks.codedigest.model.Statement;
import org.dxworks.codedigest.model.StatementType;
import org.dxworks.codedigest.model.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single linear pass over normalized COBOL lines producing the flat structural tree.
 * <p>
 * Division headers switch the context. Procedure boundaries are section and paragraph headers;
 * every statement belongs to the procedure open when its first line was read. Lines nothing
 * recognises are kept as {@link StatementType#UNKNOWN} statements, bad declarations as
 * {@link Variable#MALFORMED} variables; the parser never throws on source content.
 */
public class COBOLStructureParser implements LanguageParser {

    private static final String IDENT = "[A-Za-z0-9][A-Za-z0-9-]*";

    private static final Pattern DIVISION_HEADER = Pattern.compile(
            "^(IDENTIFICATION|ID|ENVIRONMENT|DATA|PROCEDURE)\\s+DIVISION\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_PROGRAM = Pattern.compile("^END\\s+PROGRAM\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROGRAM_ID = Pattern.compile(
            "^PROGRAM-ID\\s*\\.?\\s*(?:'([^']+)'|\"([^\"]+)\"|(" + IDENT + "))", Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT = Pattern.compile(
            "\\bSELECT\\s+(?:OPTIONAL\\s+)?(" + IDENT + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATA_SECTION = Pattern.compile(
            "^(WORKING-STORAGE|LOCAL-STORAGE|LINKAGE|FILE|COMMUNICATION|REPORT|SCREEN)\\s+SECTION\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_DESCRIPTION = Pattern.compile("^(FD|SD|RD)\\s+(" + IDENT + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEVEL_ENTRY = Pattern.compile("^(\\d{1,2})\\s+[A-Za-z]");
    private static final Pattern SECTION_HEADER = Pattern.compile(
            "^(" + IDENT + ")\\s+SECTION(?:\\s+\\d+)?\\s*\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_HEADER = Pattern.compile("^(" + IDENT + ")\\.(?:\\s+(.*))?$");
    private static final Pattern DECLARATIVES = Pattern.compile("^(END\\s+)?DECLARATIVES\\s*\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXEC_START = Pattern.compile("^EXEC\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_EXEC = Pattern.compile("\\bEND-EXEC\\b", Pattern.CASE_INSENSITIVE);

    private final CategoryClassifier classifier;
    private final StatementPatternRegistry registry;

    public COBOLStructureParser(CategoryClassifier classifier) {
        this(classifier, StatementPatternRegistry.defaults());
    }

    public COBOLStructureParser(CategoryClassifier classifier, StatementPatternRegistry registry) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public RawAST parse(NormalizedSource source) {
        ParseState state = new ParseState(source.getDiagnostics());
        for (LogicalLine line : source.getLines()) {
            switch (line.getKind()) {
                case CODE:
                    processCode(state, line.getFirstLine(), line.getText());
                    break;
                case OPAQUE:
                    state.flushAll();
                    state.addStatement(new Statement(StatementType.UNKNOWN, line.getFirstLine(), line.getText(),
                            Map.of(), state.currentProcedure));
                    break;
                default:
                    // comments, debug lines and directives carry no structure
                    break;
            }
        }
        state.finish();
        return state.toRawAST();
    }

    private void processCode(ParseState state, int lineNumber, String text) {
        if (state.execBlock != null) {
            state.execBlock.append(' ').append(text);
            if (END_EXEC.matcher(text).find()) {
                state.flushExec();
            }
            return;
        }

        if (state.skipUntilPeriod) {
            if (!LEVEL_ENTRY.matcher(text).lookingAt() && !isStructuralHeader(text)) {
                state.skipUntilPeriod = !text.endsWith(".");
                return;
            }
            state.skipUntilPeriod = false;
        }

        if (state.pendingEntry != null) {
            if (startsNewEntry(state, text)) {
                state.flushEntry(true);
            } else {
                state.pendingEntry.append(' ').append(text);
                if (text.endsWith(".")) {
                    state.flushEntry(false);
                }
                return;
            }
        }

        Matcher division = DIVISION_HEADER.matcher(text);
        if (division.lookingAt()) {
            state.flushAll();
            state.enterDivision(Division.of(division.group(1)));
            // PROCEDURE DIVISION USING lists may run over several lines
            state.skipUntilPeriod = !text.endsWith(".");
            return;
        }
        if (END_PROGRAM.matcher(text).lookingAt()) {
            state.flushAll();
            state.currentProcedure = -1;
            state.currentSection = null;
            return;
        }

        switch (state.division) {
            case IDENTIFICATION:
                processIdentification(state, text);
                break;
            case ENVIRONMENT:
                processEnvironment(state, text);
                break;
            case DATA:
                processData(state, lineNumber, text);
                break;
            default:
                processProcedure(state, lineNumber, text);
                break;
        }
    }

    private static void processIdentification(ParseState state, String text) {
        Matcher programId = PROGRAM_ID.matcher(text);
        if (state.programId == null && programId.lookingAt()) {
            state.programId = firstNonNull(programId.group(1), programId.group(2), programId.group(3));
        }
    }

    private static void processEnvironment(ParseState state, String text) {
        Matcher select = SELECT.matcher(text);
        if (select.find()) {
            state.fileNames.add(select.group(1).toUpperCase(Locale.ROOT));
        }
    }

    private void processData(ParseState state, int lineNumber, String text) {
        Matcher section = DATA_SECTION.matcher(text);
        if (section.lookingAt()) {
            state.flushStatement();
            state.dataSection = section.group(1).toUpperCase(Locale.ROOT);
            return;
        }
        Matcher fd = FILE_DESCRIPTION.matcher(text);
        if (fd.lookingAt()) {
            state.flushStatement();
            state.fileNames.add(fd.group(2).toUpperCase(Locale.ROOT));
            state.skipUntilPeriod = !text.endsWith(".");
            return;
        }
        if (LEVEL_ENTRY.matcher(text).lookingAt()) {
            state.startEntry(lineNumber, text);
            return;
        }
        processStatementText(state, lineNumber, text);
    }

    private void processProcedure(ParseState state, int lineNumber, String text) {
        // headerless copybooks may hold data entries
        if (state.division == Division.NONE && LEVEL_ENTRY.matcher(text).lookingAt()) {
            state.startEntry(lineNumber, text);
            return;
        }
        if (continuesPendingStatement(state, text)) {
            state.pendingText.append(' ').append(text);
            return;
        }
        if (DECLARATIVES.matcher(text).matches()) {
            state.flushStatement();
            return;
        }

        Matcher section = SECTION_HEADER.matcher(text);
        if (section.matches()) {
            state.flushStatement();
            state.openProcedure(section.group(1), ProcedureKind.SECTION, lineNumber);
            return;
        }

        Matcher paragraph = PARAGRAPH_HEADER.matcher(text);
        if (paragraph.matches() && isParagraphName(paragraph.group(1))) {
            state.flushStatement();
            state.openProcedure(paragraph.group(1), ProcedureKind.PARAGRAPH, lineNumber);
            String rest = paragraph.group(2);
            if (rest != null && !rest.isBlank()) {
                processStatementText(state, lineNumber, rest.trim());
            }
            return;
        }

        processStatementText(state, lineNumber, text);
    }

    private void processStatementText(ParseState state, int lineNumber, String text) {
        if (EXEC_START.matcher(text).lookingAt()) {
            state.flushStatement();
            if (END_EXEC.matcher(text).find()) {
                state.pendingLine = lineNumber;
                state.pendingText = new StringBuilder(text);
                state.flushStatement();
            } else {
                state.execLine = lineNumber;
                state.execBlock = new StringBuilder(text);
            }
            return;
        }
        if (continuesPendingStatement(state, text)) {
            state.pendingText.append(' ').append(text);
            return;
        }
        state.flushStatement();
        state.pendingLine = lineNumber;
        state.pendingText = new StringBuilder(text);
    }

    private static boolean continuesPendingStatement(ParseState state, String text) {
        if (state.pendingText == null) {
            return false;
        }
        String pending = state.pendingText.toString().trim();
        if (pending.endsWith(".")) {
            return false;
        }
        return CobolWords.CLAUSE_CONTINUATIONS.contains(CobolWords.firstWord(text))
                || CobolWords.OPERAND_EXPECTED.contains(CobolWords.lastWord(pending));
    }

    // a level entry without its period is closed by the next entry unless it still awaits an operand
    private static boolean startsNewEntry(ParseState state, String text) {
        if (!LEVEL_ENTRY.matcher(text).lookingAt()) {
            return isStructuralHeader(text);
        }
        return !CobolWords.DATA_OPERAND_EXPECTED.contains(CobolWords.lastWord(state.pendingEntry.toString()));
    }

    private static boolean isStructuralHeader(String text) {
        return DIVISION_HEADER.matcher(text).lookingAt()
                || DATA_SECTION.matcher(text).lookingAt()
                || FILE_DESCRIPTION.matcher(text).lookingAt()
                || SECTION_HEADER.matcher(text).matches();
    }

    private static boolean isParagraphName(String name) {
        return !CobolWords.NOT_PARAGRAPH_NAMES.contains(name.toUpperCase(Locale.ROOT));
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private enum Division {
        NONE, IDENTIFICATION, ENVIRONMENT, DATA, PROCEDURE;

        static Division of(String header) {
            String upper = header.toUpperCase(Locale.ROOT);
            return upper.equals("ID") ? IDENTIFICATION : valueOf(upper);
        }
    }

    private static final class ProcedureBuilder {
        final String name;
        final ProcedureKind kind;
        final int line;
        final String section;
        final List<Integer> statementIndices = new ArrayList<>();

        ProcedureBuilder(String name, ProcedureKind kind, int line, String section) {
            this.name = name;
            this.kind = kind;
            this.line = line;
            this.section = section;
        }
    }

    // Mutable state of one parse; confined to the calling thread.
    private final class ParseState {
        private final List<Statement> statements = new ArrayList<>();
        private final List<ProcedureBuilder> procedures = new ArrayList<>();
        private final List<Variable> variables = new ArrayList<>();
        private final Set<String> fileNames = new LinkedHashSet<>();
        private final Set<String> copybooks = new LinkedHashSet<>();
        private final List<Diagnostic> diagnostics;

        private Division division = Division.NONE;
        private String programId;
        private String dataSection;
        private String currentSection;
        private int currentProcedure = -1;
        private boolean skipUntilPeriod;

        private int pendingLine;
        private StringBuilder pendingText;
        private int execLine;
        private StringBuilder execBlock;
        private int entryLine;
        private StringBuilder pendingEntry;

        ParseState(List<Diagnostic> normalizerDiagnostics) {
            this.diagnostics = new ArrayList<>(normalizerDiagnostics);
        }

        void enterDivision(Division next) {
            division = next;
            dataSection = null;
            currentSection = null;
            currentProcedure = -1;
            skipUntilPeriod = false;
        }

        void openProcedure(String name, ProcedureKind kind, int line) {
            String upperName = name.toUpperCase(Locale.ROOT);
            String section = null;
            if (kind == ProcedureKind.SECTION) {
                currentSection = upperName;
            } else {
                section = currentSection;
            }
            procedures.add(new ProcedureBuilder(upperName, kind, line, section));
            currentProcedure = procedures.size() - 1;
        }

        void startEntry(int line, String text) {
            flushStatement();
            entryLine = line;
            pendingEntry = new StringBuilder(text);
            if (text.endsWith(".")) {
                flushEntry(false);
            }
        }

        void flushEntry(boolean unterminated) {
            if (pendingEntry == null) {
                return;
            }
            DataEntry entry = DataEntryParser.parse(pendingEntry.toString());
            pendingEntry = null;
            if (unterminated) {
                entry.markMalformed("missing terminating period");
            }
            String category;
            if (entry.isMalformed()) {
                category = Variable.MALFORMED;
                diagnostics.add(new Diagnostic(DiagnosticKind.MALFORMED_DECLARATION, entryLine,
                        "Malformed declaration of " + entry.getName() + ": " + entry.getProblem()));
            } else {
                category = classifier.classify(entry.getName(), NameKind.VARIABLE);
            }
            variables.add(new Variable(entry.getName().toUpperCase(Locale.ROOT), entry.getLevel(), entryLine,
                    dataSection, entry.getPicture(), entry.getUsage(), entry.getOccurs(), entry.getRedefines(), category));
        }

        void flushStatement() {
            if (pendingText == null) {
                return;
            }
            String text = pendingText.toString().trim();
            pendingText = null;
            StatementPatternRegistry.Recognition recognition = registry.recognize(text);
            if (!recognition.isRecognized()) {
                diagnostics.add(new Diagnostic(DiagnosticKind.UNRECOGNIZED_STATEMENT, pendingLine,
                        "Unrecognized statement: " + abbreviate(text)));
            }
            if (recognition.getType() == StatementType.COPY && recognition.getFields().containsKey(Statement.TARGET)) {
                copybooks.add(recognition.getFields().get(Statement.TARGET).toUpperCase(Locale.ROOT));
            }
            addStatement(new Statement(recognition.getType(), pendingLine, text, recognition.getFields(), currentProcedure));
        }

        void flushExec() {
            if (execBlock == null) {
                return;
            }
            pendingLine = execLine;
            pendingText = execBlock;
            execBlock = null;
            flushStatement();
        }

        void flushAll() {
            if (execBlock != null) {
                diagnostics.add(new Diagnostic(DiagnosticKind.UNTERMINATED_BLOCK, execLine, "EXEC block without END-EXEC"));
                flushExec();
            }
            if (pendingEntry != null) {
                flushEntry(true);
            }
            flushStatement();
            skipUntilPeriod = false;
        }

        void finish() {
            flushAll();
        }

        void addStatement(Statement statement) {
            statements.add(statement);
            if (statement.getProcedureIndex() >= 0) {
                procedures.get(statement.getProcedureIndex()).statementIndices.add(statements.size() - 1);
            }
        }

        RawAST toRawAST() {
            List<Procedure> built = new ArrayList<>(procedures.size());
            for (ProcedureBuilder builder : procedures) {
                built.add(new Procedure(builder.name, builder.kind, builder.line, builder.section,
                        builder.statementIndices, classifier.classify(builder.name, NameKind.PROCEDURE)));
            }
            return new RawAST(programId, statements, built, variables,
                    new ArrayList<>(fileNames), new ArrayList<>(copybooks), diagnostics);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
