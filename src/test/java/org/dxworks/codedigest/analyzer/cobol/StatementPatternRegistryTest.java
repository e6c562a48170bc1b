package org.dxworks.codedigest.analyzer.cobol;

import org.dxworks.codedigest.model.Statement;
import org.dxworks.codedigest.model.StatementType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class StatementPatternRegistryTest {

    private final StatementPatternRegistry registry = StatementPatternRegistry.defaults();

    @Test
    void ifConditionStopsBeforeThen() {
        StatementPatternRegistry.Recognition recognition = registry.recognize("IF WS-A = WS-B THEN");

        assertEquals(StatementType.CONDITIONAL, recognition.getType());
        assertEquals("if", recognition.getPatternName());
        assertEquals("WS-A = WS-B", recognition.getFields().get(Statement.CONDITION));
    }

    @Test
    void performVariants() {
        StatementPatternRegistry.Recognition thru = registry.recognize("PERFORM 100-READ THRU 100-EXIT.");
        assertEquals(StatementType.INVOKE, thru.getType());
        assertEquals("100-READ", thru.getFields().get(Statement.TARGET));
        assertEquals("100-EXIT", thru.getFields().get(Statement.THRU));

        StatementPatternRegistry.Recognition times = registry.recognize("PERFORM 200-LOOP 5 TIMES");
        assertEquals(StatementType.LOOP, times.getType());
        assertEquals("TIMES", times.getFields().get(Statement.KIND));
        assertEquals("5", times.getFields().get(Statement.OPERANDS));

        StatementPatternRegistry.Recognition varying = registry.recognize(
                "PERFORM VARYING WS-I FROM 1 BY 1 UNTIL WS-I > 10");
        assertEquals(StatementType.LOOP, varying.getType());
        assertEquals("VARYING", varying.getFields().get(Statement.KIND));
        assertNull(varying.getFields().get(Statement.TARGET));

        assertEquals("perform-inline", registry.recognize("PERFORM").getPatternName());
    }

    @Test
    void callKindFollowsTargetForm() {
        Map<String, String> literal = registry.recognize("CALL 'DATEUTIL' USING WS-DATE.").getFields();
        assertEquals("DATEUTIL", literal.get(Statement.TARGET));
        assertEquals("STATIC", literal.get(Statement.KIND));
        assertEquals("WS-DATE", literal.get(Statement.OPERANDS));

        Map<String, String> dynamic = registry.recognize("CALL WS-PROGRAM").getFields();
        assertEquals("WS-PROGRAM", dynamic.get(Statement.TARGET));
        assertEquals("DYNAMIC", dynamic.get(Statement.KIND));
    }

    @Test
    void assignTargets() {
        assertEquals("WS-TOTAL", registry.recognize("COMPUTE WS-TOTAL ROUNDED = WS-A * 2.")
                .getFields().get(Statement.TARGET));
        assertEquals("WS-NET", registry.recognize("SUBTRACT WS-TAX FROM WS-GROSS GIVING WS-NET")
                .getFields().get(Statement.TARGET));
        assertEquals("WS-OUT", registry.recognize("MOVE SPACES TO WS-OUT.")
                .getFields().get(Statement.TARGET));
    }

    @Test
    void ioFileNames() {
        assertEquals("CUST-FILE", registry.recognize("OPEN INPUT CUST-FILE.").getFields().get(Statement.FILE));
        assertEquals("CUST-FILE", registry.recognize("READ CUST-FILE INTO WS-REC").getFields().get(Statement.FILE));
        assertNull(registry.recognize("DISPLAY 'DONE'").getFields().get(Statement.FILE));
    }

    @Test
    void stopAndBranch() {
        StatementPatternRegistry.Recognition stop = registry.recognize("STOP RUN.");
        assertEquals(StatementType.TERMINATE, stop.getType());
        assertEquals("STOP RUN", stop.getFields().get(Statement.STOP_TYPE));

        StatementPatternRegistry.Recognition goTo = registry.recognize("GO TO 900-ABEND.");
        assertEquals(StatementType.BRANCH, goTo.getType());
        assertEquals("900-ABEND", goTo.getFields().get(Statement.TARGET));
    }

    @Test
    void unmatchedTextIsUnknown() {
        StatementPatternRegistry.Recognition recognition = registry.recognize("XML GENERATE WS-DOC FROM WS-REC");

        assertEquals(StatementType.UNKNOWN, recognition.getType());
        assertNull(recognition.getPatternName());
        assertFalse(recognition.isRecognized());
        assertEquals(StatementType.UNKNOWN, registry.recognize("").getType());
    }

    @Test
    void addedPatternsLeaveExistingRegistryUntouched() {
        StatementPattern xml = new StatementPattern("xml", StatementType.IO, "^XML\\s+(GENERATE|PARSE)\\b",
                (m, t) -> Map.of(Statement.VERB, "XML " + m.group(1).toUpperCase()));

        StatementPatternRegistry extended = registry.withPattern(xml);

        assertEquals(StatementType.IO, extended.recognize("XML GENERATE WS-DOC FROM WS-REC").getType());
        assertEquals("XML GENERATE", extended.recognize("xml generate WS-DOC").getFields().get(Statement.VERB));
        assertEquals(StatementType.UNKNOWN, registry.recognize("XML GENERATE WS-DOC FROM WS-REC").getType());
        assertEquals(registry.getPatterns().size() + 1, extended.getPatterns().size());
    }

    @Test
    void patternInsertedBeforeExistingOneTakesPrecedence() {
        StatementPattern exitParagraph = new StatementPattern("exit-paragraph", StatementType.BRANCH,
                "^EXIT\\s+PARAGRAPH\\b", null);

        StatementPatternRegistry extended = registry.withPatternBefore("other", exitParagraph);

        assertEquals(StatementType.OTHER, registry.recognize("EXIT PARAGRAPH.").getType());
        assertEquals(StatementType.BRANCH, extended.recognize("EXIT PARAGRAPH.").getType());
        assertEquals("exit-paragraph", extended.getPatterns().get(extended.getPatterns().size() - 2).getName());
    }

    @Test
    void patternInsertedBeforeMissingNameIsAppended() {
        StatementPattern custom = new StatementPattern("custom", StatementType.OTHER, "^READY\\s+TRACE\\b", null);

        StatementPatternRegistry extended = StatementPatternRegistry.empty().withPatternBefore("nothing", custom);

        assertEquals(1, extended.getPatterns().size());
        assertEquals("custom", extended.recognize("READY TRACE.").getPatternName());
    }
}
