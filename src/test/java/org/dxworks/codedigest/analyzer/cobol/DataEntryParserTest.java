package org.dxworks.codedigest.analyzer.cobol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataEntryParserTest {

    @Test
    void readsPictureAndUsage() {
        DataEntry entry = DataEntryParser.parse("05 WS-AMOUNT PIC S9(7)V99 COMP-3.");

        assertFalse(entry.isMalformed());
        assertEquals(5, entry.getLevel());
        assertEquals("WS-AMOUNT", entry.getName());
        assertEquals("S9(7)V99", entry.getPicture());
        assertEquals("COMP-3", entry.getUsage());
    }

    @Test
    void readsExplicitUsageClause() {
        DataEntry entry = DataEntryParser.parse("05 WS-LINE PIC X(80) USAGE IS DISPLAY.");

        assertFalse(entry.isMalformed());
        assertEquals("DISPLAY", entry.getUsage());
    }

    @Test
    void readsOccursWithDependingAndIndex() {
        DataEntry fixed = DataEntryParser.parse("05 WS-TABLE OCCURS 10 TIMES INDEXED BY WS-IDX.");
        assertEquals(10, fixed.getOccurs());
        assertFalse(fixed.isMalformed());

        DataEntry variable = DataEntryParser.parse(
                "05 WS-ITEMS OCCURS 1 TO 20 TIMES DEPENDING ON WS-COUNT ASCENDING KEY IS WS-KEY PIC X(4).");
        assertEquals(20, variable.getOccurs());
        assertEquals("X(4)", variable.getPicture());
        assertFalse(variable.isMalformed());
    }

    @Test
    void readsRedefines() {
        DataEntry entry = DataEntryParser.parse("01 WS-DATE-R REDEFINES WS-DATE PIC 9(8).");

        assertEquals("WS-DATE", entry.getRedefines());
        assertEquals("9(8)", entry.getPicture());
    }

    @Test
    void unnamedEntryIsFiller() {
        assertEquals("FILLER", DataEntryParser.parse("05 PIC X(10) VALUE SPACES.").getName());
        assertEquals("FILLER", DataEntryParser.parse("05 filler PIC X(2).").getName());
    }

    @Test
    void valueLiteralMayHoldBlanksAndCommas() {
        DataEntry entry = DataEntryParser.parse("01 WS-HEADER PIC X(20) VALUE 'NAME, CITY AND ZIP'.");

        assertFalse(entry.isMalformed());
        assertEquals("X(20)", entry.getPicture());
    }

    @Test
    void conditionNameNeedsValue() {
        assertFalse(DataEntryParser.parse("88 WS-DONE VALUE 'Y'.").isMalformed());

        DataEntry entry = DataEntryParser.parse("88 WS-DONE.");
        assertTrue(entry.isMalformed());
        assertEquals("condition name without VALUE", entry.getProblem());
    }

    @Test
    void malformedEntries() {
        assertEquals("PIC without operand", DataEntryParser.parse("05 WS-X PIC.").getProblem());
        assertEquals("unexpected token BOGUS", DataEntryParser.parse("05 WS-X PIC X(3) BOGUS.").getProblem());
        assertEquals("invalid level number 99", DataEntryParser.parse("99 WS-X PIC X.").getProblem());
        assertEquals("OCCURS count is not an integer: MANY",
                DataEntryParser.parse("05 WS-X OCCURS MANY TIMES.").getProblem());
        assertNull(DataEntryParser.parse("77 WS-X PIC 9 VALUE 0.").getProblem());
    }

    @Test
    void numbersTooLongForAnIntAreMalformed() {
        DataEntry count = DataEntryParser.parse("05 WS-X PIC X OCCURS 99999999999 TIMES.");
        assertTrue(count.isMalformed());
        assertEquals("OCCURS count is not an integer: 99999999999", count.getProblem());
        assertEquals("X", count.getPicture());

        assertEquals("OCCURS upper bound is not an integer",
                DataEntryParser.parse("05 WS-X OCCURS 1 TO 12345678901234 TIMES.").getProblem());
        assertEquals("invalid level number 100000000005",
                DataEntryParser.parse("100000000005 WS-X PIC X.").getProblem());
    }

    @Test
    void tokenizerKeepsParenthesesAndLiterals() {
        assertEquals(List.of("05", "WS-X", "PIC", "X(10)", "VALUE", "'A B'"),
                DataEntryParser.tokenize("05 WS-X PIC X(10), VALUE 'A B'"));
    }
}
