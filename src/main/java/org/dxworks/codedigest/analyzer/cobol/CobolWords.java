package org.dxworks.codedigest.analyzer.cobol;

import java.util.Locale;
import java.util.Set;

/**
 * Reserved-word sets shared by the structural parser and the data entry parser.
 */
final class CobolWords {

    /** Words that may end a statement with a period but never name a paragraph. */
    static final Set<String> NOT_PARAGRAPH_NAMES = Set.of(
            "EXIT", "GOBACK", "CONTINUE", "ELSE", "THEN", "OTHERWISE", "DECLARATIVES",
            "END-IF", "END-PERFORM", "END-EVALUATE", "END-READ", "END-WRITE", "END-REWRITE",
            "END-DELETE", "END-START", "END-CALL", "END-COMPUTE", "END-ADD", "END-SUBTRACT",
            "END-MULTIPLY", "END-DIVIDE", "END-STRING", "END-UNSTRING", "END-SEARCH",
            "END-RETURN", "END-ACCEPT", "END-DISPLAY", "END-EXEC", "END-INVOKE", "END-RECEIVE");

    /** First words of a line that carry on the clause of the previous, unterminated statement. */
    static final Set<String> CLAUSE_CONTINUATIONS = Set.of(
            "TO", "FROM", "GIVING", "USING", "BY", "UNTIL", "VARYING", "AND", "OR", "INTO",
            "DELIMITED", "REMAINDER", "ROUNDED", "THRU", "THROUGH", "RETURNING", "WITH");

    /** Last words of a statement line that still need an operand on the next line. */
    static final Set<String> OPERAND_EXPECTED = Set.of(
            "TO", "FROM", "GIVING", "USING", "BY", "UNTIL", "VARYING", "AND", "OR", "INTO",
            "THRU", "THROUGH", "RETURNING", "=", "OF", "IN", "NOT", "IS", "DELIMITED",
            ">", "<", ">=", "<=", "+", "-", "*", "/", "THAN", "EQUAL");

    /** Last words of a data entry line that still need an operand on the next line. */
    static final Set<String> DATA_OPERAND_EXPECTED = Set.of(
            "OCCURS", "VALUE", "VALUES", "PIC", "PICTURE", "IS", "ARE", "TO", "REDEFINES",
            "USAGE", "RENAMES", "THRU", "THROUGH", "DEPENDING", "ON", "BY", "KEY");

    static final Set<String> USAGE_WORDS = Set.of(
            "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5",
            "COMPUTATIONAL", "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3",
            "COMPUTATIONAL-4", "COMPUTATIONAL-5", "BINARY", "PACKED-DECIMAL", "DISPLAY",
            "DISPLAY-1", "NATIONAL", "INDEX", "POINTER", "PROCEDURE-POINTER", "FUNCTION-POINTER");

    /** Words that open a data description clause. */
    static final Set<String> DATA_CLAUSE_KEYWORDS = Set.of(
            "PIC", "PICTURE", "VALUE", "VALUES", "USAGE", "OCCURS", "REDEFINES", "RENAMES",
            "SIGN", "LEADING", "TRAILING", "JUSTIFIED", "JUST", "SYNC", "SYNCHRONIZED", "BLANK",
            "GLOBAL", "EXTERNAL", "DEPENDING", "ASCENDING", "DESCENDING", "INDEXED", "IS");

    private CobolWords() {
    }

    static boolean isDataKeyword(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        return DATA_CLAUSE_KEYWORDS.contains(upper) || USAGE_WORDS.contains(upper);
    }

    static String lastWord(String text) {
        String trimmed = text.trim();
        int space = Math.max(trimmed.lastIndexOf(' '), trimmed.lastIndexOf('\t'));
        return (space < 0 ? trimmed : trimmed.substring(space + 1)).toUpperCase(Locale.ROOT);
    }

    static String firstWord(String text) {
        String trimmed = text.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    }
}
