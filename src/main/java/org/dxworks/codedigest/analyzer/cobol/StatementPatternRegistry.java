package org.dxworks.codedigest.analyzer.cobol;

import org.dxworks.codedigest.model.Statement;
import org.dxworks.codedigest.model.StatementType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of statement patterns. Patterns are tried top to bottom and the first match wins;
 * text matching nothing is {@link StatementType#UNKNOWN}.
 * <p>
 * Registries are immutable: {@link #withPattern} and {@link #withPatternBefore} return extended
 * copies, so adding a pattern never alters the existing ones.
 */
public final class StatementPatternRegistry {

    private static final String IDENT = "[A-Za-z0-9][A-Za-z0-9-]*";
    private static final String LITERAL_OR_IDENT = "(?:'([^']*)'|\"([^\"]*)\"|(" + IDENT + "))";

    private static final Pattern MOVE_TARGET = Pattern.compile("\\bTO\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPUTE_TARGET = Pattern.compile("^(" + IDENT + "(?:\\s*\\([^)]*\\))?)(?:\\s+ROUNDED)?\\s*=", Pattern.CASE_INSENSITIVE);
    private static final Pattern GIVING_TARGET = Pattern.compile("\\bGIVING\\s+(" + IDENT + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPEN_MODE = Pattern.compile("^(INPUT|OUTPUT|I-O|EXTEND)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final StatementPatternRegistry DEFAULTS = new StatementPatternRegistry(defaultPatterns());

    private final List<StatementPattern> patterns;

    public StatementPatternRegistry(List<StatementPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static StatementPatternRegistry defaults() {
        return DEFAULTS;
    }

    public static StatementPatternRegistry empty() {
        return new StatementPatternRegistry(List.of());
    }

    public StatementPatternRegistry withPattern(StatementPattern pattern) {
        List<StatementPattern> extended = new ArrayList<>(patterns);
        extended.add(pattern);
        return new StatementPatternRegistry(extended);
    }

    /**
     * Inserts {@code pattern} right before the pattern named {@code existingName}, or appends it
     * when no such pattern is registered.
     */
    public StatementPatternRegistry withPatternBefore(String existingName, StatementPattern pattern) {
        List<StatementPattern> extended = new ArrayList<>(patterns);
        for (int i = 0; i < extended.size(); i++) {
            if (extended.get(i).getName().equals(existingName)) {
                extended.add(i, pattern);
                return new StatementPatternRegistry(extended);
            }
        }
        extended.add(pattern);
        return new StatementPatternRegistry(extended);
    }

    public List<StatementPattern> getPatterns() {
        return patterns;
    }

    public Recognition recognize(String text) {
        String trimmed = text == null ? "" : text.trim();
        for (StatementPattern pattern : patterns) {
            Map<String, String> fields = pattern.match(trimmed);
            if (fields != null) {
                return new Recognition(pattern.getType(), pattern.getName(), fields);
            }
        }
        return new Recognition(StatementType.UNKNOWN, null, Map.of());
    }

    /** Outcome of matching one statement text against the registry. */
    public static final class Recognition {
        private final StatementType type;
        private final String patternName;
        private final Map<String, String> fields;

        Recognition(StatementType type, String patternName, Map<String, String> fields) {
            this.type = type;
            this.patternName = patternName;
            this.fields = fields;
        }

        public StatementType getType() {
            return type;
        }

        /** Name of the matching pattern, {@code null} for unknown statements. */
        public String getPatternName() {
            return patternName;
        }

        public Map<String, String> getFields() {
            return fields;
        }

        public boolean isRecognized() {
            return type != StatementType.UNKNOWN;
        }
    }

    private static List<StatementPattern> defaultPatterns() {
        List<StatementPattern> list = new ArrayList<>();

        list.add(new StatementPattern("exec", StatementType.EMBEDDED, "^EXEC\\s+(" + IDENT + ")",
                (m, t) -> fields(Statement.VERB, "EXEC", Statement.KIND, upper(m.group(1)))));
        list.add(new StatementPattern("copy", StatementType.COPY, "^COPY\\s+" + LITERAL_OR_IDENT,
                (m, t) -> fields(Statement.VERB, "COPY", Statement.TARGET, firstNonNull(m.group(1), m.group(2), m.group(3)))));

        list.add(new StatementPattern("if", StatementType.CONDITIONAL, "^IF\\s+(.+?)(?:\\s+THEN\\b.*)?\\.?$",
                (m, t) -> fields(Statement.VERB, "IF", Statement.CONDITION, clean(m.group(1)))));
        list.add(new StatementPattern("else", StatementType.CONDITIONAL, "^ELSE\\b",
                (m, t) -> fields(Statement.VERB, "ELSE")));
        list.add(new StatementPattern("evaluate", StatementType.CONDITIONAL, "^EVALUATE\\s+(.+?)\\.?$",
                (m, t) -> fields(Statement.VERB, "EVALUATE", Statement.CONDITION, clean(m.group(1)))));
        list.add(new StatementPattern("when", StatementType.CONDITIONAL, "^WHEN\\s+(.+?)\\.?$",
                (m, t) -> fields(Statement.VERB, "WHEN", Statement.CONDITION, clean(m.group(1)))));
        list.add(new StatementPattern("end-conditional", StatementType.CONDITIONAL, "^(END-IF|END-EVALUATE)\\b",
                (m, t) -> fields(Statement.VERB, upper(m.group(1)))));

        list.add(new StatementPattern("perform-loop", StatementType.LOOP,
                "^PERFORM(?:\\s+(" + IDENT + ")(?:\\s+(?:THRU|THROUGH)\\s+(" + IDENT + "))?)?"
                        + "\\s+(?:WITH\\s+TEST\\s+(?:BEFORE|AFTER)\\s+)?(UNTIL|VARYING)\\s+(.+?)\\.?$",
                (m, t) -> fields(Statement.VERB, "PERFORM", Statement.KIND, upper(m.group(3)),
                        Statement.TARGET, m.group(1), Statement.THRU, m.group(2), Statement.CONDITION, clean(m.group(4)))));
        list.add(new StatementPattern("perform-times", StatementType.LOOP,
                "^PERFORM(?:\\s+(" + IDENT + ")(?:\\s+(?:THRU|THROUGH)\\s+(" + IDENT + "))?)?\\s+(" + IDENT + ")\\s+TIMES\\b",
                (m, t) -> fields(Statement.VERB, "PERFORM", Statement.KIND, "TIMES",
                        Statement.TARGET, m.group(1), Statement.THRU, m.group(2), Statement.OPERANDS, m.group(3))));
        list.add(new StatementPattern("perform-inline", StatementType.LOOP, "^PERFORM\\s*\\.?$",
                (m, t) -> fields(Statement.VERB, "PERFORM", Statement.KIND, "INLINE")));
        list.add(new StatementPattern("perform", StatementType.INVOKE,
                "^PERFORM\\s+(" + IDENT + ")(?:\\s+(?:THRU|THROUGH)\\s+(" + IDENT + "))?",
                (m, t) -> fields(Statement.VERB, "PERFORM", Statement.TARGET, m.group(1), Statement.THRU, m.group(2))));

        list.add(new StatementPattern("call", StatementType.CALL,
                "^CALL\\s+" + LITERAL_OR_IDENT + "(?:\\s+USING\\s+(.+?))?\\.?$",
                (m, t) -> fields(Statement.VERB, "CALL",
                        Statement.TARGET, firstNonNull(m.group(1), m.group(2), m.group(3)),
                        Statement.KIND, m.group(3) != null ? "DYNAMIC" : "STATIC",
                        Statement.OPERANDS, clean(m.group(4)))));
        list.add(new StatementPattern("go-to", StatementType.BRANCH, "^GO\\s+(?:TO\\s+)?(" + IDENT + ")",
                (m, t) -> fields(Statement.VERB, "GO TO", Statement.TARGET, m.group(1))));

        list.add(new StatementPattern("stop", StatementType.TERMINATE,
                "^(STOP\\s+RUN|GOBACK|EXIT\\s+PROGRAM|STOP\\s+(?:'[^']*'|\"[^\"]*\"|" + IDENT + "))",
                (m, t) -> fields(Statement.VERB, firstWord(m.group(1)), Statement.STOP_TYPE, collapse(upper(m.group(1))))));

        list.add(new StatementPattern("assign", StatementType.ASSIGN,
                "^(MOVE|COMPUTE|ADD|SUBTRACT|MULTIPLY|DIVIDE|SET|INITIALIZE|STRING|UNSTRING|INSPECT)\\b\\s*(.*?)\\.?$",
                (m, t) -> assignFields(upper(m.group(1)), clean(m.group(2)))));
        list.add(new StatementPattern("io", StatementType.IO,
                "^(READ|WRITE|REWRITE|DELETE|START|OPEN|CLOSE|DISPLAY|ACCEPT)\\b\\s*(.*?)\\.?$",
                (m, t) -> ioFields(upper(m.group(1)), clean(m.group(2)))));

        list.add(new StatementPattern("other", StatementType.OTHER,
                "^(CONTINUE|NEXT\\s+SENTENCE|SORT|MERGE|RELEASE|RETURN|SEARCH|CANCEL|EXIT|ALTER|ENTRY|INVOKE"
                        + "|GENERATE|INITIATE|TERMINATE|SUPPRESS|COMMIT|ROLLBACK|UNLOCK|ALLOCATE|FREE|RAISE|RESUME"
                        + "|END-" + IDENT + "|NOT\\s+(?:AT\\s+END|ON\\s+" + IDENT + "|INVALID\\s+KEY)|AT\\s+END"
                        + "|AT\\s+EOP|ON\\s+(?:SIZE\\s+ERROR|OVERFLOW|EXCEPTION|EXCEPTION)|INVALID\\s+KEY|THEN|ALSO|OTHERWISE)\\b",
                (m, t) -> fields(Statement.VERB, collapse(upper(m.group(1))))));

        return list;
    }

    private static Map<String, String> assignFields(String verb, String operands) {
        String target = null;
        if (operands != null) {
            Matcher matcher;
            switch (verb) {
                case "MOVE":
                case "ADD":
                case "SET":
                    matcher = MOVE_TARGET.matcher(operands);
                    target = matcher.find() ? clean(matcher.group(1)) : null;
                    break;
                case "COMPUTE":
                    matcher = COMPUTE_TARGET.matcher(operands);
                    target = matcher.find() ? collapse(matcher.group(1)) : null;
                    break;
                case "SUBTRACT":
                case "MULTIPLY":
                case "DIVIDE":
                    matcher = GIVING_TARGET.matcher(operands);
                    target = matcher.find() ? matcher.group(1) : null;
                    break;
                default:
                    break;
            }
        }
        return fields(Statement.VERB, verb, Statement.OPERANDS, operands, Statement.TARGET, target);
    }

    private static Map<String, String> ioFields(String verb, String operands) {
        String file = null;
        if (operands != null && !operands.isEmpty()) {
            switch (verb) {
                case "READ":
                case "WRITE":
                case "REWRITE":
                case "DELETE":
                case "START":
                    file = firstWord(operands);
                    break;
                case "OPEN":
                    file = OPEN_MODE.matcher(operands).replaceFirst("");
                    break;
                case "CLOSE":
                    file = operands;
                    break;
                default:
                    break;
            }
        }
        return fields(Statement.VERB, verb, Statement.FILE, file, Statement.OPERANDS, operands);
    }

    /** Ordered map of the given key/value pairs, skipping null or empty values. */
    static Map<String, String> fields(String... keyValues) {
        Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            String value = keyValues[i + 1];
            if (value != null && !value.isEmpty()) {
                result.put(keyValues[i], value);
            }
        }
        return result;
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return collapse(trimmed);
    }

    private static String collapse(String value) {
        return value == null ? null : WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static String firstWord(String value) {
        String trimmed = value.trim();
        int space = trimmed.indexOf(' ');
        return clean(space < 0 ? trimmed : trimmed.substring(0, space));
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
