package org.dxworks.codedigest.analyzer.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scans the clauses of a data description entry ({@code 05 WS-AMOUNT PIC S9(7)V99 COMP-3.}).
 * Never throws: anything it cannot read marks the entry malformed and scanning stops there.
 */
final class DataEntryParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    // longer digit runs do not fit an int and are never valid counts or levels
    private static final Pattern INTEGER = Pattern.compile("[0-9]{1,9}");

    private DataEntryParser() {
    }

    static DataEntry parse(String text) {
        DataEntry entry = new DataEntry();
        List<String> tokens = tokenize(stripPeriod(text));
        if (tokens.isEmpty() || !DIGITS.matcher(tokens.get(0)).matches()) {
            entry.markMalformed("missing level number");
            return entry;
        }
        if (!INTEGER.matcher(tokens.get(0)).matches()) {
            entry.markMalformed("invalid level number " + tokens.get(0));
            return entry;
        }

        entry.level = Integer.parseInt(tokens.get(0));
        if (!isValidLevel(entry.level)) {
            entry.markMalformed("invalid level number " + tokens.get(0));
        }

        int i = 1;
        if (i < tokens.size() && !CobolWords.isDataKeyword(tokens.get(i))) {
            String name = tokens.get(i);
            if (!IDENTIFIER.matcher(name).matches()) {
                entry.markMalformed("invalid data name " + name);
            } else {
                entry.name = name.equalsIgnoreCase(DataEntry.FILLER) ? DataEntry.FILLER : name;
            }
            i++;
        }

        Clauses clauses = new Clauses(tokens, entry);
        clauses.scan(i);

        if (entry.level == 88 && !entry.hasValue) {
            entry.markMalformed("condition name without VALUE");
        }
        return entry;
    }

    static boolean isValidLevel(int level) {
        return (level >= 1 && level <= 49) || level == 66 || level == 77 || level == 88;
    }

    private static String stripPeriod(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /** Splits on blanks, commas and semicolons outside literals and parentheses. */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                current.append(c);
            } else if (depth == 0 && (Character.isWhitespace(c) || c == ',' || c == ';')) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static final class Clauses {
        private final List<String> tokens;
        private final DataEntry entry;
        private int pos;

        Clauses(List<String> tokens, DataEntry entry) {
            this.tokens = tokens;
            this.entry = entry;
        }

        void scan(int start) {
            pos = start;
            while (pos < tokens.size() && !entry.isMalformed()) {
                String keyword = upper(tokens.get(pos++));
                switch (keyword) {
                    case "PIC":
                    case "PICTURE":
                        skipOptional("IS");
                        entry.picture = requireOperand(keyword);
                        break;
                    case "VALUE":
                    case "VALUES":
                        skipOptional("IS", "ARE");
                        if (requireOperand(keyword) != null) {
                            entry.hasValue = true;
                            while (pos < tokens.size() && !CobolWords.isDataKeyword(tokens.get(pos))) {
                                pos++;
                            }
                        }
                        break;
                    case "USAGE":
                        skipOptional("IS");
                        if (pos >= tokens.size()) {
                            entry.markMalformed("USAGE without operand");
                        } else if (!CobolWords.USAGE_WORDS.contains(upper(tokens.get(pos)))) {
                            entry.markMalformed("unknown usage " + tokens.get(pos));
                        } else {
                            entry.usage = upper(tokens.get(pos++));
                        }
                        break;
                    case "OCCURS":
                        occurs();
                        break;
                    case "REDEFINES":
                        entry.redefines = requireOperand(keyword);
                        break;
                    case "RENAMES":
                        requireOperand(keyword);
                        if (skipOptional("THRU", "THROUGH")) {
                            requireOperand("THRU");
                        }
                        break;
                    case "SIGN":
                        skipOptional("IS");
                        if (!skipOptional("LEADING", "TRAILING")) {
                            entry.markMalformed("SIGN without LEADING or TRAILING");
                        }
                        separate();
                        break;
                    case "LEADING":
                    case "TRAILING":
                        separate();
                        break;
                    case "JUSTIFIED":
                    case "JUST":
                        skipOptional("RIGHT");
                        break;
                    case "SYNC":
                    case "SYNCHRONIZED":
                        skipOptional("LEFT", "RIGHT");
                        break;
                    case "BLANK":
                        skipOptional("WHEN");
                        if (!skipOptional("ZERO", "ZEROS", "ZEROES")) {
                            entry.markMalformed("BLANK WHEN without ZERO");
                        }
                        break;
                    case "GLOBAL":
                    case "EXTERNAL":
                    case "IS":
                        break;
                    default:
                        if (CobolWords.USAGE_WORDS.contains(keyword)) {
                            entry.usage = keyword;
                        } else {
                            entry.markMalformed("unexpected token " + tokens.get(pos - 1));
                        }
                        break;
                }
            }
        }

        private void occurs() {
            String count = requireOperand("OCCURS");
            if (count == null) {
                return;
            }
            if (!INTEGER.matcher(count).matches()) {
                entry.markMalformed("OCCURS count is not an integer: " + count);
                return;
            }
            int times = Integer.parseInt(count);
            if (skipOptional("TO")) {
                String upperBound = requireOperand("OCCURS TO");
                if (upperBound == null || !INTEGER.matcher(upperBound).matches()) {
                    entry.markMalformed("OCCURS upper bound is not an integer");
                    return;
                }
                times = Integer.parseInt(upperBound);
            }
            entry.occurs = times;
            skipOptional("TIMES");

            while (pos < tokens.size() && !entry.isMalformed()) {
                String word = upper(tokens.get(pos));
                if (word.equals("DEPENDING")) {
                    pos++;
                    skipOptional("ON");
                    requireOperand("DEPENDING ON");
                } else if (word.equals("ASCENDING") || word.equals("DESCENDING")) {
                    pos++;
                    skipOptional("KEY");
                    skipOptional("IS");
                    requireOperand("KEY");
                    names();
                } else if (word.equals("INDEXED")) {
                    pos++;
                    skipOptional("BY");
                    requireOperand("INDEXED BY");
                    names();
                } else {
                    return;
                }
            }
        }

        // additional identifiers of a KEY or INDEXED BY list
        private void names() {
            while (pos < tokens.size()) {
                String token = tokens.get(pos);
                if (CobolWords.isDataKeyword(token) || !IDENTIFIER.matcher(token).matches()) {
                    return;
                }
                pos++;
            }
        }

        private void separate() {
            if (skipOptional("SEPARATE")) {
                skipOptional("CHARACTER");
            }
        }

        private String requireOperand(String clause) {
            if (pos >= tokens.size() || CobolWords.isDataKeyword(tokens.get(pos))) {
                entry.markMalformed(clause + " without operand");
                return null;
            }
            return tokens.get(pos++);
        }

        private boolean skipOptional(String... words) {
            if (pos >= tokens.size()) {
                return false;
            }
            String current = upper(tokens.get(pos));
            for (String word : words) {
                if (word.equals(current)) {
                    pos++;
                    return true;
                }
            }
            return false;
        }

        private static String upper(String token) {
            return token.toUpperCase(Locale.ROOT);
        }
    }
}
