package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import java.util.regex.Pattern;

/**
 * Heuristic detection of the reference format from source text.
 *
 * <ol>
 *   <li><b>FREE</b> - a {@code >>SOURCE FORMAT FREE} directive</li>
 *   <li><b>FREE</b> - most non-blank lines carry code in the indicator column</li>
 *   <li><b>VARIABLE</b> - numbered lines longer than 80 columns</li>
 *   <li><b>FIXED</b> - fallback</li>
 * </ol>
 */
public final class SourceFormatHeuristics {

    private static final Pattern FREE_DIRECTIVE = Pattern.compile("(?im)^\\s*>>\\s*SOURCE\\s+(FORMAT\\s+)?(IS\\s+)?FREE\\b");
    private static final Pattern SEQUENCE_AREA = Pattern.compile("^[0-9]{6}");

    private SourceFormatHeuristics() {
        // utility class
    }

    public static CobolSourceFormat detect(String source) {
        if (source == null || source.isEmpty()) {
            return CobolSourceFormat.FIXED;
        }
        if (FREE_DIRECTIVE.matcher(source).find()) {
            return CobolSourceFormat.FREE;
        }

        int codeLines = 0;
        int offColumnLines = 0;
        boolean longNumberedLine = false;
        for (String line : source.split("\r?\n|\r")) {
            if (line.isBlank()) {
                continue;
            }
            codeLines++;
            if (line.length() > 6 && !isIndicator(line.charAt(6))) {
                offColumnLines++;
            }
            if (line.length() > 80 && SEQUENCE_AREA.matcher(line).find()) {
                longNumberedLine = true;
            }
        }

        if (codeLines > 0 && offColumnLines * 2 > codeLines) {
            return CobolSourceFormat.FREE;
        }
        if (longNumberedLine) {
            return CobolSourceFormat.VARIABLE;
        }
        return CobolSourceFormat.FIXED;
    }

    private static boolean isIndicator(char c) {
        return c == ' ' || c == '*' || c == '/' || c == '-' || c == 'D' || c == 'd' || c == '$';
    }
}
