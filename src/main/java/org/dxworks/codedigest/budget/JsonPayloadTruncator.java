package org.dxworks.codedigest.budget;

/**
 * Cuts a compact JSON document to a character limit while keeping it valid JSON.
 * <p>
 * Cuts happen only between values: right after an opening bracket, or right after a complete
 * member or element. A marker {@code [TRUNCATED: N chars omitted]} is appended (as the
 * {@code "_truncated"} member inside objects, as a plain string inside arrays) and every open
 * container is closed again. The latest cut whose result fits the limit wins.
 */
public final class JsonPayloadTruncator {
    public static final String MARKER_KEY = "_truncated";

    private JsonPayloadTruncator() {
    }

    /**
     * @return {@code json} when it already fits, the cut document otherwise, or {@code null} when
     * not even the smallest cut fits {@code maxChars}
     */
    public static String truncate(String json, int maxChars) {
        if (json.length() <= maxChars) {
            return json;
        }

        char[] stack = new char[json.length()];
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        int bestCut = -1;
        boolean bestNeedsComma = false;
        String bestClosers = null;

        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            int cut = -1;
            boolean needsComma = false;
            switch (c) {
                case '"':
                    inString = true;
                    break;
                case '{':
                case '[':
                    stack[depth++] = c;
                    cut = i + 1;
                    break;
                case ',':
                    cut = i;
                    needsComma = true;
                    break;
                case '}':
                case ']':
                    if (depth > 0 && json.charAt(i - 1) != '{' && json.charAt(i - 1) != '[') {
                        cut = i;
                        needsComma = true;
                    }
                    break;
                default:
                    break;
            }

            if (cut >= 0 && depth > 0) {
                String closers = closers(stack, depth);
                int length = cut + markerLength(stack[depth - 1], json.length() - cut, needsComma) + closers.length();
                if (length <= maxChars) {
                    bestCut = cut;
                    bestNeedsComma = needsComma;
                    bestClosers = closers;
                }
            }

            if ((c == '}' || c == ']') && depth > 0) {
                depth--;
            }
        }

        if (bestCut < 0) {
            return null;
        }
        char container = bestClosers.charAt(0) == '}' ? '{' : '[';
        return json.substring(0, bestCut)
                + marker(container, json.length() - bestCut, bestNeedsComma)
                + bestClosers;
    }

    static String markerText(int omitted) {
        return "[TRUNCATED: " + omitted + " chars omitted]";
    }

    private static String marker(char container, int omitted, boolean needsComma) {
        String value = "\"" + markerText(omitted) + "\"";
        String entry = container == '{' ? "\"" + MARKER_KEY + "\":" + value : value;
        return needsComma ? "," + entry : entry;
    }

    private static int markerLength(char container, int omitted, boolean needsComma) {
        return marker(container, omitted, needsComma).length();
    }

    private static String closers(char[] stack, int depth) {
        StringBuilder closers = new StringBuilder(depth);
        for (int i = depth - 1; i >= 0; i--) {
            closers.append(stack[i] == '{' ? '}' : ']');
        }
        return closers.toString();
    }
}
