package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import java.util.Objects;

public final class LogicalLine {
    private final int firstLine;
    private final int lastLine;
    private final String text;
    private final LogicalLineKind kind;

    public LogicalLine(int firstLine, int lastLine, String text, LogicalLineKind kind) {
        this.firstLine = firstLine;
        this.lastLine = lastLine;
        this.text = text == null ? "" : text;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static LogicalLine code(int line, String text) {
        return new LogicalLine(line, line, text, LogicalLineKind.CODE);
    }

    public int getFirstLine() {
        return firstLine;
    }

    public int getLastLine() {
        return lastLine;
    }

    public String getText() {
        return text;
    }

    public LogicalLineKind getKind() {
        return kind;
    }

    public boolean isCode() {
        return kind == LogicalLineKind.CODE;
    }

    @Override
    public String toString() {
        return firstLine + (lastLine != firstLine ? "-" + lastLine : "") + " " + kind + ": " + text;
    }
}
