package org.dxworks.codedigest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Non-fatal finding reported next to best-effort output. Line is 0 for unit-level findings.
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final int line;
    private final String message;

    public Diagnostic(DiagnosticKind kind, int line, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.message = message;
    }

    @JsonProperty("kind")
    public DiagnosticKind getKind() {
        return kind;
    }

    @JsonProperty("line")
    public int getLine() {
        return line;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return line == that.line && kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, message);
    }

    @Override
    public String toString() {
        return kind + "@" + line + ": " + message;
    }
}
