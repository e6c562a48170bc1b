package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.model.Diagnostic;

import java.nio.charset.Charset;
import java.util.List;

public final class NormalizedSource {
    private final List<LogicalLine> lines;
    private final List<Diagnostic> diagnostics;
    private final CobolSourceFormat format;
    private final Charset charset;

    public NormalizedSource(List<LogicalLine> lines, List<Diagnostic> diagnostics,
                            CobolSourceFormat format, Charset charset) {
        this.lines = List.copyOf(lines);
        this.diagnostics = List.copyOf(diagnostics);
        this.format = format;
        this.charset = charset;
    }

    public List<LogicalLine> getLines() {
        return lines;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public CobolSourceFormat getFormat() {
        return format;
    }

    /** Charset the bytes were finally decoded with; {@code null} when normalizing text directly. */
    public Charset getCharset() {
        return charset;
    }
}
