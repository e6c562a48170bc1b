package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.model.Diagnostic;

import java.nio.charset.Charset;
import java.util.List;

public final class DecodedSource {
    private final String text;
    private final Charset charset;
    private final List<Diagnostic> diagnostics;

    public DecodedSource(String text, Charset charset, List<Diagnostic> diagnostics) {
        this.text = text;
        this.charset = charset;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getText() {
        return text;
    }

    public Charset getCharset() {
        return charset;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
