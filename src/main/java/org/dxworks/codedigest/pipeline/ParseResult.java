package org.dxworks.codedigest.pipeline;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;
import org.dxworks.codedigest.model.Diagnostic;
import org.dxworks.codedigest.model.RawAST;

import java.nio.charset.Charset;
import java.util.List;

public final class ParseResult {
    private final RawAST rawAst;
    private final CobolSourceFormat format;
    private final Charset charset;

    public ParseResult(RawAST rawAst, CobolSourceFormat format, Charset charset) {
        this.rawAst = rawAst;
        this.format = format;
        this.charset = charset;
    }

    public RawAST getRawAst() {
        return rawAst;
    }

    /** Decoding, normalizing and parsing diagnostics, in that order. */
    public List<Diagnostic> getDiagnostics() {
        return rawAst.getDiagnostics();
    }

    public CobolSourceFormat getFormat() {
        return format;
    }

    public Charset getCharset() {
        return charset;
    }
}
