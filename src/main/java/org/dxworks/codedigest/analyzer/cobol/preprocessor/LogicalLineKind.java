package org.dxworks.codedigest.analyzer.cobol.preprocessor;

public enum LogicalLineKind {
    CODE,
    COMMENT,
    DEBUG,
    DIRECTIVE,

    /** Malformed line kept verbatim; the parser records it as an unknown statement. */
    OPAQUE
}
