package org.dxworks.codedigest.analyzer.cobol.preprocessor;

public enum CobolLineType {
    NORMAL,
    BLANK,
    COMMENT,
    CONTINUATION,
    DEBUG,
    COMPILER_DIRECTIVE,
    MALFORMED
}
