package org.dxworks.codedigest.model;

public enum DiagnosticKind {
    ENCODING_FALLBACK,
    UNKNOWN_ENCODING_HINT,
    INVALID_INDICATOR,
    ORPHAN_CONTINUATION,
    CONTROL_CHARACTERS,
    UNRECOGNIZED_STATEMENT,
    MALFORMED_DECLARATION,
    UNTERMINATED_BLOCK
}
