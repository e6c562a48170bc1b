package org.dxworks.codedigest.model;

public enum ProcedureKind {
    PARAGRAPH,
    SECTION
}
