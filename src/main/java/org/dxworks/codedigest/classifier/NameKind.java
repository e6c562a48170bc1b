package org.dxworks.codedigest.classifier;

public enum NameKind {
    PROCEDURE,
    VARIABLE
}
