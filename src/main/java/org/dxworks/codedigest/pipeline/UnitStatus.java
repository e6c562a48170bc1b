package org.dxworks.codedigest.pipeline;

public enum UnitStatus {
    DIGESTED,
    INPUT_TOO_LARGE,
    FAILED,
    CANCELLED
}
