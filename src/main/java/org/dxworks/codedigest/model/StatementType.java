package org.dxworks.codedigest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StatementType {
    CONDITIONAL("Conditional"),
    LOOP("Loop"),
    INVOKE("Invoke"),
    CALL("Call"),
    BRANCH("Branch"),
    ASSIGN("Assign"),
    IO("IO"),
    TERMINATE("Terminate"),
    EMBEDDED("Embedded"),
    COPY("Copy"),
    OTHER("Other"),
    UNKNOWN("Unknown");

    private final String label;

    StatementType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
