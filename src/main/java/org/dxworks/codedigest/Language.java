package org.dxworks.codedigest;

public enum Language {
    COBOL("cobol");

    private final String name;

    Language(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
