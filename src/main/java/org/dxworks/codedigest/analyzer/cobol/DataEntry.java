package org.dxworks.codedigest.analyzer.cobol;

/**
 * Clauses scanned from one level-number entry. {@link #getProblem()} is non-null when the entry
 * could not be read completely.
 */
final class DataEntry {
    static final String FILLER = "FILLER";

    int level;
    String name = FILLER;
    String picture;
    String usage;
    Integer occurs;
    String redefines;
    boolean hasValue;
    String problem;

    int getLevel() {
        return level;
    }

    String getName() {
        return name;
    }

    String getPicture() {
        return picture;
    }

    String getUsage() {
        return usage;
    }

    Integer getOccurs() {
        return occurs;
    }

    String getRedefines() {
        return redefines;
    }

    String getProblem() {
        return problem;
    }

    boolean isMalformed() {
        return problem != null;
    }

    void markMalformed(String reason) {
        if (problem == null) {
            problem = reason;
        }
    }
}
