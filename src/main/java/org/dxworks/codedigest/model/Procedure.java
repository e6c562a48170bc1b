package org.dxworks.codedigest.model;

import java.util.List;
import java.util.Objects;

/**
 * A named code section (paragraph or section) with the indices of the statements it owns.
 */
public final class Procedure {
    private final String name;
    private final ProcedureKind kind;
    private final int line;
    private final String section;
    private final List<Integer> statementIndices;
    private final String category;

    public Procedure(String name, ProcedureKind kind, int line, String section,
                     List<Integer> statementIndices, String category) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.section = section;
        this.statementIndices = List.copyOf(statementIndices);
        this.category = Objects.requireNonNull(category, "category");
    }

    public String getName() {
        return name;
    }

    public ProcedureKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    /** Enclosing section for paragraphs declared inside one, otherwise {@code null}. */
    public String getSection() {
        return section;
    }

    public List<Integer> getStatementIndices() {
        return statementIndices;
    }

    public String getCategory() {
        return category;
    }
}
