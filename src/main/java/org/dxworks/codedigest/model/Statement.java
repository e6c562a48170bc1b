package org.dxworks.codedigest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single recognised (or unrecognised) source statement. Immutable.
 */
public final class Statement {
    public static final String VERB = "verb";
    public static final String CONDITION = "condition";
    public static final String TARGET = "target";
    public static final String OPERANDS = "operands";
    public static final String FILE = "file";
    public static final String STOP_TYPE = "stop_type";
    public static final String KIND = "kind";
    public static final String THRU = "thru";

    private final StatementType type;
    private final int line;
    private final String rawText;
    private final Map<String, String> fields;
    private final int procedureIndex;

    public Statement(StatementType type, int line, String rawText, Map<String, String> fields, int procedureIndex) {
        this.type = Objects.requireNonNull(type, "type");
        this.line = line;
        this.rawText = rawText == null ? "" : rawText;
        this.fields = fields == null || fields.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.procedureIndex = procedureIndex;
    }

    public StatementType getType() {
        return type;
    }

    public int getLine() {
        return line;
    }

    public String getRawText() {
        return rawText;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public String field(String name) {
        return fields.get(name);
    }

    /** Index of the owning procedure in {@link RawAST#getProcedures()}, -1 outside any procedure. */
    public int getProcedureIndex() {
        return procedureIndex;
    }

    @Override
    public String toString() {
        return type.getLabel() + "@" + line + ": " + rawText;
    }
}
