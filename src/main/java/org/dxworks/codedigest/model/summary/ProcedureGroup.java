package org.dxworks.codedigest.model.summary;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"count", "procedures"})
public final class ProcedureGroup {
    private final String category;
    private final int count;
    private final List<String> procedures;

    public ProcedureGroup(String category, int count, List<String> procedures) {
        this.category = Objects.requireNonNull(category, "category");
        this.count = count;
        this.procedures = procedures == null ? null : List.copyOf(procedures);
    }

    @JsonIgnore
    public String getCategory() {
        return category;
    }

    @JsonProperty("count")
    public int getCount() {
        return count;
    }

    /** Capped procedure names, {@code null} once names were dropped to save space. */
    @JsonProperty("procedures")
    public List<String> getProcedures() {
        return procedures;
    }

    public ProcedureGroup withoutNames() {
        return procedures == null ? this : new ProcedureGroup(category, count, null);
    }
}
