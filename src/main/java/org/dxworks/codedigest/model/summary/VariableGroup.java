package org.dxworks.codedigest.model.summary;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"count", "examples"})
public final class VariableGroup {
    private final String category;
    private final int count;
    private final List<String> examples;

    public VariableGroup(String category, int count, List<String> examples) {
        this.category = Objects.requireNonNull(category, "category");
        this.count = count;
        this.examples = examples == null ? null : List.copyOf(examples);
    }

    @JsonIgnore
    public String getCategory() {
        return category;
    }

    @JsonProperty("count")
    public int getCount() {
        return count;
    }

    /** Capped variable names, {@code null} once names were dropped to save space. */
    @JsonProperty("examples")
    public List<String> getExamples() {
        return examples;
    }

    public VariableGroup withoutExamples() {
        return examples == null ? this : new VariableGroup(category, count, null);
    }
}
