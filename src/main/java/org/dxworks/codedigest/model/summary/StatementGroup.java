package org.dxworks.codedigest.model.summary;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.codedigest.model.StatementType;

import java.util.List;
import java.util.Objects;

/**
 * All statements of one type: exact count, a deterministic sample and the line span of every
 * member.
 */
@JsonPropertyOrder({"count", "examples", "line_range"})
public final class StatementGroup {
    private final StatementType type;
    private final int count;
    private final List<StatementExample> examples;
    private final int firstLine;
    private final int lastLine;

    public StatementGroup(StatementType type, int count, List<StatementExample> examples, int firstLine, int lastLine) {
        this.type = Objects.requireNonNull(type, "type");
        this.count = count;
        this.examples = List.copyOf(examples);
        this.firstLine = firstLine;
        this.lastLine = lastLine;
    }

    @JsonIgnore
    public StatementType getType() {
        return type;
    }

    @JsonProperty("count")
    public int getCount() {
        return count;
    }

    @JsonProperty("examples")
    public List<StatementExample> getExamples() {
        return examples;
    }

    @JsonIgnore
    public int getFirstLine() {
        return firstLine;
    }

    @JsonIgnore
    public int getLastLine() {
        return lastLine;
    }

    @JsonProperty("line_range")
    public String getLineRange() {
        return firstLine + "-" + lastLine;
    }

    public StatementGroup withExampleCap(int cap) {
        if (examples.size() <= cap) {
            return this;
        }
        return new StatementGroup(type, count, examples.subList(0, Math.max(0, cap)), firstLine, lastLine);
    }
}
