package org.dxworks.codedigest.model.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"line", "content", "condition", "target"})
public final class StatementExample {
    private final int line;
    private final String content;
    private final String condition;
    private final String target;

    public StatementExample(int line, String content, String condition, String target) {
        this.line = line;
        this.content = content;
        this.condition = condition;
        this.target = target;
    }

    @JsonProperty("line")
    public int getLine() {
        return line;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("condition")
    public String getCondition() {
        return condition;
    }

    @JsonProperty("target")
    public String getTarget() {
        return target;
    }
}
