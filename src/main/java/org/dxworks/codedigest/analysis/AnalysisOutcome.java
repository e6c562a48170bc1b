package org.dxworks.codedigest.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Free text produced by the analysis collaborator, or the reason it produced none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisOutcome {
    private final String text;
    private final String failure;

    private AnalysisOutcome(String text, String failure) {
        this.text = text;
        this.failure = failure;
    }

    public static AnalysisOutcome text(String text) {
        return new AnalysisOutcome(Objects.requireNonNull(text, "text"), null);
    }

    public static AnalysisOutcome failure(String reason) {
        return new AnalysisOutcome(null, Objects.requireNonNull(reason, "reason"));
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("failure")
    public String getFailure() {
        return failure;
    }

    public boolean isSuccess() {
        return text != null;
    }
}
