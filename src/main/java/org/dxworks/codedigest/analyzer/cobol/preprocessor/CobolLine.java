package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.model.DiagnosticKind;

import java.util.Objects;

/**
 * One physical line cut into its reference-format areas, or several physical lines once
 * continuation lines have been joined into it.
 */
public final class CobolLine {
    private final int number;
    private final int lastNumber;
    private final String raw;
    private final String sequenceArea;
    private final char indicator;
    private final String contentArea;
    private final String commentArea;
    private final CobolLineType type;
    private final DiagnosticKind problem;
    private final String problemMessage;

    private CobolLine(int number, int lastNumber, String raw, String sequenceArea, char indicator,
                      String contentArea, String commentArea, CobolLineType type,
                      DiagnosticKind problem, String problemMessage) {
        this.number = number;
        this.lastNumber = lastNumber;
        this.raw = raw;
        this.sequenceArea = sequenceArea;
        this.indicator = indicator;
        this.contentArea = contentArea;
        this.commentArea = commentArea;
        this.type = Objects.requireNonNull(type, "type");
        this.problem = problem;
        this.problemMessage = problemMessage;
    }

    public static CobolLine of(int number, String raw, String sequenceArea, char indicator,
                               String contentArea, String commentArea, CobolLineType type) {
        return new CobolLine(number, number, raw, sequenceArea, indicator, contentArea, commentArea, type, null, null);
    }

    public static CobolLine malformed(int number, String raw, DiagnosticKind problem, String message) {
        return new CobolLine(number, number, raw, "", ' ', raw, "", CobolLineType.MALFORMED, problem, message);
    }

    public CobolLine withContent(String newContent) {
        return new CobolLine(number, lastNumber, raw, sequenceArea, indicator, newContent, commentArea, type,
                problem, problemMessage);
    }

    /** Appends the content of a continuation line, widening the physical line span. */
    public CobolLine joinedWith(String continuedContent, int continuationNumber) {
        return new CobolLine(number, continuationNumber, raw, sequenceArea, indicator, continuedContent,
                commentArea, type, problem, problemMessage);
    }

    public CobolLine asMalformed(DiagnosticKind newProblem, String message) {
        return new CobolLine(number, lastNumber, raw, sequenceArea, indicator, raw, commentArea,
                CobolLineType.MALFORMED, newProblem, message);
    }

    public int getNumber() {
        return number;
    }

    public int getLastNumber() {
        return lastNumber;
    }

    public String getRaw() {
        return raw;
    }

    public String getSequenceArea() {
        return sequenceArea;
    }

    public char getIndicator() {
        return indicator;
    }

    public String getContentArea() {
        return contentArea;
    }

    public String getCommentArea() {
        return commentArea;
    }

    public CobolLineType getType() {
        return type;
    }

    public DiagnosticKind getProblem() {
        return problem;
    }

    public String getProblemMessage() {
        return problemMessage;
    }
}
