package org.dxworks.codedigest.analyzer.cobol.preprocessor;

/**
 * Reference formats: where the sequence, indicator and content areas sit on a physical line.
 */
public enum CobolSourceFormat {

    /**
     * Columns 1-6 sequence area, 7 indicator area, 8-72 content area, 73-80 identification area.
     */
    FIXED(6, 72),

    /**
     * As {@link #FIXED}, but the content area runs to the end of the line.
     */
    VARIABLE(6, -1),

    /**
     * HP Tandem: column 1 indicator area, content from column 2 to the end of the line.
     */
    TANDEM(0, -1),

    /**
     * No sequence or indicator area; {@code *>} starts a comment and {@code >>} a directive.
     */
    FREE(-1, -1);

    private final int indicatorColumn;
    private final int contentEnd;

    CobolSourceFormat(int indicatorColumn, int contentEnd) {
        this.indicatorColumn = indicatorColumn;
        this.contentEnd = contentEnd;
    }

    /** Zero-based column of the indicator area, -1 when the format has none. */
    public int getIndicatorColumn() {
        return indicatorColumn;
    }

    /** Exclusive end column of the content area, -1 when it runs to the end of the line. */
    public int getContentEnd() {
        return contentEnd;
    }

    public boolean hasIndicatorArea() {
        return indicatorColumn >= 0;
    }
}
