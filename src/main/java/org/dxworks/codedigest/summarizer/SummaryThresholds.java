package org.dxworks.codedigest.summarizer;

/**
 * Sampling limits of the summarizer.
 * <ul>
 *     <li>{@code fullExampleLimit} (T1): groups up to this size keep every member as an example;</li>
 *     <li>{@code exampleCap} (K): larger groups keep their first K members in source order;</li>
 *     <li>{@code nameCap}: procedure and variable names listed per category.</li>
 * </ul>
 */
public final class SummaryThresholds {
    public static final int DEFAULT_FULL_EXAMPLE_LIMIT = 5;
    public static final int DEFAULT_EXAMPLE_CAP = 3;
    public static final int DEFAULT_NAME_CAP = 5;

    private static final SummaryThresholds DEFAULTS =
            new SummaryThresholds(DEFAULT_FULL_EXAMPLE_LIMIT, DEFAULT_EXAMPLE_CAP, DEFAULT_NAME_CAP);

    private final int fullExampleLimit;
    private final int exampleCap;
    private final int nameCap;

    public SummaryThresholds(int fullExampleLimit, int exampleCap, int nameCap) {
        if (fullExampleLimit < 0) {
            throw new IllegalArgumentException("fullExampleLimit must be >= 0, was " + fullExampleLimit);
        }
        if (exampleCap < 0) {
            throw new IllegalArgumentException("exampleCap must be >= 0, was " + exampleCap);
        }
        if (nameCap < 0) {
            throw new IllegalArgumentException("nameCap must be >= 0, was " + nameCap);
        }
        this.fullExampleLimit = fullExampleLimit;
        this.exampleCap = exampleCap;
        this.nameCap = nameCap;
    }

    public static SummaryThresholds defaults() {
        return DEFAULTS;
    }

    public int getFullExampleLimit() {
        return fullExampleLimit;
    }

    public int getExampleCap() {
        return exampleCap;
    }

    public int getNameCap() {
        return nameCap;
    }

    public SummaryThresholds withExampleCap(int cap) {
        return new SummaryThresholds(fullExampleLimit, cap, nameCap);
    }

    @Override
    public String toString() {
        return "T1=" + fullExampleLimit + ", K=" + exampleCap + ", nameCap=" + nameCap;
    }
}
