package org.dxworks.codedigest.budget;

import org.dxworks.codedigest.model.summary.HierarchicalSummary;

import java.util.Objects;

/**
 * A summary together with the payload that would be sent for it. The payload is the serialized
 * summary until the last ladder step cuts it.
 */
public final class SummaryCandidate {
    private final HierarchicalSummary summary;
    private final String payload;

    public SummaryCandidate(HierarchicalSummary summary, String payload) {
        this.summary = Objects.requireNonNull(summary, "summary");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public static SummaryCandidate of(HierarchicalSummary summary) {
        return new SummaryCandidate(summary, SummarySerializer.serialize(summary));
    }

    public HierarchicalSummary getSummary() {
        return summary;
    }

    public String getPayload() {
        return payload;
    }
}
