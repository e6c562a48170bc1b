package org.dxworks.codedigest.budget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codedigest.model.summary.HierarchicalSummary;

import java.io.UncheckedIOException;

/**
 * Compact JSON form of a summary; this is the text whose size is budgeted.
 */
public final class SummarySerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.INDENT_OUTPUT);

    private SummarySerializer() {
    }

    public static String serialize(HierarchicalSummary summary) {
        try {
            return MAPPER.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            // the summary model only holds strings, numbers, lists and maps
            throw new UncheckedIOException("Could not serialize summary " + summary.getName(), e);
        }
    }
}
