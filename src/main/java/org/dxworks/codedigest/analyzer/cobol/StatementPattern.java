package org.dxworks.codedigest.analyzer.cobol;

import org.dxworks.codedigest.model.StatementType;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A registered (matcher, extractor) pair: a case-insensitive pattern anchored at the start of the
 * statement text and the function pulling structural fields out of a match.
 */
public final class StatementPattern {

    @FunctionalInterface
    public interface FieldExtractor {
        Map<String, String> extract(Matcher matcher, String text);
    }

    private final String name;
    private final StatementType type;
    private final Pattern pattern;
    private final FieldExtractor extractor;

    public StatementPattern(String name, StatementType type, String regex, FieldExtractor extractor) {
        this(name, type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), extractor);
    }

    public StatementPattern(String name, StatementType type, Pattern pattern, FieldExtractor extractor) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.extractor = extractor != null ? extractor : (m, t) -> Map.of();
    }

    /** Fields of the match, or {@code null} when the text does not start with this pattern. */
    public Map<String, String> match(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.lookingAt()) {
            return null;
        }
        return extractor.extract(matcher, text);
    }

    public String getName() {
        return name;
    }

    public StatementType getType() {
        return type;
    }

    public Pattern getPattern() {
        return pattern;
    }
}
