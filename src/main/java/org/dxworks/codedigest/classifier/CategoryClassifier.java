package org.dxworks.codedigest.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps procedure and variable names to semantic categories. Rules are evaluated in order and the
 * first match wins; no match yields {@link #OTHER}.
 * <p>
 * Immutable, so one instance can be shared by every worker of a batch.
 */
public final class CategoryClassifier {

    public static final String OTHER = "other";

    private final List<CategoryRule> rules;

    public CategoryClassifier(List<CategoryRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static CategoryClassifier defaults() {
        return new CategoryClassifier(CategoryRules.defaultRules());
    }

    public String classify(String name, NameKind kind) {
        if (name == null || name.isBlank()) {
            return OTHER;
        }
        String normalized = normalize(name);
        for (CategoryRule rule : rules) {
            if (rule.matches(normalized, kind)) {
                return rule.getCategory();
            }
        }
        return OTHER;
    }

    public List<CategoryRule> getRules() {
        return rules;
    }

    /** New classifier evaluating {@code rule} before every existing rule. */
    public CategoryClassifier withFirst(CategoryRule rule) {
        List<CategoryRule> extended = new ArrayList<>(rules.size() + 1);
        extended.add(rule);
        extended.addAll(rules);
        return new CategoryClassifier(extended);
    }

    /** New classifier evaluating {@code rule} after every existing rule. */
    public CategoryClassifier withLast(CategoryRule rule) {
        List<CategoryRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new CategoryClassifier(extended);
    }

    public static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
