package org.dxworks.codedigest.classifier;

import java.util.Objects;

public final class CategoryRule {
    private final NamePredicate predicate;
    private final String category;
    private final NameKind kind;

    /**
     * @param kind kind of name the rule applies to, {@code null} for any
     */
    public CategoryRule(NamePredicate predicate, String category, NameKind kind) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.category = Objects.requireNonNull(category, "category");
        this.kind = kind;
    }

    public boolean matches(String normalizedName, NameKind nameKind) {
        return (kind == null || kind == nameKind) && predicate.test(normalizedName);
    }

    public NamePredicate getPredicate() {
        return predicate;
    }

    public String getCategory() {
        return category;
    }

    public NameKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return (kind == null ? "any" : kind.name().toLowerCase()) + " " + predicate.describe() + " -> " + category;
    }
}
