package org.dxworks.codedigest.classifier;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Arbitrary test over the normalized name. Must be side-effect free.
 */
public final class CustomPredicate implements NamePredicate {
    private final String description;
    private final Predicate<String> predicate;

    public CustomPredicate(String description, Predicate<String> predicate) {
        this.description = Objects.requireNonNull(description, "description");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    /** Matches names having one of the given hyphen-separated words, e.g. {@code sw} in {@code ws-sw-eof}. */
    public static CustomPredicate anyToken(List<String> tokens) {
        Set<String> wanted = Set.copyOf(PrefixMatch.normalizeAll(tokens));
        return new CustomPredicate("token" + wanted, name -> {
            for (String part : name.split("-")) {
                if (wanted.contains(part)) {
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public boolean test(String normalizedName) {
        return predicate.test(normalizedName);
    }

    @Override
    public String describe() {
        return description;
    }
}
