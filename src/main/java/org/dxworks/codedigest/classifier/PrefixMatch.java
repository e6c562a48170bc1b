package org.dxworks.codedigest.classifier;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class PrefixMatch implements NamePredicate {
    private final List<String> prefixes;

    public PrefixMatch(List<String> prefixes) {
        this.prefixes = normalizeAll(prefixes);
    }

    public PrefixMatch(String... prefixes) {
        this(List.of(prefixes));
    }

    @Override
    public boolean test(String normalizedName) {
        for (String prefix : prefixes) {
            if (normalizedName.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String describe() {
        return "prefix" + prefixes;
    }

    static List<String> normalizeAll(List<String> values) {
        return values.stream().map(CategoryClassifier::normalize)
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }
}
