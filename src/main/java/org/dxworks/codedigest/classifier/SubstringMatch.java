package org.dxworks.codedigest.classifier;

import java.util.List;

public final class SubstringMatch implements NamePredicate {
    private final List<String> fragments;

    public SubstringMatch(List<String> fragments) {
        this.fragments = PrefixMatch.normalizeAll(fragments);
    }

    public SubstringMatch(String... fragments) {
        this(List.of(fragments));
    }

    @Override
    public boolean test(String normalizedName) {
        for (String fragment : fragments) {
            if (normalizedName.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String describe() {
        return "contains" + fragments;
    }
}
