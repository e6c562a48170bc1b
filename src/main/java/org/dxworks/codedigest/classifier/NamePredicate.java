package org.dxworks.codedigest.classifier;

/**
 * Test over a normalized name (lower case, underscores turned into hyphens).
 */
public interface NamePredicate {

    boolean test(String normalizedName);

    /** Short readable form, used when listing rules. */
    String describe();
}
