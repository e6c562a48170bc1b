package org.dxworks.codedigest;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared dialect of a source unit: the language plus the reference format its lines follow.
 */
public enum LanguageVariant {
    COBOL_FIXED(Language.COBOL, CobolSourceFormat.FIXED),
    COBOL_VARIABLE(Language.COBOL, CobolSourceFormat.VARIABLE),
    COBOL_TANDEM(Language.COBOL, CobolSourceFormat.TANDEM),
    COBOL_FREE(Language.COBOL, CobolSourceFormat.FREE);

    private final Language language;
    private final CobolSourceFormat format;

    LanguageVariant(Language language, CobolSourceFormat format) {
        this.language = language;
        this.format = format;
    }

    public Language getLanguage() {
        return language;
    }

    public CobolSourceFormat getFormat() {
        return format;
    }

    /** Name used in summary documents, e.g. {@code cobol-fixed}. */
    public String getName() {
        return language.getName() + "-" + format.name().toLowerCase(Locale.ROOT);
    }

    public static LanguageVariant of(CobolSourceFormat format) {
        for (LanguageVariant variant : values()) {
            if (variant.format == format) {
                return variant;
            }
        }
        throw new IllegalArgumentException("No COBOL variant for format: " + format);
    }

    public static Optional<LanguageVariant> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (LanguageVariant variant : values()) {
            if (variant.getName().equals(wanted) || variant.format.name().equalsIgnoreCase(wanted)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }
}
