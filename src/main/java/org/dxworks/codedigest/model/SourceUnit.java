package org.dxworks.codedigest.model;

import org.dxworks.codedigest.LanguageVariant;

import java.util.Arrays;
import java.util.Objects;

/**
 * One input program: its name, declared variant and the undecoded source bytes.
 */
public final class SourceUnit {
    private final String name;
    private final LanguageVariant languageVariant;
    private final byte[] rawText;
    private final String encoding;

    public SourceUnit(String name, LanguageVariant languageVariant, byte[] rawText, String encoding) {
        this.name = Objects.requireNonNull(name, "name");
        this.languageVariant = languageVariant;
        this.rawText = Arrays.copyOf(Objects.requireNonNull(rawText, "rawText"), rawText.length);
        this.encoding = encoding;
    }

    public String getName() {
        return name;
    }

    /** Declared variant, or {@code null} when the format has to be sniffed from the text. */
    public LanguageVariant getLanguageVariant() {
        return languageVariant;
    }

    public byte[] getRawText() {
        return Arrays.copyOf(rawText, rawText.length);
    }

    /** Encoding hint; may be {@code null}. */
    public String getEncoding() {
        return encoding;
    }
}
