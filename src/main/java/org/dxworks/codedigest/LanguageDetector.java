package org.dxworks.codedigest;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".cbl") || fileName.endsWith(".cob")
                || fileName.endsWith(".cpy") || fileName.endsWith(".cobol")) {
            return Optional.of(Language.COBOL);
        }

        return Optional.empty();
    }
}
