package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import java.io.IOException;

/**
 * Raised when no charset of the fallback chain can decode a unit.
 */
public class SourceDecodingException extends IOException {

    public SourceDecodingException(String message) {
        super(message);
    }
}
