package org.dxworks.codedigest.analyzer;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.NormalizedSource;
import org.dxworks.codedigest.model.RawAST;

public interface LanguageParser {
    RawAST parse(NormalizedSource source);
}
