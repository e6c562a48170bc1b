/*
 * Copyright (C) 2017, Ulrich Wolffgang <u.wol@wwu.de>
 * All rights reserved.
 *
 * This software may be modified and distributed under the terms
 * of the BSD 3-clause license. See the LICENSE file for details.
 */

package org.dxworks.codedigest.analyzer.cobol.preprocessor.line.reader;

import java.util.List;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolLine;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;

/**
 * Cuts physical lines into reference-format areas and classifies them by indicator.
 */
public interface CobolLineReader {

	CobolLine parseLine(String line, int lineNumber, CobolSourceFormat format);

	List<CobolLine> processLines(String lines, CobolSourceFormat format);

}
