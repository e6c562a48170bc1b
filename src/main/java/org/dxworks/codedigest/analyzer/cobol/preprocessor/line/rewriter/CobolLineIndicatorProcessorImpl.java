package org.dxworks.codedigest.analyzer.cobol.preprocessor.line.rewriter;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the content area according to the indicator: continuation lines lose their leading
 * blanks, directives and blank lines are trimmed. Code lines keep trailing blanks because a
 * literal continued on the next line runs up to the end of the content area.
 */
public class CobolLineIndicatorProcessorImpl implements CobolLineIndicatorProcessor {

	@Override
	public CobolLine processLine(CobolLine line) {
		switch (line.getType()) {
			case CONTINUATION:
				return line.withContent(stripLeading(line.getContentArea()));
			case COMPILER_DIRECTIVE:
				return line.withContent(line.getContentArea().trim());
			case BLANK:
				return line.withContent("");
			default:
				return line;
		}
	}

	@Override
	public List<CobolLine> processLines(List<CobolLine> lines) {
		List<CobolLine> result = new ArrayList<>(lines.size());
		for (CobolLine line : lines) {
			result.add(processLine(line));
		}
		return result;
	}

	private static String stripLeading(String content) {
		int i = 0;
		while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
			i++;
		}
		return content.substring(i);
	}
}
