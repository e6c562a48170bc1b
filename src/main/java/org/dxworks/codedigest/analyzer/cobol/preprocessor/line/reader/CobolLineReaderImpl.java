package org.dxworks.codedigest.analyzer.cobol.preprocessor.line.reader;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolLine;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolLineType;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;
import org.dxworks.codedigest.model.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class CobolLineReaderImpl implements CobolLineReader {

	private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

	private static final Pattern LISTING_DIRECTIVE = Pattern.compile("(?i)^(EJECT|SKIP[123])\\.?$");

	@Override
	public List<CobolLine> processLines(String lines, CobolSourceFormat format) {
		List<CobolLine> result = new ArrayList<>();
		if (lines == null || lines.isEmpty()) {
			return result;
		}

		String[] physicalLines = LINE_BREAK.split(lines, -1);
		int count = physicalLines.length;
		// trailing line break does not start another line
		if (count > 0 && physicalLines[count - 1].isEmpty()) {
			count--;
		}
		for (int i = 0; i < count; i++) {
			result.add(parseLine(physicalLines[i], i + 1, format));
		}
		return result;
	}

	@Override
	public CobolLine parseLine(String line, int lineNumber, CobolSourceFormat format) {
		int control = firstControlCharacter(line);
		if (control >= 0) {
			return CobolLine.malformed(lineNumber, line, DiagnosticKind.CONTROL_CHARACTERS,
					String.format(Locale.ROOT, "Control character 0x%02X at column %d", (int) line.charAt(control), control + 1));
		}

		if (format == CobolSourceFormat.FREE) {
			return parseFreeLine(line, lineNumber);
		}
		return parseColumnLine(line, lineNumber, format);
	}

	private CobolLine parseColumnLine(String line, int lineNumber, CobolSourceFormat format) {
		int indicatorColumn = format.getIndicatorColumn();
		if (line.length() <= indicatorColumn) {
			// nothing beyond the sequence area
			return CobolLine.of(lineNumber, line, line, ' ', "", "", CobolLineType.BLANK);
		}

		String sequenceArea = line.substring(0, indicatorColumn);
		char indicator = line.charAt(indicatorColumn);
		int contentStart = indicatorColumn + 1;
		int contentEnd = format.getContentEnd() < 0 ? line.length() : Math.min(line.length(), format.getContentEnd());
		String contentArea = contentStart < contentEnd ? line.substring(contentStart, contentEnd) : "";
		String commentArea = contentEnd < line.length() ? line.substring(contentEnd) : "";

		CobolLineType type;
		switch (indicator) {
			case ' ':
				type = classifyContent(contentArea);
				break;
			case '*':
			case '/':
				type = CobolLineType.COMMENT;
				break;
			case '-':
				type = CobolLineType.CONTINUATION;
				break;
			case 'D':
			case 'd':
				type = CobolLineType.DEBUG;
				break;
			case '$':
				type = CobolLineType.COMPILER_DIRECTIVE;
				break;
			default:
				return CobolLine.malformed(lineNumber, line, DiagnosticKind.INVALID_INDICATOR,
						"Invalid indicator '" + indicator + "' in column " + (indicatorColumn + 1));
		}

		if (type == CobolLineType.NORMAL || type == CobolLineType.CONTINUATION) {
			contentArea = stripInlineComment(contentArea);
		}
		return CobolLine.of(lineNumber, line, sequenceArea, indicator, contentArea, commentArea, type);
	}

	private CobolLine parseFreeLine(String line, int lineNumber) {
		String trimmed = line.trim();
		if (trimmed.startsWith("*>")) {
			return CobolLine.of(lineNumber, line, "", ' ', "", trimmed, CobolLineType.COMMENT);
		}
		String content = stripInlineComment(line);
		return CobolLine.of(lineNumber, line, "", ' ', content, "", classifyContent(content));
	}

	private static CobolLineType classifyContent(String content) {
		String trimmed = content.trim();
		if (trimmed.isEmpty()) {
			return CobolLineType.BLANK;
		}
		if (trimmed.startsWith(">>") || LISTING_DIRECTIVE.matcher(trimmed).matches()) {
			return CobolLineType.COMPILER_DIRECTIVE;
		}
		if (trimmed.startsWith("*>")) {
			return CobolLineType.COMMENT;
		}
		return CobolLineType.NORMAL;
	}

	/** Cuts a floating {@code *>} comment that is not inside an alphanumeric literal. */
	static String stripInlineComment(String content) {
		char quote = 0;
		for (int i = 0; i < content.length() - 1; i++) {
			char c = content.charAt(i);
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
			} else if (c == '"' || c == '\'') {
				quote = c;
			} else if (c == '*' && content.charAt(i + 1) == '>') {
				return content.substring(0, i);
			}
		}
		return content;
	}

	private static int firstControlCharacter(String line) {
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if ((c < 0x20 && c != '\t') || c == 0x7F) {
				return i;
			}
		}
		return -1;
	}
}
