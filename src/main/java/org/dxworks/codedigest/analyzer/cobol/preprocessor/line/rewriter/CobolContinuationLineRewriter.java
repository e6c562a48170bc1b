package org.dxworks.codedigest.analyzer.cobol.preprocessor.line.rewriter;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolLine;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolLineType;
import org.dxworks.codedigest.model.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins continuation lines into the code line they continue.
 * <p>
 * Runs as a two-state machine. In {@code IDLE} a code line becomes pending and moves the machine
 * to {@code ACCUMULATING}; a continuation line in {@code IDLE} has nothing to continue and is
 * marked malformed. In {@code ACCUMULATING} continuation lines are appended to the pending line,
 * comment and blank lines are held back so output order stays by first physical line, and any
 * other line flushes the pending line.
 */
public class CobolContinuationLineRewriter implements CobolLineRewriter {

	private enum State {
		IDLE,
		ACCUMULATING
	}

	@Override
	public List<CobolLine> processLines(List<CobolLine> lines) {
		List<CobolLine> result = new ArrayList<>(lines.size());
		List<CobolLine> heldBack = new ArrayList<>();
		State state = State.IDLE;
		CobolLine pending = null;

		for (CobolLine line : lines) {
			CobolLineType type = line.getType();

			if (state == State.IDLE) {
				if (type == CobolLineType.NORMAL) {
					pending = line;
					state = State.ACCUMULATING;
				} else if (type == CobolLineType.CONTINUATION) {
					result.add(line.asMalformed(DiagnosticKind.ORPHAN_CONTINUATION,
							"Continuation line without a preceding code line"));
				} else {
					result.add(line);
				}
				continue;
			}

			switch (type) {
				case CONTINUATION:
					pending = pending.joinedWith(join(pending.getContentArea(), line.getContentArea()), line.getNumber());
					break;
				case COMMENT:
				case BLANK:
					heldBack.add(line);
					break;
				case NORMAL:
					flush(result, pending, heldBack);
					pending = line;
					break;
				default:
					flush(result, pending, heldBack);
					pending = null;
					state = State.IDLE;
					result.add(line);
					break;
			}
		}

		if (state == State.ACCUMULATING) {
			flush(result, pending, heldBack);
		}
		return result;
	}

	private static void flush(List<CobolLine> result, CobolLine pending, List<CobolLine> heldBack) {
		result.add(pending);
		result.addAll(heldBack);
		heldBack.clear();
	}

	/**
	 * An open alphanumeric literal resumes after the continuation's leading quote; anything else
	 * continues right after the last non-blank character of the previous line.
	 */
	static String join(String previous, String continuation) {
		char openQuote = openLiteralQuote(previous);
		if (openQuote != 0 && !continuation.isEmpty() && continuation.charAt(0) == openQuote) {
			return previous + continuation.substring(1);
		}
		return stripTrailing(previous) + continuation;
	}

	static char openLiteralQuote(String content) {
		char quote = 0;
		for (int i = 0; i < content.length(); i++) {
			char c = content.charAt(i);
			if (quote == 0) {
				if (c == '"' || c == '\'') {
					quote = c;
				}
			} else if (c == quote) {
				// a doubled quote closes and reopens, which leaves the literal open
				quote = 0;
			}
		}
		return quote;
	}

	private static String stripTrailing(String content) {
		int end = content.length();
		while (end > 0 && Character.isWhitespace(content.charAt(end - 1))) {
			end--;
		}
		return content.substring(0, end);
	}
}
