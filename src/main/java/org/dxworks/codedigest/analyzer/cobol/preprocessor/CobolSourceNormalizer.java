package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.line.reader.CobolLineReader;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.line.reader.CobolLineReaderImpl;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.line.rewriter.CobolContinuationLineRewriter;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.line.rewriter.CobolLineIndicatorProcessor;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.line.rewriter.CobolLineIndicatorProcessorImpl;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.line.rewriter.CobolLineRewriter;
import org.dxworks.codedigest.model.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw source into logical lines: decode, cut reference-format areas, apply indicators and
 * join continuations. Malformed lines are reported and passed on as {@link LogicalLineKind#OPAQUE};
 * nothing here throws for a bad line.
 */
public class CobolSourceNormalizer {

    private final CobolLineReader lineReader;
    private final CobolLineIndicatorProcessor indicatorProcessor;
    private final CobolLineRewriter continuationRewriter;

    public CobolSourceNormalizer() {
        this(new CobolLineReaderImpl(), new CobolLineIndicatorProcessorImpl(), new CobolContinuationLineRewriter());
    }

    public CobolSourceNormalizer(CobolLineReader lineReader, CobolLineIndicatorProcessor indicatorProcessor,
                                 CobolLineRewriter continuationRewriter) {
        this.lineReader = lineReader;
        this.indicatorProcessor = indicatorProcessor;
        this.continuationRewriter = continuationRewriter;
    }

    /**
     * Decodes and normalizes. A {@code null} format is sniffed from the decoded text.
     */
    public NormalizedSource normalize(byte[] bytes, String encodingHint, CobolSourceFormat format)
            throws SourceDecodingException {
        DecodedSource decoded = SourceDecoder.decode(bytes, encodingHint);
        CobolSourceFormat effectiveFormat = format != null ? format : SourceFormatHeuristics.detect(decoded.getText());

        List<Diagnostic> diagnostics = new ArrayList<>(decoded.getDiagnostics());
        List<LogicalLine> lines = toLogicalLines(decoded.getText(), effectiveFormat, diagnostics);
        return new NormalizedSource(lines, diagnostics, effectiveFormat, decoded.getCharset());
    }

    public NormalizedSource normalize(String text, CobolSourceFormat format) {
        CobolSourceFormat effectiveFormat = format != null ? format : SourceFormatHeuristics.detect(text);
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<LogicalLine> lines = toLogicalLines(text, effectiveFormat, diagnostics);
        return new NormalizedSource(lines, diagnostics, effectiveFormat, null);
    }

    private List<LogicalLine> toLogicalLines(String text, CobolSourceFormat format, List<Diagnostic> diagnostics) {
        List<CobolLine> physical = lineReader.processLines(text, format);
        List<CobolLine> joined = continuationRewriter.processLines(indicatorProcessor.processLines(physical));

        List<LogicalLine> result = new ArrayList<>(joined.size());
        for (CobolLine line : joined) {
            LogicalLine logical = toLogicalLine(line, diagnostics);
            if (logical != null) {
                result.add(logical);
            }
        }
        return result;
    }

    private static LogicalLine toLogicalLine(CobolLine line, List<Diagnostic> diagnostics) {
        switch (line.getType()) {
            case NORMAL: {
                String code = line.getContentArea().trim();
                if (code.isEmpty()) {
                    return null;
                }
                return new LogicalLine(line.getNumber(), line.getLastNumber(), code, LogicalLineKind.CODE);
            }
            case COMMENT:
                return new LogicalLine(line.getNumber(), line.getLastNumber(), line.getContentArea().trim(), LogicalLineKind.COMMENT);
            case DEBUG:
                return new LogicalLine(line.getNumber(), line.getLastNumber(), line.getContentArea().trim(), LogicalLineKind.DEBUG);
            case COMPILER_DIRECTIVE:
                return new LogicalLine(line.getNumber(), line.getLastNumber(), line.getContentArea(), LogicalLineKind.DIRECTIVE);
            case MALFORMED:
                diagnostics.add(new Diagnostic(line.getProblem(), line.getNumber(), line.getProblemMessage()));
                return new LogicalLine(line.getNumber(), line.getLastNumber(), line.getRaw().trim(), LogicalLineKind.OPAQUE);
            default:
                return null;
        }
    }
}
