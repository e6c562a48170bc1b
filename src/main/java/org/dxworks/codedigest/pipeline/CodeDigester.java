package org.dxworks.codedigest.pipeline;

import org.dxworks.codedigest.LanguageVariant;
import org.dxworks.codedigest.analyzer.LanguageParser;
import org.dxworks.codedigest.analyzer.cobol.COBOLStructureParser;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceFormat;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.CobolSourceNormalizer;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.NormalizedSource;
import org.dxworks.codedigest.analyzer.cobol.preprocessor.SourceDecodingException;
import org.dxworks.codedigest.budget.BudgetConfig;
import org.dxworks.codedigest.budget.BudgetFitResult;
import org.dxworks.codedigest.budget.BudgetFitter;
import org.dxworks.codedigest.budget.TokenEstimator;
import org.dxworks.codedigest.classifier.CategoryClassifier;
import org.dxworks.codedigest.model.RawAST;
import org.dxworks.codedigest.model.SourceUnit;
import org.dxworks.codedigest.model.summary.HierarchicalSummary;
import org.dxworks.codedigest.summarizer.HierarchicalSummarizer;
import org.dxworks.codedigest.summarizer.SummaryThresholds;

import java.util.Objects;

/**
 * Entry point of the in-memory pipeline: normalize, parse, summarize, fit to budget.
 * <p>
 * Holds no per-unit state, so one instance can serve every worker thread of a batch.
 */
public class CodeDigester {

    private final CobolSourceNormalizer normalizer;
    private final LanguageParser parser;
    private final HierarchicalSummarizer summarizer;
    private final SummaryThresholds thresholds;
    private final BudgetConfig budgetConfig;

    public CodeDigester() {
        this(CategoryClassifier.defaults(), SummaryThresholds.defaults(), BudgetConfig.defaults());
    }

    public CodeDigester(CategoryClassifier classifier, SummaryThresholds thresholds, BudgetConfig budgetConfig) {
        this(new CobolSourceNormalizer(), new COBOLStructureParser(classifier), thresholds, budgetConfig);
    }

    public CodeDigester(CobolSourceNormalizer normalizer, LanguageParser parser,
                        SummaryThresholds thresholds, BudgetConfig budgetConfig) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.summarizer = new HierarchicalSummarizer();
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.budgetConfig = Objects.requireNonNull(budgetConfig, "budgetConfig");
    }

    /** Parses with the reference format sniffed from the text. */
    public ParseResult parse(byte[] source, String encodingHint) throws SourceDecodingException {
        return parse(source, encodingHint, null);
    }

    public ParseResult parse(byte[] source, String encodingHint, CobolSourceFormat format) throws SourceDecodingException {
        NormalizedSource normalized = normalizer.normalize(source, encodingHint, format);
        RawAST ast = parser.parse(normalized);
        return new ParseResult(ast, normalized.getFormat(), normalized.getCharset());
    }

    public HierarchicalSummary summarize(RawAST ast, SummaryThresholds thresholds) {
        return summarizer.summarize(ast, thresholds);
    }

    public BudgetFitResult fitToBudget(HierarchicalSummary summary, BudgetConfig config) {
        return new BudgetFitter(config).fit(summary);
    }

    public int estimateTokens(String text) {
        return new TokenEstimator(budgetConfig.getCharsPerToken()).estimateTokens(text);
    }

    /**
     * Runs the whole pipeline for one unit with the configured thresholds and budget.
     *
     * @throws SourceDecodingException when no charset of the fallback chain decodes the unit
     */
    public DigestResult digest(SourceUnit unit) throws SourceDecodingException {
        LanguageVariant declared = unit.getLanguageVariant();
        ParseResult parsed = parse(unit.getRawText(), unit.getEncoding(), declared != null ? declared.getFormat() : null);
        String variant = (declared != null ? declared : LanguageVariant.of(parsed.getFormat())).getName();

        RawAST ast = parsed.getRawAst();
        String name = ast.getProgramId() != null ? ast.getProgramId() : unit.getName();
        HierarchicalSummary summary = summarizer.summarize(name, variant, ast, thresholds);
        BudgetFitResult fit = fitToBudget(summary, budgetConfig);
        return new DigestResult(unit.getName(), variant, summary, fit, ProgramMetrics.of(ast), parsed.getDiagnostics());
    }

    public SummaryThresholds getThresholds() {
        return thresholds;
    }

    public BudgetConfig getBudgetConfig() {
        return budgetConfig;
    }
}
