package org.dxworks.codedigest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codedigest.budget.BudgetConfig;
import org.dxworks.codedigest.budget.TokenEstimator;
import org.dxworks.codedigest.classifier.CategoryClassifier;
import org.dxworks.codedigest.classifier.CategoryRule;
import org.dxworks.codedigest.classifier.CategoryRules;
import org.dxworks.codedigest.summarizer.SummaryThresholds;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class CodedigestConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "codedigest-config.yml";

    private final int maxFileLines;
    private final String defaultEncoding;
    private final LanguageVariant sourceFormat;
    private final SummaryThresholds thresholds;
    private final BudgetConfig budget;
    private final int threads;
    private final boolean mockAnalysis;
    private final Path classifierRules;

    private CodedigestConfig(int maxFileLines, String defaultEncoding, LanguageVariant sourceFormat,
                             SummaryThresholds thresholds, BudgetConfig budget, int threads,
                             boolean mockAnalysis, Path classifierRules) {
        this.maxFileLines = maxFileLines;
        this.defaultEncoding = defaultEncoding;
        this.sourceFormat = sourceFormat;
        this.thresholds = thresholds;
        this.budget = budget;
        this.threads = threads;
        this.mockAnalysis = mockAnalysis;
        this.classifierRules = classifierRules;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /** Encoding hint for every unit; {@code null} means the fallback chain starts at UTF-8. */
    public String getDefaultEncoding() {
        return defaultEncoding;
    }

    /** Declared variant for every unit; {@code null} means sniff per file. */
    public LanguageVariant getSourceFormat() {
        return sourceFormat;
    }

    public SummaryThresholds getThresholds() {
        return thresholds;
    }

    public BudgetConfig getBudget() {
        return budget;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isMockAnalysis() {
        return mockAnalysis;
    }

    public Path getClassifierRules() {
        return classifierRules;
    }

    /**
     * Classifier with the rules of {@link #getClassifierRules()} evaluated before the defaults.
     * An unreadable rules file is reported and the defaults are used alone.
     */
    public CategoryClassifier createClassifier() {
        if (classifierRules == null) {
            return CategoryClassifier.defaults();
        }
        try {
            List<CategoryRule> rules = new ArrayList<>(CategoryRules.fromYaml(classifierRules));
            rules.addAll(CategoryRules.defaultRules());
            return new CategoryClassifier(rules);
        } catch (IOException e) {
            System.err.println("Could not read classifier rules " + classifierRules + ": " + e.getMessage()
                    + ". Using default rules.");
            return CategoryClassifier.defaults();
        }
    }

    public static CodedigestConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodedigestConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig, configPath);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ": " + e.getMessage() + ". Using defaults.");
        }

        return defaults();
    }

    public static CodedigestConfig defaults() {
        return new CodedigestConfig(DEFAULT_MAX_FILE_LINES, null, null, SummaryThresholds.defaults(),
                BudgetConfig.defaults(), defaultThreads(), false, null);
    }

    public static CodedigestConfig with(SummaryThresholds thresholds, BudgetConfig budget, int threads, boolean mockAnalysis) {
        int effectiveThreads = threads > 0 ? threads : defaultThreads();
        return new CodedigestConfig(DEFAULT_MAX_FILE_LINES, null, null, thresholds, budget, effectiveThreads,
                mockAnalysis, null);
    }

    private static CodedigestConfig fromYaml(YamlConfig yaml, Path configPath) {
        int effectiveMaxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        String effectiveEncoding = (yaml.defaultEncoding != null && !yaml.defaultEncoding.isBlank())
                ? yaml.defaultEncoding.trim()
                : null;
        LanguageVariant effectiveFormat = LanguageVariant.fromName(yaml.sourceFormat).orElse(null);
        int effectiveThreads = (yaml.threads != null && yaml.threads > 0) ? yaml.threads : defaultThreads();
        boolean effectiveMockAnalysis = yaml.mockAnalysis != null && yaml.mockAnalysis;

        Path effectiveRules = null;
        if (yaml.classifierRules != null && !yaml.classifierRules.isBlank()) {
            Path rules = Paths.get(yaml.classifierRules.trim());
            Path base = configPath.toAbsolutePath().getParent();
            effectiveRules = rules.isAbsolute() || base == null ? rules : base.resolve(rules);
        }

        return new CodedigestConfig(effectiveMaxFileLines, effectiveEncoding, effectiveFormat,
                thresholds(yaml.summary), budget(yaml.budget), effectiveThreads, effectiveMockAnalysis, effectiveRules);
    }

    private static SummaryThresholds thresholds(YamlSummary yaml) {
        if (yaml == null) {
            return SummaryThresholds.defaults();
        }
        return new SummaryThresholds(
                nonNegativeOr(yaml.fullExampleLimit, SummaryThresholds.DEFAULT_FULL_EXAMPLE_LIMIT),
                nonNegativeOr(yaml.exampleCap, SummaryThresholds.DEFAULT_EXAMPLE_CAP),
                nonNegativeOr(yaml.nameCap, SummaryThresholds.DEFAULT_NAME_CAP));
    }

    private static BudgetConfig budget(YamlBudget yaml) {
        if (yaml == null) {
            return BudgetConfig.defaults();
        }
        return BudgetConfig.builder()
                .contextWindow(positiveOr(yaml.contextWindow, BudgetConfig.DEFAULT_CONTEXT_WINDOW))
                .reservedSystemCost(nonNegativeOr(yaml.reservedSystemCost, BudgetConfig.DEFAULT_RESERVED_SYSTEM_COST))
                .safetyMargin(nonNegativeOr(yaml.safetyMargin, BudgetConfig.DEFAULT_SAFETY_MARGIN))
                .responseCap(nonNegativeOr(yaml.responseCap, BudgetConfig.DEFAULT_RESPONSE_CAP))
                .minimumPromptTokens(nonNegativeOr(yaml.minimumPromptTokens, BudgetConfig.DEFAULT_MINIMUM_PROMPT_TOKENS))
                .maxShrinkIterations(nonNegativeOr(yaml.maxShrinkIterations, BudgetConfig.DEFAULT_MAX_SHRINK_ITERATIONS))
                .reducedExampleCap(nonNegativeOr(yaml.reducedExampleCap, BudgetConfig.DEFAULT_REDUCED_EXAMPLE_CAP))
                .charsPerToken(yaml.charsPerToken != null && yaml.charsPerToken > 0
                        ? yaml.charsPerToken
                        : TokenEstimator.DEFAULT_CHARS_PER_TOKEN)
                .build();
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static int nonNegativeOr(Integer value, int fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private static int defaultThreads() {
        return Runtime.getRuntime().availableProcessors();
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String defaultEncoding;
        public String sourceFormat;
        public Integer threads;
        public Boolean mockAnalysis;
        public String classifierRules;
        public YamlSummary summary;
        public YamlBudget budget;
    }

    private static class YamlSummary {
        public Integer fullExampleLimit;
        public Integer exampleCap;
        public Integer nameCap;
    }

    private static class YamlBudget {
        public Integer contextWindow;
        public Integer reservedSystemCost;
        public Integer safetyMargin;
        public Integer responseCap;
        public Integer minimumPromptTokens;
        public Integer maxShrinkIterations;
        public Integer reducedExampleCap;
        public Double charsPerToken;
    }
}
