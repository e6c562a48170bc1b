package org.dxworks.codedigest.classifier;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Loads category rules from YAML. Each entry names a kind ({@code procedure}, {@code variable} or
 * {@code any}), a match style ({@code prefix}, {@code contains} or {@code token}), the values and
 * the category:
 *
 * <pre>
 * rules:
 *   - kind: procedure
 *     match: contains
 *     values: [valid, verify]
 *     category: validation
 * </pre>
 *
 * The default set is the bundled {@code default-rules.yml} preceded by the built-in custom rules.
 */
public final class CategoryRules {

    private static final String DEFAULT_RULES_RESOURCE = "default-rules.yml";

    private static final Pattern EXIT_PARAGRAPH = Pattern.compile("^([a-z0-9]+-)*exit$");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CategoryRules() {
    }

    public static List<CategoryRule> defaultRules() {
        return DefaultsHolder.DEFAULTS;
    }

    public static List<CategoryRule> builtInRules() {
        List<CategoryRule> rules = new ArrayList<>();
        rules.add(new CategoryRule(new CustomPredicate("filler", "filler"::equals), "filler", NameKind.VARIABLE));
        rules.add(new CategoryRule(new CustomPredicate("exit paragraph", name -> EXIT_PARAGRAPH.matcher(name).matches()),
                "exit", NameKind.PROCEDURE));
        return rules;
    }

    public static List<CategoryRule> fromYaml(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return fromYaml(in);
        }
    }

    public static List<CategoryRule> fromYaml(InputStream in) throws IOException {
        YamlRules yamlRules = YAML_MAPPER.readValue(in, YamlRules.class);
        List<CategoryRule> rules = new ArrayList<>();
        if (yamlRules == null || yamlRules.rules == null) {
            return rules;
        }
        for (YamlRule yamlRule : yamlRules.rules) {
            rules.add(toRule(yamlRule));
        }
        return rules;
    }

    private static CategoryRule toRule(YamlRule yamlRule) throws IOException {
        if (yamlRule.category == null || yamlRule.category.isBlank()) {
            throw new IOException("Category rule without a category: " + yamlRule.values);
        }
        if (yamlRule.values == null || yamlRule.values.isEmpty()) {
            throw new IOException("Category rule '" + yamlRule.category + "' has no values");
        }

        String match = yamlRule.match == null ? "contains" : yamlRule.match.trim().toLowerCase(Locale.ROOT);
        NamePredicate predicate;
        switch (match) {
            case "prefix":
                predicate = new PrefixMatch(yamlRule.values);
                break;
            case "contains":
                predicate = new SubstringMatch(yamlRule.values);
                break;
            case "token":
                predicate = CustomPredicate.anyToken(yamlRule.values);
                break;
            default:
                throw new IOException("Unknown match style '" + yamlRule.match + "' for category " + yamlRule.category);
        }
        return new CategoryRule(predicate, yamlRule.category.trim(), toKind(yamlRule.kind));
    }

    private static NameKind toKind(String kind) throws IOException {
        if (kind == null || kind.equalsIgnoreCase("any")) {
            return null;
        }
        try {
            return NameKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown name kind: " + kind, e);
        }
    }

    private static List<CategoryRule> loadDefaults() {
        List<CategoryRule> rules = builtInRules();
        try (InputStream in = CategoryRules.class.getResourceAsStream(DEFAULT_RULES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classifier resource: " + DEFAULT_RULES_RESOURCE);
            }
            rules.addAll(fromYaml(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default classifier rules", e);
        }
        return List.copyOf(rules);
    }

    private static final class DefaultsHolder {
        private static final List<CategoryRule> DEFAULTS = loadDefaults();
    }

    private static class YamlRules {
        public List<YamlRule> rules;
    }

    private static class YamlRule {
        public String kind;
        public String match;
        public List<String> values;
        public String category;
    }
}
