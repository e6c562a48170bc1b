package org.dxworks.codedigest.classifier;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CategoryClassifierTest {

    private final CategoryClassifier classifier = CategoryClassifier.defaults();

    @Test
    void classifiesProcedures() {
        assertEquals("control", classifier.classify("0000-MAIN", NameKind.PROCEDURE));
        assertEquals("initialization", classifier.classify("1000-INIT", NameKind.PROCEDURE));
        assertEquals("error-handling", classifier.classify("9000-ABEND-ROUTINE", NameKind.PROCEDURE));
        assertEquals("exit", classifier.classify("2000-EXIT", NameKind.PROCEDURE));
        assertEquals("other", classifier.classify("P1", NameKind.PROCEDURE));
    }

    @Test
    void classifiesVariables() {
        assertEquals("filler", classifier.classify("FILLER", NameKind.VARIABLE));
        assertEquals("flag", classifier.classify("WS-EOF-SW", NameKind.VARIABLE));
        assertEquals("counter", classifier.classify("WS-REC-CNT", NameKind.VARIABLE));
        assertEquals("date-time", classifier.classify("WS-RUN-DATE", NameKind.VARIABLE));
        assertEquals("other", classifier.classify("WS-X", NameKind.VARIABLE));
    }

    @Test
    void rulesApplyOnlyToTheirKind() {
        assertEquals("calculation", classifier.classify("WS-TOTAL", NameKind.PROCEDURE));
        assertEquals("amount", classifier.classify("WS-TOTAL", NameKind.VARIABLE));
    }

    @Test
    void namesAreNormalizedBeforeMatching() {
        assertEquals("flag", classifier.classify("  ws_eof_flag ", NameKind.VARIABLE));
        assertEquals("other", classifier.classify(null, NameKind.VARIABLE));
        assertEquals("other", classifier.classify(" ", NameKind.PROCEDURE));
    }

    @Test
    void tokenRulesMatchWholeWordsOnly() {
        // "swap" holds "sw" only as a substring
        assertEquals("other", classifier.classify("WS-SWAP", NameKind.VARIABLE));
    }

    @Test
    void firstMatchingRuleWins() {
        CategoryClassifier custom = classifier.withFirst(
                new CategoryRule(new PrefixMatch("ws-"), "working-storage", NameKind.VARIABLE));

        assertEquals("working-storage", custom.classify("WS-EOF-SW", NameKind.VARIABLE));
        assertEquals("flag", classifier.classify("WS-EOF-SW", NameKind.VARIABLE));

        CategoryClassifier fallback = classifier.withLast(
                new CategoryRule(new SubstringMatch("x"), "mystery", null));
        assertEquals("mystery", fallback.classify("WS-X", NameKind.VARIABLE));
        assertEquals("flag", fallback.classify("WS-X-FLAG", NameKind.VARIABLE));
    }

    @Test
    void loadsRulesFromYaml() throws Exception {
        String yaml = "rules:\n"
                + "  - kind: procedure\n"
                + "    match: prefix\n"
                + "    values: [\"8\"]\n"
                + "    category: batch\n"
                + "  - kind: any\n"
                + "    match: token\n"
                + "    values: [tmp]\n"
                + "    category: scratch\n";

        List<CategoryRule> rules = CategoryRules.fromYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        CategoryClassifier custom = new CategoryClassifier(rules);

        assertEquals("batch", custom.classify("8000-NIGHTLY", NameKind.PROCEDURE));
        assertEquals("other", custom.classify("8000-NIGHTLY", NameKind.VARIABLE));
        assertEquals("scratch", custom.classify("WS-TMP-AREA", NameKind.VARIABLE));
    }

    @Test
    void rejectsUnknownMatchStyle() {
        String yaml = "rules:\n"
                + "  - match: regex\n"
                + "    values: [a]\n"
                + "    category: broken\n";

        assertThrows(IOException.class,
                () -> CategoryRules.fromYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }
}
