package io.codeforesight.detectors;

import io.codeforesight.model.Category;
import io.codeforesight.model.DetectionSource;
import io.codeforesight.model.Finding;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.rules.RuleIndex;
import io.codeforesight.support.Sources;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleStrategyTest {

    private static RuleIndex rules;

    @BeforeAll
    static void loadRules() throws Exception {
        rules = RuleIndex.load("classpath:/rules.yaml");
    }

    @Test
    void analyze_unboundedCopyYieldsBufferOverflowOnExactLine() {
        SourceUnit unit = Sources.single("copy.c", """
                static void copy_untrusted(char *dst, const char *src) {
                    strcpy(dst, src);
                }""", false);

        List<Finding> findings = analyze(unit, 3);

        assertThat(findings).hasSize(1);
        Finding f = findings.get(0);
        assertThat(f.stage()).isEqualTo(Stage.STAGE1);
        assertThat(f.category()).isEqualTo(Category.BUFFER_OVERFLOW);
        assertThat(f.cweId()).isEqualTo("CWE-120");
        assertThat(f.ruleId()).isEqualTo("S1-UNBOUNDED-COPY");
        assertThat(f.detector()).isEqualTo(DetectionSource.RULE);
        assertThat(f.lineStart()).isEqualTo(2);
        assertThat(f.lineEnd()).isEqualTo(2);
        assertThat(f.confidence()).isEqualTo(0.9);
        assertThat(f.evidence()).isEqualTo("strcpy(dst, src);");
        assertThat(f.remediation()).isNotBlank();
        assertThat(f.functionName()).isEqualTo("f");
    }

    @Test
    void analyze_capsHitsPerRulePerSnippet() {
        SourceUnit unit = Sources.single("many.c", """
                strcpy(a, b);
                strcpy(a, b);
                strcpy(a, b);
                strcpy(a, b);
                strcpy(a, b);""", false);

        assertThat(analyze(unit, 3))
                .filteredOn(f -> "S1-UNBOUNDED-COPY".equals(f.ruleId()))
                .hasSize(3);
        assertThat(analyze(unit, 1)).hasSize(1);
    }

    @Test
    void analyze_reportsOneFindingPerLineForRepeatedMatches() {
        SourceUnit unit = Sources.single("same-line.c", "strcpy(a, b); strcat(a, c);", false);

        assertThat(analyze(unit, 3))
                .filteredOn(f -> "S1-UNBOUNDED-COPY".equals(f.ruleId()))
                .hasSize(1);
    }

    @Test
    void analyze_sqlInterpolationIsInjection() {
        SourceUnit unit = Sources.single("query.c",
                "sprintf(out, \"SELECT * FROM users WHERE name = '%s'\", user_input);", false);

        assertThat(analyze(unit, 3))
                .extracting(Finding::ruleId)
                .contains("S1-SQL-INTERPOLATION", "S1-UNBOUNDED-FORMAT");
    }

    @Test
    void analyze_staticQueryIsNotInjection() {
        SourceUnit unit = Sources.single("static.c",
                "safe_copy(out, \"SELECT * FROM users WHERE active = 1\", out_size);", false);

        assertThat(analyze(unit, 3))
                .noneMatch(f -> f.category() == Category.INJECTION);
    }

    @Test
    void analyze_suppressionPatternDropsMatch() {
        SourceUnit safe = Sources.single("load.py", "data = yaml.load(stream, Loader=yaml.SafeLoader)", false);
        SourceUnit unsafe = Sources.single("load.py", "data = yaml.load(stream)", false);

        assertThat(analyze(safe, 3)).noneMatch(f -> f.category() == Category.DESERIALIZATION);
        assertThat(analyze(unsafe, 3)).anyMatch(f -> f.category() == Category.DESERIALIZATION);
    }

    @Test
    void analyze_includeOfParentDirectoryIsNotPathTraversal() {
        SourceUnit unit = Sources.single("inc.c", "#include \"../common.h\"\nFILE *f = fopen(\"../../etc/passwd\", \"r\");", false);

        List<Finding> traversal = analyze(unit, 3).stream()
                .filter(f -> f.category() == Category.PATH_TRAVERSAL)
                .toList();
        assertThat(traversal).hasSize(1);
        assertThat(traversal.get(0).lineStart()).isEqualTo(2);
    }

    @Test
    void analyze_hardCodedPasswordIsCredentialFinding() {
        SourceUnit unit = Sources.single("main.c", "    const char *password = \"P@ssw0rd!\";", false);

        assertThat(analyze(unit, 3))
                .extracting(Finding::category)
                .containsExactly(Category.CREDENTIALS);
    }

    @Test
    void analyze_offsetsLinesBySnippetStart() {
        SourceUnit unit = Sources.fixtureUnit("demo_vuln.c");
        var snippet = Sources.function(unit, "copy_untrusted_bytes");

        List<Finding> findings = new RuleStrategy(rules, 3).analyze(unit, snippet);

        assertThat(findings).extracting(Finding::ruleId).containsExactly("S1-LENGTH-SIZED-COPY");
        assertThat(findings.get(0).lineStart()).isEqualTo(snippet.startLine() + 1);
        assertThat(findings.get(0).cweId()).isEqualTo("CWE-805");
    }

    private static List<Finding> analyze(SourceUnit unit, int maxHits) {
        return new RuleStrategy(rules, maxHits).analyze(unit, unit.snippets().get(0));
    }
}
