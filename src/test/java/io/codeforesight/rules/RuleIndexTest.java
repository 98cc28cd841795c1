package io.codeforesight.rules;

import io.codeforesight.artifacts.ModelLoadException;
import io.codeforesight.model.Category;
import io.codeforesight.model.Severity;
import io.codeforesight.model.Stage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleIndexTest {

    @Test
    void load_bundledIndexHasVersionAndStage1Rules() throws Exception {
        RuleIndex index = RuleIndex.load("classpath:/rules.yaml");

        assertThat(index.version()).isEqualTo("2024.06-1");
        assertThat(index.size()).isGreaterThanOrEqualTo(10);
        assertThat(index.rulesFor(Stage.STAGE1)).hasSize(index.size());
        assertThat(index.rules()).extracting(DetectionRule::id)
                .contains("S1-UNBOUNDED-COPY", "S1-SQL-INTERPOLATION", "S1-HARDCODED-CREDENTIAL")
                .doesNotHaveDuplicates();
    }

    @Test
    void load_parsesRuleFields() throws Exception {
        RuleIndex index = RuleIndex.load(yaml("""
                formatVersion: 1
                version: test-1
                rules:
                  - id: T-1
                    name: Test rule
                    category: injection
                    cwe: CWE-89
                    severity: critical
                    ignoreCase: true
                    pattern: 'select'
                    suppressIf: 'safe'
                    confidence: 0.4
                    remediation: Do not.
                """), "test");

        DetectionRule rule = index.rules().get(0);
        assertThat(rule.category()).isEqualTo(Category.INJECTION);
        assertThat(rule.cweId()).isEqualTo("CWE-89");
        assertThat(rule.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(rule.confidence()).isEqualTo(0.4);
        assertThat(rule.pattern().matcher("SELECT 1").find()).isTrue();
        assertThat(rule.suppresses("select * -- SAFE")).isTrue();
        assertThat(rule.suppresses("select *")).isFalse();
    }

    @Test
    void load_rejectsFormatVersionMismatch() {
        assertThatThrownBy(() -> RuleIndex.load(yaml("formatVersion: 2\nrules: []\n"), "v2"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("formatVersion");
    }

    @Test
    void load_rejectsDuplicateIds() {
        String doc = """
                formatVersion: 1
                rules:
                  - {id: D, category: xss, pattern: 'a'}
                  - {id: D, category: xss, pattern: 'b'}
                """;
        assertThatThrownBy(() -> RuleIndex.load(yaml(doc), "dup"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Duplicate rule id D");
    }

    @Test
    void load_rejectsInvalidPattern() {
        String doc = """
                formatVersion: 1
                rules:
                  - {id: P, category: xss, pattern: '(unclosed'}
                """;
        assertThatThrownBy(() -> RuleIndex.load(yaml(doc), "bad"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("invalid pattern");
    }

    @Test
    void load_rejectsUnknownCategory() {
        String doc = """
                formatVersion: 1
                rules:
                  - {id: C, category: weather, pattern: 'x'}
                """;
        assertThatThrownBy(() -> RuleIndex.load(yaml(doc), "cat"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("unknown category");
    }

    @Test
    void load_missingArtifactIsModelLoadError() {
        assertThatThrownBy(() -> RuleIndex.load("classpath:/no-such-rules.yaml"))
                .isInstanceOf(ModelLoadException.class);
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
