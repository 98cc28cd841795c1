package io.codeforesight.reasoning;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    void parse_readsFencedJsonSurroundedByProse() throws Exception {
        String content = """
                Here is my analysis:
                ```json
                {"findings": [
                  {"issue": "Negative total", "severity": "HIGH", "line": 147,
                   "snippet": "total = total - 100;", "fix": "Clamp at zero",
                   "rationale": "Coupon after payment makes the total negative", "confidence": 0.85,
                   "cwe": "CWE-840"}
                ]}
                ```
                Let me know if you need more.
                """;

        List<ReasoningFinding> findings = parser.parse(content);

        assertThat(findings).hasSize(1);
        ReasoningFinding f = findings.get(0);
        assertThat(f.issue()).isEqualTo("Negative total");
        assertThat(f.severity()).isEqualTo("HIGH");
        assertThat(f.line()).isEqualTo(147);
        assertThat(f.snippet()).isEqualTo("total = total - 100;");
        assertThat(f.fix()).isEqualTo("Clamp at zero");
        assertThat(f.confidence()).isEqualTo(0.85);
        assertThat(f.cwe()).isEqualTo("CWE-840");
    }

    @Test
    void parse_toleratesTrailingCommas() throws Exception {
        List<ReasoningFinding> findings = parser.parse("{\"findings\": [{\"issue\": \"x\",},],}");

        assertThat(findings).extracting(ReasoningFinding::issue).containsExactly("x");
    }

    @Test
    void parse_missingFindingsMeansNoFindings() throws Exception {
        assertThat(parser.parse("{\"summary\": \"nothing to report\"}")).isEmpty();
        assertThat(parser.parse("{\"findings\": null}")).isEmpty();
    }

    @Test
    void parse_readsLineFromLeadingDigitsOfText() throws Exception {
        List<ReasoningFinding> findings = parser.parse("""
                {"findings": [
                  {"issue": "a", "line": "42-45"},
                  {"issue": "b", "line": "n/a"},
                  {"issue": "c", "line": "99999999999"}
                ]}""");

        assertThat(findings).extracting(ReasoningFinding::line).containsExactly(42, null, null);
    }

    @Test
    void parse_treatsZeroConfidenceAsAbsent() throws Exception {
        List<ReasoningFinding> findings = parser.parse("""
                {"findings": [{"issue": "a", "confidence": 0}, {"issue": "b", "confidence": 1.5},
                              {"issue": "c", "confidence": "high"}]}""");

        assertThat(findings).allMatch(f -> f.confidenceValue().isEmpty());
    }

    @Test
    void parse_blankFieldsBecomeNull() throws Exception {
        ReasoningFinding f = parser.parse("{\"findings\": [{\"issue\": \"a\", \"fix\": \"  \"}]}").get(0);

        assertThat(f.fix()).isNull();
        assertThat(f.rationale()).isNull();
    }

    @Test
    void parse_nonArrayFindingsIsMalformed() {
        assertMalformed("{\"findings\": \"none\"}");
    }

    @Test
    void parse_contentWithoutObjectIsMalformed() {
        assertMalformed("I could not find any issues.");
        assertMalformed("   ");
    }

    @Test
    void parse_brokenJsonIsMalformed() {
        assertMalformed("{\"findings\": [ {\"issue\": }");
    }

    private void assertMalformed(String content) {
        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(ReasoningServiceException.class)
                .satisfies(e -> assertThat(((ReasoningServiceException) e).kind())
                        .isEqualTo(ReasoningServiceException.Kind.MALFORMED));
    }
}
