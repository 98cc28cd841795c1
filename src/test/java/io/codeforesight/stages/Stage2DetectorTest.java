package io.codeforesight.stages;

import io.codeforesight.config.GateConfig;
import io.codeforesight.model.Category;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.Verdict;
import io.codeforesight.reasoning.ReasoningResponse;
import io.codeforesight.reasoning.ReasoningServiceException;
import io.codeforesight.support.FakeReasoningClient;
import io.codeforesight.support.Sources;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.codeforesight.support.FakeReasoningClient.finding;
import static org.assertj.core.api.Assertions.assertThat;

class Stage2DetectorTest {

    private static final GateConfig.Stage2Settings SNIPPETS =
            new GateConfig.Stage2Settings(0.7, false, GateConfig.Granularity.SNIPPET);

    private final SourceUnit unit = Sources.fixtureUnit("demo_vuln.c");

    @Test
    void run_surfacesBusinessLogicFlawWhenBackendReachable() {
        Snippet coupon = Sources.function(unit, "apply_coupon_after_checkout");
        FakeReasoningClient client = FakeReasoningClient.responding(request ->
                "apply_coupon_after_checkout".equals(request.snippet().functionName())
                        ? new ReasoningResponse(List.of(finding("Negative total after coupon", "high",
                        coupon.startLine() + 6, "Coupon applied after payment makes the total negative",
                        "Reject coupons once paid and clamp the total at zero")), "fake")
                        : ReasoningResponse.empty("fake"));

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(unit), new RunContext(), client);

        assertThat(report.stage()).isEqualTo(Stage.STAGE2);
        assertThat(report.verdict()).isEqualTo(Verdict.BLOCK);
        assertThat(report.findings()).singleElement().satisfies(f -> {
            assertThat(f.id()).isEqualTo("S2-0001");
            assertThat(f.category()).isEqualTo(Category.BUSINESS_LOGIC);
            assertThat(f.lineStart()).isEqualTo(coupon.startLine() + 6);
        });
        assertThat(client.calls()).isEqualTo(unit.snippets().size());
    }

    @Test
    void run_isIndeterminateWhenBackendUnreachable() {
        FakeReasoningClient client = FakeReasoningClient.failing(ReasoningServiceException.Kind.TIMEOUT);

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(unit), new RunContext(), client);

        assertThat(report.verdict()).isEqualTo(Verdict.INDETERMINATE);
        assertThat(report.findings()).isEmpty();
        assertThat(report.reason())
                .contains("failed for " + unit.snippets().size() + " of " + unit.snippets().size())
                .contains("timeout");
    }

    @Test
    void run_keepsPartialResultsAndReportsFailures() {
        FakeReasoningClient client = FakeReasoningClient.answering(finding("Missing authorization", "low", null, "r", null))
                .thenFail(ReasoningServiceException.Kind.UNAVAILABLE);

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(unit), new RunContext(), client);

        // low severity stays under the block threshold
        assertThat(report.verdict()).isEqualTo(Verdict.INDETERMINATE);
        assertThat(report.findings()).hasSize(unit.snippets().size() - 1);
        assertThat(report.reason()).contains("failed for 1 of " + unit.snippets().size());
    }

    @Test
    void run_blockWinsOverPartialFailure() {
        FakeReasoningClient client = FakeReasoningClient.answering(finding("Missing authorization", "critical", null, "r", null))
                .thenFail(ReasoningServiceException.Kind.UNAVAILABLE);

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(unit), new RunContext(), client);

        assertThat(report.verdict()).isEqualTo(Verdict.BLOCK);
        assertThat(report.reason()).contains("failed for 1 of");
    }

    @Test
    void run_passesWhenOnlySignatureIssuesAreReported() {
        FakeReasoningClient client = FakeReasoningClient.answering(
                finding("Buffer overflow in copy", "critical", null, "strcpy", null));

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(unit), new RunContext(), client);

        assertThat(report.verdict()).isEqualTo(Verdict.PASS);
        assertThat(report.findings()).isEmpty();
        assertThat(report.reason()).isNull();
    }

    @Test
    void run_emptyInputPassesWithoutCalls() {
        FakeReasoningClient client = FakeReasoningClient.silent();

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(Sources.c("empty.c", "")), new RunContext(), client);

        assertThat(report.verdict()).isEqualTo(Verdict.PASS);
        assertThat(client.calls()).isZero();
    }

    @Test
    void run_fileGranularitySendsOneWholeFileRequest() {
        FakeReasoningClient client = FakeReasoningClient.silent();
        GateConfig.Stage2Settings file = new GateConfig.Stage2Settings(0.7, false, GateConfig.Granularity.FILE);

        new Stage2Detector(file).run(List.of(unit), new RunContext(), client);

        assertThat(client.calls()).isEqualTo(1);
        Snippet sent = client.requests().get(0).snippet();
        assertThat(sent.startLine()).isEqualTo(1);
        assertThat(sent.endLine()).isEqualTo(unit.lineCount());
        assertThat(sent.text()).isEqualTo(unit.text());
    }

    @Test
    void targets_degradedUnitIsAnalyzedAsWholeFile() {
        SourceUnit broken = Sources.c("broken.c", "void f(void) {\n    int total = -1;\n");

        List<Snippet> targets = new Stage2Detector(SNIPPETS).targets(broken);

        assertThat(broken.degraded()).isTrue();
        assertThat(targets).singleElement().satisfies(s -> {
            assertThat(s.startLine()).isEqualTo(1);
            assertThat(s.functionName()).isNull();
        });
    }

    @Test
    void run_findingIdsContinueFromRunContext() {
        RunContext ctx = new RunContext();
        ctx.nextId(Stage.STAGE2);
        FakeReasoningClient client = FakeReasoningClient.responding(request ->
                "view_admin_report".equals(request.snippet().functionName())
                        ? new ReasoningResponse(List.of(finding("Missing authorization", "high", null, "r", null)), "f")
                        : ReasoningResponse.empty("f"));

        StageReport report = new Stage2Detector(SNIPPETS).run(List.of(unit), ctx, client);

        assertThat(report.findings()).extracting(Finding::id).containsExactly("S2-0002");
    }
}
