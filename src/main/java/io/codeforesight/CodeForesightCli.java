package io.codeforesight;

import io.codeforesight.artifacts.AnalysisArtifacts;
import io.codeforesight.artifacts.ModelLoadException;
import io.codeforesight.config.ConfigException;
import io.codeforesight.config.GateConfig;
import io.codeforesight.config.ModeConfiguration;
import io.codeforesight.config.ModeOption;
import io.codeforesight.gate.GateListener;
import io.codeforesight.gate.GateOrchestrator;
import io.codeforesight.gate.GateState;
import io.codeforesight.gate.TrajectoryLoader;
import io.codeforesight.model.ExitStatus;
import io.codeforesight.model.GateDecision;
import io.codeforesight.model.InvariantViolationException;
import io.codeforesight.model.Language;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.TrajectoryPoint;
import io.codeforesight.normalize.Normalizer;
import io.codeforesight.reasoning.HttpReasoningClient;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.Sleeper;
import io.codeforesight.report.ConsoleReporter;
import io.codeforesight.report.HtmlReporter;
import io.codeforesight.report.JsonReporter;
import io.codeforesight.report.Reporter;
import io.codeforesight.stages.RunContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point for code-foresight.
 */
@Command(
        name = "code-foresight",
        mixinStandardHelpOptions = true,
        version = "code-foresight 1.0.0",
        description = "Runs source code through three security gates: known vulnerabilities, "
                + "business-logic flaws and forecast risk.",
        footer = {
                "",
                "Examples:",
                "  code-foresight src/demo_vuln.c",
                "  code-foresight --stage1-only --explain src/demo_vuln.c",
                "  code-foresight --llm-only -o json -f report.json src/*.c",
                "  code-foresight --stage3-only --history risk-history.json src/*.c",
                "",
                "Exit codes: 0 pass, 10/20/30 stage 1/2/3 blocked, 3 indeterminate,",
                "            1 fatal error, 2 usage or configuration error"
        }
)
public class CodeForesightCli implements Callable<Integer> {

    @Parameters(
            arity = "1..*",
            paramLabel = "FILE",
            description = "Source files to analyze"
    )
    private List<Path> inputFiles;

    @Option(
            names = {"--language"},
            description = "Language tag for all inputs (c, cpp, java, javascript, go, csharp, python). "
                    + "Detected from the file when omitted."
    )
    private String language;

    @Option(names = {"--full"}, description = "Run all three stages (default)")
    private boolean full;

    @Option(names = {"--stage1-only", "--stage1"}, description = "Run only Stage 1 (known vulnerabilities)")
    private boolean stage1Only;

    @Option(names = {"--stage2-only", "--stage2"}, description = "Run only Stage 2 (business-logic flaws)")
    private boolean stage2Only;

    @Option(names = {"--stage3-only", "--stage3"}, description = "Run only Stage 3 (risk forecast)")
    private boolean stage3Only;

    @Option(names = {"--llm-only"}, description = "Use the reasoning backend for Stage 1 instead of rules and classifier")
    private boolean llmOnly;

    @Option(names = {"--explain"}, description = "Attach explanations to the top Stage 1 findings")
    private boolean explain;

    @Option(
            names = {"--max-explain"},
            description = "Number of Stage 1 findings to explain (default: from config)"
    )
    private Integer maxExplain;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration file (default: code-foresight.yaml in the working directory)"
    )
    private Path configFile;

    @Option(
            names = {"--history"},
            description = "JSON file with the risk trajectory of earlier runs: [{\"timestamp\": ..., \"riskLoad\": ...}]"
    )
    private Path historyFile;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file (default: stdout)"
    )
    private Path outputFile;

    @Option(names = {"--pretty"}, description = "Pretty-print JSON output")
    private boolean pretty;

    @Option(names = {"--no-color"}, description = "Disable colored output")
    private boolean noColor;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Option(
            names = {"--allow-indeterminate"},
            description = "Exit 0 instead of 3 when a gate could not reach a verdict"
    )
    private boolean allowIndeterminate;

    public enum OutputFormat {
        console, json, html
    }

    @Override
    public Integer call() {
        try {
            for (Path input : inputFiles) {
                if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
                    System.err.println("Error: Input file does not exist or is not readable: " + input);
                    return ExitStatus.CONFIG_ERROR.code();
                }
            }

            if (outputFormat == OutputFormat.console) {
                printBanner();
            }

            ModeConfiguration mode = ModeConfiguration.of(requestedModes());
            log("Mode: " + mode);

            GateConfig config = loadConfig();
            if (maxExplain != null) {
                config = config.withOverride("stage1", "maxExplain", maxExplain);
            }

            log("Loading rule index and models...");
            AnalysisArtifacts artifacts = AnalysisArtifacts.load(config.artifacts());
            artifacts.versions().forEach((name, version) -> log("  " + name + ": " + version));
            log("  " + artifacts.rules().size() + " detection rules");

            List<TrajectoryPoint> history = List.of();
            if (historyFile != null) {
                history = new TrajectoryLoader().load(historyFile);
                log("Loaded " + history.size() + " trajectory points from " + historyFile);
            }

            log("Normalizing sources...");
            List<SourceUnit> units = normalize(config);

            GateConfig.ReasoningSettings reasoning = config.reasoning();
            ReasoningClient primary = HttpReasoningClient.fromEnvironment(reasoning, reasoning.model());
            ReasoningClient fallback = reasoning.fallbackModel() == null || reasoning.fallbackModel().isBlank()
                    ? null
                    : HttpReasoningClient.fromEnvironment(reasoning, reasoning.fallbackModel());

            GateOrchestrator orchestrator = new GateOrchestrator(config, artifacts, primary, fallback, Sleeper.SYSTEM);
            GateDecision decision = orchestrator.run(units, mode, history,
                    new RunContext(), new ProgressListener());

            writeReport(decision, createReporter());
            return exitCode(decision, allowIndeterminate);

        } catch (ConfigException e) {
            System.err.println("Error: " + e.getMessage());
            return ExitStatus.CONFIG_ERROR.code();
        } catch (ModelLoadException e) {
            System.err.println("Error: Failed to load analysis artifacts: " + e.getMessage());
            return ExitStatus.FATAL.code();
        } catch (InvariantViolationException e) {
            System.err.println("Error: Internal invariant violated: " + e.getMessage());
            return ExitStatus.FATAL.code();
        } catch (IOException e) {
            System.err.println("Error: I/O error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return ExitStatus.FATAL.code();
        } catch (Exception e) {
            System.err.println("Error: Unexpected error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return ExitStatus.FATAL.code();
        }
    }

    /**
     * Process exit code for a decision. An indeterminate outcome passes when allowed.
     */
    static int exitCode(GateDecision decision, boolean allowIndeterminate) {
        if (decision.exitStatus() == ExitStatus.INDETERMINATE && allowIndeterminate) {
            return ExitStatus.PASS.code();
        }
        return decision.exitStatus().code();
    }

    private Set<ModeOption> requestedModes() {
        Set<ModeOption> modes = EnumSet.noneOf(ModeOption.class);
        if (full) {
            modes.add(ModeOption.FULL);
        }
        if (stage1Only) {
            modes.add(ModeOption.STAGE1_ONLY);
        }
        if (stage2Only) {
            modes.add(ModeOption.STAGE2_ONLY);
        }
        if (stage3Only) {
            modes.add(ModeOption.STAGE3_ONLY);
        }
        if (llmOnly) {
            modes.add(ModeOption.LLM_ONLY);
        }
        if (explain) {
            modes.add(ModeOption.EXPLAIN);
        }
        return modes;
    }

    private GateConfig loadConfig() throws IOException, ConfigException {
        GateConfig defaultConfig = GateConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new ConfigException("Configuration file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(GateConfig.loadFromFile(configFile));
        }

        // Check for code-foresight.yaml in the working directory
        Path localConfig = Path.of("code-foresight.yaml");
        if (Files.exists(localConfig)) {
            log("Loading configuration from: " + localConfig.toAbsolutePath());
            return defaultConfig.merge(GateConfig.loadFromFile(localConfig));
        }

        return defaultConfig;
    }

    private List<SourceUnit> normalize(GateConfig config) throws IOException {
        Normalizer normalizer = new Normalizer(config.fallbackWindowLines());
        List<SourceUnit> units = new ArrayList<>();
        for (Path input : inputFiles) {
            String text = readSource(input);
            Language lang = language != null ? Language.fromTag(language) : Language.detect(input, text);
            SourceUnit unit = normalizer.normalize(input.toString(), text, lang);
            log("  " + input + " [" + lang.tag() + "]: " + unit.snippets().size() + " snippets"
                    + (unit.degraded() ? " (degraded)" : ""));
            units.add(unit);
        }
        return units;
    }

    /**
     * Decodes a source file as UTF-8, replacing malformed bytes instead of failing.
     */
    static String readSource(Path input) throws IOException {
        return new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor && outputFile == null);
            case json -> new JsonReporter(pretty);
            case html -> new HtmlReporter();
        };
    }

    private void writeReport(GateDecision decision, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(decision, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            reporter.write(decision, out);
            out.flush();
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private void printBanner() {
        System.out.println("""
                ╔═══════════════════════════════════════════════════════════════╗
                ║                        CODE-FORESIGHT                         ║
                ║        Three-Stage Security Gate for Source Changes           ║
                ╚═══════════════════════════════════════════════════════════════╝
                """);
    }

    private class ProgressListener implements GateListener {

        @Override
        public void onTransition(GateState state) {
            switch (state) {
                case STAGE1_RUNNING -> log("Stage 1: scanning for known vulnerabilities...");
                case STAGE2_RUNNING -> log("Stage 2: reasoning about business logic...");
                case STAGE3_RUNNING -> log("Stage 3: forecasting risk trend...");
                default -> {
                }
            }
        }

        @Override
        public void onStageComplete(StageReport report) {
            log("  " + report.verdict().id() + ", "
                    + report.totalFindings() + " findings"
                    + (report.reason() != null ? " (" + report.reason() + ")" : ""));
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeForesightCli()).execute(args);
        System.exit(exitCode);
    }
}
