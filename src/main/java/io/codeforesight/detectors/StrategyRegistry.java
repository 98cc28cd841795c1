package io.codeforesight.detectors;

import io.codeforesight.artifacts.AnalysisArtifacts;
import io.codeforesight.config.GateConfig;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of detection strategies run against each snippet.
 */
public class StrategyRegistry {

    private final List<DetectionStrategy> strategies;

    private StrategyRegistry(List<DetectionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Rule matcher followed by the classifier.
     */
    public static StrategyRegistry createDefault(AnalysisArtifacts artifacts, GateConfig.Stage1Settings settings) {
        return new StrategyRegistry(List.of(
                new RuleStrategy(artifacts.rules(), settings.maxHitsPerSnippet()),
                new ClassifierStrategy(artifacts.classifier(), settings.keepThreshold(),
                        settings.degradedConfidenceFactor())
        ));
    }

    /**
     * Stage 1 routed through the reasoning backend only.
     */
    public static StrategyRegistry llmOnly(ReasoningClient client) {
        return new StrategyRegistry(List.of(ReasoningStrategy.knownVulnerabilities(client)));
    }

    /**
     * Creates a registry with specific strategies.
     */
    public static StrategyRegistry of(DetectionStrategy... strategies) {
        return new StrategyRegistry(Arrays.asList(strategies));
    }

    /**
     * Runs every strategy on the snippet, in registry order.
     *
     * @return Findings grouped by strategy, in registry order
     */
    public List<List<Finding>> runAll(SourceUnit unit, Snippet snippet) throws ReasoningServiceException {
        List<List<Finding>> results = new ArrayList<>();
        for (DetectionStrategy strategy : strategies) {
            results.add(strategy.analyze(unit, snippet));
        }
        return results;
    }

    public List<DetectionStrategy> allStrategies() {
        return strategies;
    }

    public Optional<DetectionStrategy> getById(String id) {
        return strategies.stream()
                .filter(s -> s.id().equals(id))
                .findFirst();
    }
}
