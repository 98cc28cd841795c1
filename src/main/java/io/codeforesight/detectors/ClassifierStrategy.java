package io.codeforesight.detectors;

import io.codeforesight.artifacts.ClassifierModel;
import io.codeforesight.artifacts.FeatureExtractor;
import io.codeforesight.model.Category;
import io.codeforesight.model.DetectionSource;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores a snippet's feature vector with the trained classifier and keeps every
 * category whose probability reaches the keep threshold. Findings cover the whole snippet.
 */
public class ClassifierStrategy implements DetectionStrategy {

    private final ClassifierModel model;
    private final FeatureExtractor extractor = new FeatureExtractor();
    private final double keepThreshold;
    private final double degradedFactor;

    /**
     * @param keepThreshold  minimum probability for a category to be kept
     * @param degradedFactor multiplier applied to probabilities on degraded units
     */
    public ClassifierStrategy(ClassifierModel model, double keepThreshold, double degradedFactor) {
        this.model = model;
        this.keepThreshold = keepThreshold;
        this.degradedFactor = degradedFactor;
    }

    @Override
    public String id() {
        return "classifier";
    }

    @Override
    public String description() {
        return "Scores snippet features with the trained vulnerability classifier (" + model.modelVersion() + ")";
    }

    @Override
    public List<Finding> analyze(SourceUnit unit, Snippet snippet) {
        List<Finding> findings = new ArrayList<>();
        Map<Category, Double> scores = model.score(extractor.extract(snippet));
        for (Map.Entry<Category, Double> score : scores.entrySet()) {
            double confidence = unit.degraded() ? score.getValue() * degradedFactor : score.getValue();
            if (confidence < keepThreshold) {
                continue;
            }
            Category category = score.getKey();
            findings.add(Finding.builder()
                    .stage(Stage.STAGE1)
                    .category(category)
                    .cweId(category.primaryCwe())
                    .file(unit.id())
                    .lines(snippet.startLine(), snippet.endLine())
                    .confidence(confidence)
                    .detector(DetectionSource.CLASSIFIER)
                    .functionName(snippet.functionName())
                    .evidence(firstLine(snippet))
                    .build());
        }
        return findings;
    }

    private static String firstLine(Snippet snippet) {
        return snippet.text().lines()
                .filter(l -> !l.isBlank())
                .findFirst()
                .map(RuleStrategy::evidence)
                .orElse("");
    }
}
