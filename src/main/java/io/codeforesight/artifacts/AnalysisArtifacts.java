package io.codeforesight.artifacts;

import io.codeforesight.config.GateConfig;
import io.codeforesight.rules.RuleIndex;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The rule index and trained models, loaded once per process and shared read-only by all runs.
 */
public record AnalysisArtifacts(RuleIndex rules, ClassifierModel classifier, TemporalModel temporal) {

    public AnalysisArtifacts {
        if (rules == null || classifier == null || temporal == null) {
            throw new IllegalArgumentException("rules, classifier and temporal model are all required");
        }
    }

    /**
     * Loads every artifact named by the configuration.
     *
     * @throws ModelLoadException if any artifact is missing, malformed or of the wrong format version
     */
    public static AnalysisArtifacts load(GateConfig.ArtifactLocations locations) throws ModelLoadException {
        return new AnalysisArtifacts(
                RuleIndex.load(locations.rules()),
                ClassifierModel.load(locations.classifier()),
                TemporalModel.load(locations.temporal()));
    }

    /**
     * Versions echoed in the report, keyed by artifact.
     */
    public Map<String, String> versions() {
        Map<String, String> versions = new LinkedHashMap<>();
        versions.put("rules", rules.version());
        versions.put("classifier", classifier.modelVersion());
        versions.put("temporal", temporal.modelVersion());
        return versions;
    }
}
