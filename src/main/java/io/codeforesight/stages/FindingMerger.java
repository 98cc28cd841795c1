package io.codeforesight.stages;

import io.codeforesight.config.MergePolicy;
import io.codeforesight.model.DetectionSource;
import io.codeforesight.model.Finding;
import io.codeforesight.model.InvariantViolationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles rule and classifier findings of one snippet. When both agree on a category the
 * classifier finding is folded into the rule findings, which keep their precise line ranges.
 */
public class FindingMerger {

    private final MergePolicy policy;
    private final double ruleWeight;

    public FindingMerger(MergePolicy policy, double ruleWeight) {
        this.policy = policy;
        this.ruleWeight = ruleWeight;
    }

    public List<Finding> merge(List<Finding> ruleFindings, List<Finding> classifierFindings) {
        List<Finding> merged = new ArrayList<>(ruleFindings);
        for (Finding classified : classifierFindings) {
            boolean agreed = false;
            for (int i = 0; i < merged.size(); i++) {
                Finding rule = merged.get(i);
                if (rule.detector() == DetectionSource.CLASSIFIER
                        || rule.category() != classified.category()
                        || !rule.overlaps(classified)) {
                    continue;
                }
                double confidence = policy.merge(rule.confidence(), classified.confidence(), ruleWeight);
                InvariantViolationException.requireUnitInterval(confidence, "merged confidence");
                merged.set(i, rule.toBuilder()
                        .confidence(confidence)
                        .detector(DetectionSource.MERGED)
                        .build());
                agreed = true;
            }
            if (!agreed) {
                merged.add(classified);
            }
        }
        return merged;
    }
}
