package io.codeforesight.detectors;

import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.List;

/**
 * Base interface for per-snippet detection strategies.
 * Strategies are composed as ordered lists; each looks at one snippet at a time.
 */
public interface DetectionStrategy {

    /**
     * Returns a unique identifier for this strategy.
     */
    String id();

    /**
     * Returns a human-readable description of what this strategy finds.
     */
    String description();

    /**
     * Analyzes one snippet.
     *
     * @param unit    The source unit the snippet belongs to (file id, language, sibling snippets)
     * @param snippet The snippet to analyze
     * @return Findings without ids, in any order; ids are assigned by the stage after sorting
     * @throws ReasoningServiceException if the strategy depends on a reasoning backend that failed
     */
    List<Finding> analyze(SourceUnit unit, Snippet snippet) throws ReasoningServiceException;
}
