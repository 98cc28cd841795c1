package io.codeforesight.config;

import io.codeforesight.model.Stage;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A validated combination of {@link ModeOption}s.
 * Decides which stages run and how Stage 1 detects.
 */
public final class ModeConfiguration {

    private final Set<ModeOption> options;

    private ModeConfiguration(Set<ModeOption> options) {
        this.options = Set.copyOf(options);
    }

    /**
     * The default: all three stages, rules and classifier in Stage 1, no explanations.
     */
    public static ModeConfiguration full() {
        return new ModeConfiguration(EnumSet.of(ModeOption.FULL));
    }

    public static ModeConfiguration of(ModeOption... options) throws ConfigException {
        return of(List.of(options));
    }

    /**
     * Validates and builds a configuration.
     *
     * @throws ConfigException if the options contradict each other
     */
    public static ModeConfiguration of(Collection<ModeOption> requested) throws ConfigException {
        Set<ModeOption> options = requested.isEmpty()
                ? EnumSet.noneOf(ModeOption.class)
                : EnumSet.copyOf(requested);

        List<ModeOption> selectors = options.stream()
                .filter(ModeOption::isStageSelector)
                .sorted()
                .toList();
        if (selectors.size() > 1) {
            throw new ConfigException("Use only one of " + ids(selectors) + " at a time.");
        }
        if (options.contains(ModeOption.FULL) && !selectors.isEmpty()) {
            throw new ConfigException("'full' cannot be combined with " + selectors.get(0).id());
        }
        if (options.contains(ModeOption.LLM_ONLY)
                && (options.contains(ModeOption.STAGE2_ONLY) || options.contains(ModeOption.STAGE3_ONLY))) {
            throw new ConfigException("'llm_only' changes Stage 1 and cannot be combined with "
                    + selectors.get(0).id());
        }
        if (selectors.isEmpty()) {
            options.add(ModeOption.FULL);
        }
        return new ModeConfiguration(options);
    }

    /**
     * Returns true if the given stage is selected to run.
     */
    public boolean runs(Stage stage) {
        if (options.contains(ModeOption.STAGE1_ONLY)) {
            return stage == Stage.STAGE1;
        }
        if (options.contains(ModeOption.STAGE2_ONLY)) {
            return stage == Stage.STAGE2;
        }
        if (options.contains(ModeOption.STAGE3_ONLY)) {
            return stage == Stage.STAGE3;
        }
        return true;
    }

    public boolean llmOnly() {
        return options.contains(ModeOption.LLM_ONLY);
    }

    public boolean explain() {
        return options.contains(ModeOption.EXPLAIN);
    }

    public Set<ModeOption> options() {
        return options;
    }

    /**
     * Option ids, e.g. ["explain", "full"].
     */
    public Set<String> optionIds() {
        return options.stream().map(ModeOption::id).collect(Collectors.toCollection(TreeSet::new));
    }

    private static String ids(List<ModeOption> options) {
        return options.stream().map(ModeOption::id).collect(Collectors.joining("/"));
    }

    @Override
    public String toString() {
        return String.join(",", optionIds());
    }
}
