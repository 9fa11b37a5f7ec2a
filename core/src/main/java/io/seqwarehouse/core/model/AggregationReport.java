package io.seqwarehouse.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one aggregation run.
 *
 * @param destinationRoot root of the canonical destination tree
 * @param outcomes        one outcome per target and per subfolder, in resolution order
 */
public record AggregationReport(Path destinationRoot, List<TargetOutcome> outcomes) {

    public AggregationReport {
        outcomes = List.copyOf(outcomes);
    }

    public TargetOutcome outcome(String name) {
        return outcomes.stream()
                .filter(outcome -> outcome.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    public List<FileCopy> files() {
        return outcomes.stream().flatMap(outcome -> outcome.files().stream()).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> outcome.state() == TargetState.FAILED);
    }
}
