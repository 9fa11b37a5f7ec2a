package io.seqwarehouse.core.model;

import java.util.List;

/**
 * Outcome of reconciling several validated tables.
 *
 * @param records one record per identifier, sorted by identifier
 * @param issues  every reconciliation issue, grouped by identifier in the same order
 */
public record ReconciliationResult(List<ReconciledRecord> records, List<ReconciliationIssue> issues) {

    public ReconciliationResult {
        records = List.copyOf(records);
        issues = List.copyOf(issues);
    }

    public ReconciledRecord find(String identifier) {
        return records.stream()
                .filter(record -> record.identifier().equals(identifier))
                .findFirst()
                .orElse(null);
    }

    public List<ReconciliationIssue> issuesOf(IssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).toList();
    }
}
