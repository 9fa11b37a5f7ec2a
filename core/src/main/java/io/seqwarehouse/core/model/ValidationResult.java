package io.seqwarehouse.core.model;

import java.util.List;

/**
 * Outcome of validating one table: one record per input row plus every issue found.
 *
 * @param schemaKind kind of the schema used
 * @param records    validated records, in source order
 * @param issues     all issues, in source order
 */
public record ValidationResult(String schemaKind, List<ValidatedRecord> records, List<ValidationIssue> issues) {

    public ValidationResult {
        records = List.copyOf(records);
        issues = List.copyOf(issues);
    }

    public long countOf(IssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).count();
    }

    /** Records that carry an identifier and can take part in reconciliation. */
    public List<ValidatedRecord> reconcilable() {
        return records.stream()
                .filter(record -> !record.hasIssue(IssueKind.MISSING_IDENTIFIER))
                .toList();
    }
}
