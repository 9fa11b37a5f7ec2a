package io.seqwarehouse.core.model;

/**
 * Non-fatal problems attached to records. Row-level kinds come from validation; the last three
 * come from reconciliation.
 */
public enum IssueKind {
    MISSING_REQUIRED_FIELD,
    TYPE_MISMATCH,
    DATE_FORMAT_MISMATCH,
    MISSING_IDENTIFIER,
    MALFORMED_ROW,
    DUPLICATE_VALUE,
    PATTERN_MISMATCH,
    IDENTIFIER_MISMATCH,
    ROW_COUNT_MISMATCH,

    ORPHAN_IDENTIFIER,
    DUPLICATE_IDENTIFIER,
    CONFLICT;

    public boolean isReconciliationIssue() {
        return this == ORPHAN_IDENTIFIER || this == DUPLICATE_IDENTIFIER || this == CONFLICT;
    }
}
