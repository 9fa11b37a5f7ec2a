package io.seqwarehouse.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A problem found while joining tables on an identifier.
 *
 * @param kind       {@link IssueKind#ORPHAN_IDENTIFIER}, {@link IssueKind#DUPLICATE_IDENTIFIER}
 *                   or {@link IssueKind#CONFLICT}
 * @param identifier identifier value the issue concerns
 * @param attribute  conflicting attribute, {@code null} for other kinds
 * @param tableKinds missing kinds for orphans, duplicated kind for duplicates, contributing kinds
 *                   for conflicts
 * @param values     chosen value first, then rejected values (conflicts only)
 * @param detail     human-readable description
 */
public record ReconciliationIssue(
        IssueKind kind,
        String identifier,
        String attribute,
        List<String> tableKinds,
        List<KindValue> values,
        String detail) {

    public ReconciliationIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        tableKinds = List.copyOf(tableKinds);
        values = values != null ? List.copyOf(values) : List.of();
    }

    @Override
    public String toString() {
        return kind + "[" + identifier + (attribute != null ? "." + attribute : "") + "]: " + detail;
    }
}
