package io.seqwarehouse.core.model;

import java.util.Objects;

/**
 * A row-level problem found while validating a raw row against a schema.
 *
 * @param kind      issue kind
 * @param attribute affected attribute, or {@code null} for row-wide issues
 * @param rawValue  offending raw value, may be null
 * @param detail    human-readable description
 * @param location  source row
 */
public record ValidationIssue(
        IssueKind kind, String attribute, Object rawValue, String detail, SourceLocation location) {

    public ValidationIssue {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String toString() {
        return kind + (attribute != null ? "(" + attribute + ")" : "") + " at " + location + ": " + detail;
    }
}
