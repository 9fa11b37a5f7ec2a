package io.seqwarehouse.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema-typed record: attribute name to typed value or {@code null}. Records with problems are
 * retained with their issues attached.
 */
public final class ValidatedRecord {

    private final String kind;
    private final Map<String, Object> attributes;
    private final SourceLocation location;
    private final List<ValidationIssue> issues;

    public ValidatedRecord(
            String kind, Map<String, Object> attributes, SourceLocation location, List<ValidationIssue> issues) {
        this.kind = kind;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.location = location;
        this.issues = List.copyOf(issues);
    }

    /** Source kind of the schema this record was validated against. */
    public String kind() {
        return kind;
    }

    public Object get(String attribute) {
        return attributes.get(attribute);
    }

    /** The attribute's value as opaque identifier text, or {@code null} when blank. */
    public String identifier(String attribute) {
        Object value = attributes.get(attribute);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public SourceLocation location() {
        return location;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public boolean hasIssue(IssueKind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }

    /** A record is valid when no issue was attached. */
    public boolean isValid() {
        return issues.isEmpty();
    }

    /** Returns a copy with additional issues appended. */
    public ValidatedRecord withIssues(List<ValidationIssue> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<ValidationIssue> all = new ArrayList<>(issues);
        all.addAll(extra);
        return new ValidatedRecord(kind, attributes, location, all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidatedRecord other)) {
            return false;
        }
        return Objects.equals(kind, other.kind)
                && attributes.equals(other.attributes)
                && Objects.equals(location, other.location)
                && issues.equals(other.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, attributes, location, issues);
    }

    @Override
    public String toString() {
        return "ValidatedRecord[" + kind + " " + location + ", " + attributes + ", issues=" + issues.size() + "]";
    }
}
