package io.seqwarehouse.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Union of attributes from every table contributing to one identifier value. Reaction-level rows
 * of {@link Cardinality#MANY} tables stay nested under {@link #children()}; flattening happens
 * only at export.
 */
public final class ReconciledRecord {

    private final String identifier;
    private final Map<String, Object> attributes;
    private final Set<String> presentIn;
    private final Map<String, List<KindValue>> conflicts;
    private final Map<String, List<ValidatedRecord>> children;
    private final List<ReconciliationIssue> issues;

    public ReconciledRecord(
            String identifier,
            Map<String, Object> attributes,
            Set<String> presentIn,
            Map<String, List<KindValue>> conflicts,
            Map<String, List<ValidatedRecord>> children,
            List<ReconciliationIssue> issues) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.presentIn = Collections.unmodifiableSortedSet(new TreeSet<>(presentIn));
        Map<String, List<KindValue>> disagreements = new LinkedHashMap<>();
        conflicts.forEach((attribute, values) -> disagreements.put(attribute, List.copyOf(values)));
        this.conflicts = Collections.unmodifiableMap(disagreements);
        Map<String, List<ValidatedRecord>> nested = new LinkedHashMap<>();
        children.forEach((kind, rows) -> nested.put(kind, List.copyOf(rows)));
        this.children = Collections.unmodifiableMap(nested);
        this.issues = List.copyOf(issues);
    }

    public String identifier() {
        return identifier;
    }

    /** Merged attribute value; {@code null} when no contributing table supplied it. */
    public Object get(String attribute) {
        return attributes.get(attribute);
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    /** Table kinds that contributed at least one record, sorted. */
    public Set<String> presentIn() {
        return presentIn;
    }

    /** Attribute to every disagreeing contribution, for attributes whose sources disagree. */
    public Map<String, List<KindValue>> conflicts() {
        return conflicts;
    }

    /** Nested rows per {@link Cardinality#MANY} table kind, in source order. */
    public Map<String, List<ValidatedRecord>> children() {
        return children;
    }

    public List<ValidatedRecord> children(String tableKind) {
        return children.getOrDefault(tableKind, List.of());
    }

    public List<ReconciliationIssue> issues() {
        return issues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReconciledRecord other)) {
            return false;
        }
        return identifier.equals(other.identifier)
                && attributes.equals(other.attributes)
                && presentIn.equals(other.presentIn)
                && conflicts.equals(other.conflicts)
                && children.equals(other.children)
                && issues.equals(other.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, attributes, presentIn, conflicts, children, issues);
    }

    @Override
    public String toString() {
        return "ReconciledRecord[" + identifier + ", presentIn=" + presentIn + ", attributes=" + attributes.size()
                + ", conflicts=" + conflicts.keySet() + "]";
    }
}
