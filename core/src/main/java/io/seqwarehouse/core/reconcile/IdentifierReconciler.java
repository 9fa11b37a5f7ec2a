package io.seqwarehouse.core.reconcile;

import io.seqwarehouse.core.model.Cardinality;
import io.seqwarehouse.core.model.IssueKind;
import io.seqwarehouse.core.model.KindValue;
import io.seqwarehouse.core.model.ReconciledRecord;
import io.seqwarehouse.core.model.ReconciliationIssue;
import io.seqwarehouse.core.model.ReconciliationResult;
import io.seqwarehouse.core.model.ValidatedRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins validated tables of different kinds on a shared identifier.
 *
 * <p>
 * The identifiers of the primary tables define the output: one {@link ReconciledRecord} per
 * identifier, sorted by identifier. For each identifier:
 *
 * <ul>
 *   <li>a {@link Cardinality#ONE} table contributes its first record; further records raise
 *       {@link IssueKind#DUPLICATE_IDENTIFIER};
 *   <li>a {@link Cardinality#MANY} table contributes all its records as nested children;
 *   <li>kinds lacking the identifier are named in a single {@link IssueKind#ORPHAN_IDENTIFIER};
 *   <li>attributes on which contributions disagree keep the value of the highest-precedence kind
 *       and raise {@link IssueKind#CONFLICT} listing every value.
 * </ul>
 *
 * Identifiers seen only in secondary tables produce no record but are reported as orphans.
 * Records without an identifier are skipped; validation already reported them. The result does
 * not depend on the iteration order of the input map.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class IdentifierReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(IdentifierReconciler.class);

    private final TablePrecedence precedence;

    public IdentifierReconciler() {
        this(TablePrecedence.defaults());
    }

    public IdentifierReconciler(TablePrecedence precedence) {
        this.precedence = Objects.requireNonNull(precedence, "precedence must not be null");
    }

    public TablePrecedence precedence() {
        return precedence;
    }

    /**
     * Reconciles tables keyed by table kind.
     *
     * @param tables table kind to validated input
     * @return records sorted by identifier and every reconciliation issue
     */
    public ReconciliationResult reconcile(Map<String, TableInput> tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        Comparator<String> byPrecedence = precedence.comparator(kind -> tables.get(kind).category());
        List<String> kinds = tables.keySet().stream().sorted(byPrecedence).toList();

        Map<String, Map<String, List<ValidatedRecord>>> byKind = new LinkedHashMap<>();
        for (String kind : kinds) {
            byKind.put(kind, groupByIdentifier(tables.get(kind)));
        }

        List<String> primaryKinds = kinds.stream().filter(k -> tables.get(k).primary()).toList();
        if (primaryKinds.isEmpty()) {
            primaryKinds = kinds;
        }
        Set<String> identifiers = new TreeSet<>();
        primaryKinds.forEach(kind -> identifiers.addAll(byKind.get(kind).keySet()));

        Map<String, List<ReconciliationIssue>> issuesById = new TreeMap<>();
        List<ReconciledRecord> records = new ArrayList<>();
        for (String identifier : identifiers) {
            List<ReconciliationIssue> issues = new ArrayList<>();
            records.add(merge(identifier, kinds, tables, byKind, issues));
            issuesById.put(identifier, issues);
        }

        List<String> sortedPrimary = primaryKinds.stream().sorted().toList();
        for (String kind : kinds) {
            for (String identifier : byKind.get(kind).keySet()) {
                if (!identifiers.contains(identifier) && !issuesById.containsKey(identifier)) {
                    List<String> seenIn = kinds.stream()
                            .filter(k -> byKind.get(k).containsKey(identifier))
                            .sorted()
                            .toList();
                    issuesById.put(identifier, List.of(new ReconciliationIssue(
                            IssueKind.ORPHAN_IDENTIFIER,
                            identifier,
                            null,
                            sortedPrimary,
                            List.of(),
                            "Identifier only present in " + seenIn + "; missing from primary tables "
                                    + sortedPrimary)));
                }
            }
        }

        List<ReconciliationIssue> allIssues = issuesById.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
        if (LOG.isDebugEnabled()) {
            allIssues.forEach(issue -> LOG.debug("{}", issue));
        }
        LOG.info(
                "Reconciled {} tables {} into {} records: {} orphans, {} duplicates, {} conflicts",
                kinds.size(),
                kinds,
                records.size(),
                count(allIssues, IssueKind.ORPHAN_IDENTIFIER),
                count(allIssues, IssueKind.DUPLICATE_IDENTIFIER),
                count(allIssues, IssueKind.CONFLICT));
        return new ReconciliationResult(records, allIssues);
    }

    private static Map<String, List<ValidatedRecord>> groupByIdentifier(TableInput table) {
        Map<String, List<ValidatedRecord>> grouped = new LinkedHashMap<>();
        for (ValidatedRecord record : table.records()) {
            String identifier = record.identifier(table.identifierAttribute());
            if (identifier != null) {
                grouped.computeIfAbsent(identifier, k -> new ArrayList<>()).add(record);
            }
        }
        return grouped;
    }

    private ReconciledRecord merge(
            String identifier,
            List<String> kinds,
            Map<String, TableInput> tables,
            Map<String, Map<String, List<ValidatedRecord>>> byKind,
            List<ReconciliationIssue> issues) {
        Set<String> presentIn = new TreeSet<>();
        List<String> missing = new ArrayList<>();
        Map<String, List<ValidatedRecord>> children = new LinkedHashMap<>();
        Map<String, List<KindValue>> contributions = new LinkedHashMap<>();

        for (String kind : kinds) {
            List<ValidatedRecord> matches = byKind.get(kind).get(identifier);
            if (matches == null) {
                missing.add(kind);
                continue;
            }
            presentIn.add(kind);
            if (tables.get(kind).cardinality() == Cardinality.MANY) {
                children.put(kind, matches);
                continue;
            }
            if (matches.size() > 1) {
                issues.add(new ReconciliationIssue(
                        IssueKind.DUPLICATE_IDENTIFIER,
                        identifier,
                        null,
                        List.of(kind),
                        List.of(),
                        matches.size() + " records in '" + kind + "' at "
                                + matches.stream().map(r -> String.valueOf(r.location())).toList()
                                + "; using the first"));
            }
            matches.get(0).attributes().forEach((attribute, value) -> contributions
                    .computeIfAbsent(attribute, k -> new ArrayList<>())
                    .add(new KindValue(kind, value)));
        }

        if (!missing.isEmpty()) {
            List<String> sortedMissing = missing.stream().sorted().toList();
            issues.add(0, new ReconciliationIssue(
                    IssueKind.ORPHAN_IDENTIFIER,
                    identifier,
                    null,
                    sortedMissing,
                    List.of(),
                    "Identifier missing from " + sortedMissing));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        Map<String, List<KindValue>> conflicts = new LinkedHashMap<>();
        contributions.forEach((attribute, values) -> {
            List<KindValue> present = values.stream().filter(v -> v.value() != null).toList();
            attributes.put(attribute, present.isEmpty() ? null : present.get(0).value());
            if (hasDisagreement(present)) {
                conflicts.put(attribute, present);
                issues.add(new ReconciliationIssue(
                        IssueKind.CONFLICT,
                        identifier,
                        attribute,
                        present.stream().map(KindValue::tableKind).toList(),
                        present,
                        "Values disagree; kept " + present.get(0) + ", rejected "
                                + present.subList(1, present.size())));
            }
        });

        return new ReconciledRecord(identifier, attributes, presentIn, conflicts, children, issues);
    }

    private static boolean hasDisagreement(List<KindValue> values) {
        Set<Object> distinct = new LinkedHashSet<>();
        for (KindValue value : values) {
            distinct.add(normalize(value.value()));
        }
        return distinct.size() > 1;
    }

    private static Object normalize(Object value) {
        if (value instanceof Number number && !(value instanceof Double) && !(value instanceof Float)) {
            return number.doubleValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof String s) {
            return s.trim();
        }
        return value;
    }

    private static long count(List<ReconciliationIssue> issues, IssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).count();
    }
}
