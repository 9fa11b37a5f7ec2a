package io.seqwarehouse.core.reconcile;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ranks table kinds when their values for the same attribute disagree. An entry ranks a kind that
 * equals it, a kind named {@code <entry>-...} (so {@code sequence} covers
 * {@code sequence-bamstats}), or a kind whose category equals it. Kinds matching no entry rank
 * after all listed ones, alphabetically, so the outcome never depends on input order.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class TablePrecedence {

    /** Experimental records outrank sample records, which outrank sequencing summaries. */
    public static final List<String> DEFAULT_ORDER = List.of("experimental", "sample", "sequence");

    private final List<String> order;

    private TablePrecedence(List<String> order) {
        this.order = order;
    }

    public static TablePrecedence defaults() {
        return new TablePrecedence(DEFAULT_ORDER);
    }

    /**
     * Creates a precedence from highest to lowest.
     *
     * @throws IllegalArgumentException if an entry is blank or repeated
     */
    public static TablePrecedence of(List<String> order) {
        Objects.requireNonNull(order, "order must not be null");
        List<String> normalized = order.stream().map(s -> s.trim().toLowerCase(Locale.ROOT)).toList();
        if (normalized.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Precedence entries must not be blank: " + order);
        }
        if (normalized.stream().distinct().count() != normalized.size()) {
            throw new IllegalArgumentException("Precedence entries must be unique: " + order);
        }
        return new TablePrecedence(normalized);
    }

    public List<String> order() {
        return order;
    }

    /** Position of a kind in the order, or {@code order().size()} if no entry matches. */
    public int rank(String kind, String category) {
        String k = kind.toLowerCase(Locale.ROOT);
        for (int i = 0; i < order.size(); i++) {
            String entry = order.get(i);
            if (k.equals(entry) || k.startsWith(entry + "-")) {
                return i;
            }
        }
        if (category != null) {
            int byCategory = order.indexOf(category.toLowerCase(Locale.ROOT));
            if (byCategory >= 0) {
                return byCategory;
            }
        }
        return order.size();
    }

    /** Orders kinds from highest to lowest precedence; ties break alphabetically. */
    public Comparator<String> comparator(Function<String, String> categoryOf) {
        return Comparator.<String>comparingInt(kind -> rank(kind, categoryOf.apply(kind)))
                .thenComparing(Comparator.naturalOrder());
    }

    @Override
    public String toString() {
        return String.join(" > ", order);
    }
}
