package io.seqwarehouse.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One untyped source record: raw column name to scalar ({@link String}, {@link Number},
 * {@link java.time.temporal.Temporal}, {@link Boolean}, or {@code null} for blank). Column order
 * is preserved for diagnostics only.
 *
 * <p>
 * A row the loader could not fully parse still arrives here, with {@link #parseIssue()} set.
 */
public final class RawRow {

    private final Map<String, Object> values;
    private final SourceLocation location;
    private final String parseIssue;

    public RawRow(Map<String, Object> values, SourceLocation location, String parseIssue) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.location = location;
        this.parseIssue = parseIssue;
    }

    public RawRow(Map<String, Object> values, SourceLocation location) {
        this(values, location, null);
    }

    /** Whether the row has a column with exactly this name (blank values included). */
    public boolean has(String column) {
        return values.containsKey(column);
    }

    /** The raw value, or {@code null} if the column is absent or blank. */
    public Object get(String column) {
        return values.get(column);
    }

    public Map<String, Object> values() {
        return values;
    }

    public SourceLocation location() {
        return location;
    }

    /** Description of a parse problem, or {@code null} if the row parsed cleanly. */
    public String parseIssue() {
        return parseIssue;
    }

    /** Returns a copy with an extra column, appended after the existing ones. */
    public RawRow with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new RawRow(copy, location, parseIssue);
    }

    /** True when every value is null or blank text. */
    public boolean isBlank() {
        for (Object value : values.values()) {
            if (value instanceof String s) {
                if (!s.isBlank()) {
                    return false;
                }
            } else if (value != null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "RawRow[" + location + ", " + values + (parseIssue != null ? ", issue=" + parseIssue : "") + "]";
    }
}
