package io.seqwarehouse.core.validate;

import io.seqwarehouse.core.model.FieldSpec;
import io.seqwarehouse.core.model.IssueKind;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/** Converts raw scalars into the declared datatype of a field. */
final class ValueCoercer {

    /**
     * Result of one conversion: either a typed value or a failure kind with a description.
     *
     * @param value   typed value, {@code null} on failure
     * @param failure issue kind on failure, otherwise {@code null}
     * @param detail  description of the failure
     */
    record Coerced(Object value, IssueKind failure, String detail) {

        static Coerced ok(Object value) {
            return new Coerced(value, null, null);
        }

        static Coerced failed(IssueKind kind, String detail) {
            return new Coerced(null, kind, detail);
        }

        boolean failed() {
            return failure != null;
        }
    }

    private ValueCoercer() {}

    /** True for {@code null} and whitespace-only text. */
    static boolean isBlank(Object raw) {
        return raw == null || (raw instanceof String s && s.isBlank());
    }

    /** Converts a non-blank raw value. */
    static Coerced coerce(Object raw, FieldSpec field) {
        switch (field.dataType()) {
            case STR:
                return Coerced.ok(asText(raw));
            case INT:
                return toLong(raw, field);
            case FLOAT:
                return toDouble(raw, field);
            case DATE:
                return toDate(raw, field);
            default:
                throw new IllegalStateException("Unhandled datatype " + field.dataType());
        }
    }

    /** Canonical text of a raw value; integral spreadsheet numbers lose their {@code .0}. */
    static String asText(Object raw) {
        if (raw instanceof String s) {
            return s.trim();
        }
        if (raw instanceof Double d && isIntegral(d)) {
            return Long.toString(d.longValue());
        }
        if (raw instanceof Float f && isIntegral(f.doubleValue())) {
            return Long.toString(f.longValue());
        }
        return raw.toString();
    }

    private static Coerced toLong(Object raw, FieldSpec field) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return Coerced.ok(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            return isIntegral(d) && Math.abs(d) < 9.0e18
                    ? Coerced.ok((long) d)
                    : mismatch(raw, field, "integer");
        }
        if (raw instanceof BigInteger || raw instanceof BigDecimal || raw instanceof String) {
            try {
                BigDecimal decimal = raw instanceof BigInteger big ? new BigDecimal(big) : new BigDecimal(asText(raw));
                return Coerced.ok(decimal.longValueExact());
            } catch (NumberFormatException | ArithmeticException e) {
                return mismatch(raw, field, "integer");
            }
        }
        return mismatch(raw, field, "integer");
    }

    private static Coerced toDouble(Object raw, FieldSpec field) {
        if (raw instanceof Number number && !(raw instanceof BigDecimal) && !(raw instanceof BigInteger)) {
            return Coerced.ok(number.doubleValue());
        }
        if (raw instanceof BigDecimal || raw instanceof BigInteger || raw instanceof String) {
            try {
                return Coerced.ok(new BigDecimal(asText(raw)).doubleValue());
            } catch (NumberFormatException e) {
                return mismatch(raw, field, "number");
            }
        }
        return mismatch(raw, field, "number");
    }

    private static Coerced toDate(Object raw, FieldSpec field) {
        if (raw instanceof LocalDate date) {
            return Coerced.ok(date);
        }
        if (raw instanceof LocalDateTime dateTime) {
            return Coerced.ok(dateTime.toLocalDate());
        }
        String text = asText(raw);
        try {
            return Coerced.ok(DateFormats.parse(text, field.dateFormat()));
        } catch (DateTimeParseException e) {
            return Coerced.failed(
                    IssueKind.DATE_FORMAT_MISMATCH,
                    "'" + text + "' does not match date format '" + field.dateFormat() + "'");
        }
    }

    private static Coerced mismatch(Object raw, FieldSpec field, String expected) {
        return Coerced.failed(
                IssueKind.TYPE_MISMATCH,
                "'" + raw + "' is not a valid " + expected + " for " + field.dataType().descriptorName());
    }

    private static boolean isIntegral(double d) {
        return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d);
    }
}
