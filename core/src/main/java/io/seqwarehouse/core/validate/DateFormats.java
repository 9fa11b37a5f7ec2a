package io.seqwarehouse.core.validate;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiles descriptor date formats into strict {@link DateTimeFormatter}s.
 *
 * <p>
 * Formats containing {@code %} are read as {@code strftime} directives ({@code %Y/%m/%d}); any
 * other format is taken as a {@link DateTimeFormatter} pattern ({@code yyyy-MM-dd}). Parsing is
 * strict: {@code 2023/02/30} is rejected rather than adjusted.
 *
 * <p>
 * Thread-safe: compiled formatters are cached.
 */
public final class DateFormats {

    private static final Map<Character, String> DIRECTIVES = Map.ofEntries(
            Map.entry('Y', "yyyy"),
            Map.entry('y', "yy"),
            Map.entry('m', "MM"),
            Map.entry('d', "dd"),
            Map.entry('B', "MMMM"),
            Map.entry('b', "MMM"),
            Map.entry('j', "DDD"),
            Map.entry('A', "EEEE"),
            Map.entry('a', "EEE"),
            Map.entry('H', "HH"),
            Map.entry('I', "hh"),
            Map.entry('M', "mm"),
            Map.entry('S', "ss"),
            Map.entry('p', "a"));

    private static final Map<String, DateTimeFormatter> CACHE = new ConcurrentHashMap<>();

    private DateFormats() {}

    /**
     * Returns the formatter for a descriptor date format.
     *
     * @throws IllegalArgumentException if the format uses an unsupported directive or is not a
     *                                  valid pattern
     */
    public static DateTimeFormatter formatter(String format) {
        return CACHE.computeIfAbsent(format, DateFormats::compile);
    }

    /**
     * Parses text with the given descriptor format.
     *
     * @throws DateTimeParseException if the text does not match
     */
    public static LocalDate parse(String text, String format) {
        return LocalDate.parse(text, formatter(format));
    }

    /** Formats a date with the given descriptor format. */
    public static String format(LocalDate date, String format) {
        return formatter(format).format(date);
    }

    /** Translates a {@code strftime} format into a {@link DateTimeFormatter} pattern. */
    static String toPattern(String format) {
        if (format.indexOf('%') < 0) {
            return format;
        }
        StringBuilder pattern = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= format.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of date format '" + format + "'");
            }
            char directive = format.charAt(++i);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            String mapped = DIRECTIVES.get(directive);
            if (mapped == null) {
                throw new IllegalArgumentException(
                        "Unsupported directive '%" + directive + "' in date format '" + format + "'");
            }
            appendLiteral(pattern, literal);
            pattern.append(mapped);
        }
        appendLiteral(pattern, literal);
        return pattern.toString();
    }

    private static void appendLiteral(StringBuilder pattern, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }

    private static DateTimeFormatter compile(String format) {
        // yyyy is year-of-era; strict resolution needs the era supplied
        return new DateTimeFormatterBuilder()
                .appendPattern(toPattern(format))
                .parseDefaulting(ChronoField.ERA, 1)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
