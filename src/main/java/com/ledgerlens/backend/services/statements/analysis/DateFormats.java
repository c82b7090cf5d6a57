package com.ledgerlens.backend.services.statements.analysis;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.ledgerlens.backend.services.statements.model.CellValues;

/**
 * Date pattern handling. Formats may be given as {@link DateTimeFormatter} patterns
 * ({@code dd/MM/yyyy}) or strftime strings ({@code %d/%m/%Y}); both compile to a strict,
 * case-insensitive English formatter.
 */
public final class DateFormats {

    /** Probed in order by the heuristic analyzer. */
    public static final List<String> CANDIDATE_PATTERNS = List.of(
            "yyyy-MM-dd",
            "dd/MM/yyyy",
            "MM/dd/yyyy",
            "d/M/yyyy",
            "M/d/yyyy",
            "dd-MM-yyyy",
            "MM-dd-yyyy",
            "dd.MM.yyyy",
            "yyyy/MM/dd",
            "dd/MM/yy",
            "MM/dd/yy",
            "dd MMM yyyy",
            "d MMM yyyy",
            "dd-MMM-yyyy",
            "dd-MMM-yy",
            "MMM d, yyyy",
            "yyyyMMdd"
    );

    private DateFormats() {
    }

    /**
     * @throws IllegalArgumentException when the pattern is not a usable date format
     */
    public static DateTimeFormatter formatter(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("date format is blank");
        }
        String javaPattern = pattern.indexOf('%') >= 0 ? fromStrftime(pattern.trim()) : pattern.trim();
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(yearOfEraToProlepticYear(javaPattern))
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses a cell. Temporal values pass through; text is parsed with the formatter.
     */
    public static Optional<LocalDate> parse(Object value, DateTimeFormatter formatter) {
        if (CellValues.isBlank(value)) return Optional.empty();
        if (value instanceof LocalDate d) return Optional.of(d);
        if (value instanceof LocalDateTime dt) return Optional.of(dt.toLocalDate());
        if (value instanceof ZonedDateTime zdt) return Optional.of(zdt.toLocalDate());
        if (value instanceof java.sql.Date sqlDate) return Optional.of(sqlDate.toLocalDate());
        try {
            return Optional.of(LocalDate.parse(value.toString().trim(), formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static boolean isTemporal(Object value) {
        return value instanceof LocalDate || value instanceof LocalDateTime
                || value instanceof ZonedDateTime || value instanceof java.sql.Date;
    }

    /**
     * Translates a strftime format into a {@link DateTimeFormatter} pattern.
     * Day and month directives between separators accept one or two digits.
     */
    public static String fromStrftime(String format) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        boolean prevDirective = false;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c != '%') {
                appendLiteral(out, c);
                prevDirective = false;
                i++;
                continue;
            }
            if (i + 1 >= format.length()) {
                throw new IllegalArgumentException("dangling '%' in date format: " + format);
            }
            char d = format.charAt(i + 1);
            boolean unpadded = false;
            int consumed = 2;
            if (d == '-' || d == '#') {
                if (i + 2 >= format.length()) {
                    throw new IllegalArgumentException("dangling flag in date format: " + format);
                }
                unpadded = true;
                d = format.charAt(i + 2);
                consumed = 3;
            }
            boolean nextDirective = i + consumed < format.length() && format.charAt(i + consumed) == '%';
            boolean flexible = unpadded || (!prevDirective && !nextDirective);
            switch (d) {
                case 'Y' -> out.append("uuuu");
                case 'y' -> out.append("uu");
                case 'm' -> out.append(flexible ? "M" : "MM");
                case 'd' -> out.append(flexible ? "d" : "dd");
                case 'e' -> out.append("d");
                case 'b', 'h' -> out.append("MMM");
                case 'B' -> out.append("MMMM");
                case 'a' -> out.append("EEE");
                case 'A' -> out.append("EEEE");
                case 'H' -> out.append("HH");
                case 'I' -> out.append("hh");
                case 'M' -> out.append("mm");
                case 'S' -> out.append("ss");
                case 'p' -> out.append("a");
                case 'j' -> out.append("DDD");
                case '%' -> out.append('%');
                default -> throw new IllegalArgumentException("unsupported strftime directive %" + d);
            }
            prevDirective = d != '%';
            i += consumed;
        }
        return out.toString();
    }

    private static void appendLiteral(StringBuilder out, char c) {
        if (c == '\'') {
            out.append("''");
        } else if (Character.isLetter(c) || c == '[' || c == ']' || c == '{' || c == '}' || c == '#') {
            out.append('\'').append(c).append('\'');
        } else {
            out.append(c);
        }
    }

    // 'y' needs an era under STRICT resolution; 'u' does not.
    private static String yearOfEraToProlepticYear(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            sb.append(!quoted && c == 'y' ? 'u' : c);
        }
        return sb.toString();
    }
}
