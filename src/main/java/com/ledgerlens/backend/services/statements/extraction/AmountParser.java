package com.ledgerlens.backend.services.statements.extraction;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

import com.ledgerlens.backend.services.statements.model.CellValues;

/**
 * Lenient money parsing for statement cells.
 *
 * <p>Accepts currency symbols and codes ({@code Rs. 500}, {@code 12.00 EUR}), thousands separators (either {@code 1,234.56} or
 * {@code 1.234,56}), leading or trailing minus signs and accounting parentheses
 * ({@code (25.00)} is negative).</p>
 */
public final class AmountParser {

    private static final Pattern CURRENCY_WORD = Pattern.compile("\\p{L}+\\.?");

    private AmountParser() {
    }

    /**
     * @return empty for blank cells
     * @throws NumberFormatException when the cell holds text that is not a number
     */
    public static Optional<BigDecimal> parse(Object value) {
        if (CellValues.isBlank(value)) return Optional.empty();
        if (value instanceof BigDecimal bd) return Optional.of(bd);
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number n) return Optional.of(new BigDecimal(n.toString()));

        String raw = value.toString().trim();
        // "Rs." or "Kr." prefixes and DR/CR suffixes: the abbreviation dot is not a decimal point
        String unlabelled = CURRENCY_WORD.matcher(raw).replaceAll(" ");
        StringBuilder kept = new StringBuilder(unlabelled.length());
        for (char c : unlabelled.toCharArray()) {
            if (Character.isDigit(c) || c == '.' || c == ',' || c == '-' || c == '+' || c == '(' || c == ')') {
                kept.append(c);
            }
        }
        String s = kept.toString();

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }
        if (s.endsWith("-")) {
            negative = !negative;
            s = s.substring(0, s.length() - 1);
        }
        if (s.startsWith("-")) {
            negative = !negative;
            s = s.substring(1);
        } else if (s.startsWith("+")) {
            s = s.substring(1);
        }

        if (s.isEmpty() || !s.chars().allMatch(ch -> Character.isDigit(ch) || ch == '.' || ch == ',')
                || s.chars().noneMatch(Character::isDigit)) {
            throw new NumberFormatException("not an amount: '" + raw + "'");
        }

        BigDecimal parsed = new BigDecimal(normalizeSeparators(s));
        return Optional.of(negative ? parsed.negate() : parsed);
    }

    public static boolean isAmount(Object value) {
        try {
            return parse(value).isPresent();
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String normalizeSeparators(String s) {
        int lastDot = s.lastIndexOf('.');
        int lastComma = s.lastIndexOf(',');

        if (lastDot >= 0 && lastComma >= 0) {
            if (lastDot > lastComma) {
                return s.replace(",", "");
            }
            return s.replace(".", "").replace(',', '.');
        }
        if (lastComma >= 0) {
            boolean single = s.indexOf(',') == lastComma;
            int decimals = s.length() - lastComma - 1;
            if (single && decimals != 3) {
                return s.replace(',', '.');
            }
            return s.replace(",", "");
        }
        if (lastDot >= 0 && s.indexOf('.') != lastDot) {
            return s.replace(".", "");
        }
        return s;
    }
}
