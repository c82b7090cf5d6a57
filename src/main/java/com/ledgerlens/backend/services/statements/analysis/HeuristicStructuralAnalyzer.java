package com.ledgerlens.backend.services.statements.analysis;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.statements.extraction.AmountParser;
import com.ledgerlens.backend.services.statements.model.AmountLayout;
import com.ledgerlens.backend.services.statements.model.CellValues;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic structure discovery from header names and cell contents.
 *
 * <p>The date column is the one whose sampled values best parse under one of
 * {@link DateFormats#CANDIDATE_PATTERNS}. Amounts are recognised by header keywords first
 * (debit/credit pairs, then amount plus an optional type column), then by falling back to
 * the first fully numeric column that is not a balance.</p>
 */
@Slf4j
@Component
public class HeuristicStructuralAnalyzer implements StructuralAnalyzer {

    private static final double MIN_DATE_HIT_RATIO = 0.8;

    private static final List<String> DEBIT_HEADER_HINTS = List.of("debit", "withdraw", "paid out", "money out", "outflow");
    private static final List<String> CREDIT_HEADER_HINTS = List.of("credit", "deposit", "paid in", "money in", "inflow");
    private static final List<String> AMOUNT_HEADER_HINTS = List.of("amount", "amt", "value", "sum");
    private static final List<String> TYPE_HEADER_HINTS = List.of("type", "dr/cr", "cr/dr", "indicator", "direction");

    static final Set<String> DEBIT_TOKENS = Set.of("dr", "debit", "d", "db", "dbt", "withdrawal", "out", "expense", "-");
    static final Set<String> CREDIT_TOKENS = Set.of("cr", "credit", "c", "crd", "deposit", "in", "income", "+");

    @Override
    public StructuralInfo analyze(RawFrame sample) {
        if (sample == null || sample.isEmpty()) {
            throw new StructuralDiscoveryException("input has no rows");
        }

        DateGuess date = guessDate(sample)
                .orElseThrow(() -> new StructuralDiscoveryException("no column holds parseable dates in "
                        + sample.columnNames()));

        List<String> remaining = new ArrayList<>(sample.columnNames());
        remaining.remove(date.column());

        AmountLayout layout = guessAmount(sample, remaining)
                .orElseThrow(() -> new StructuralDiscoveryException("no amount column found in " + remaining));

        log.info("[StructuralAnalysis] heuristic: date={} ({}), amounts={}",
                date.column(), date.pattern(), layout.representation().wireName());
        return new StructuralInfo(date.column(), date.pattern(), layout);
    }

    private Optional<DateGuess> guessDate(RawFrame sample) {
        DateGuess best = null;
        for (String column : sample.columnNames()) {
            List<Object> values = nonBlank(sample.column(column));
            if (values.isEmpty()) continue;

            DateGuess candidate = scoreDateColumn(column, values);
            if (candidate == null || candidate.ratio() < MIN_DATE_HIT_RATIO) continue;

            if (best == null || candidate.ratio() > best.ratio()
                    || (candidate.ratio() == best.ratio() && candidate.headerHint() > best.headerHint())) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private DateGuess scoreDateColumn(String column, List<Object> values) {
        int hint = dateHeaderHint(column);
        if (values.stream().allMatch(DateFormats::isTemporal)) {
            return new DateGuess(column, "yyyy-MM-dd", 1.0, hint);
        }
        DateGuess best = null;
        for (String pattern : DateFormats.CANDIDATE_PATTERNS) {
            DateTimeFormatter formatter = DateFormats.formatter(pattern);
            long hits = values.stream().filter(v -> DateFormats.parse(v, formatter).isPresent()).count();
            double ratio = (double) hits / values.size();
            if (best == null || ratio > best.ratio()) {
                best = new DateGuess(column, pattern, ratio, hint);
            }
            if (ratio == 1.0) break;
        }
        return best;
    }

    private static int dateHeaderHint(String column) {
        String h = header(column);
        if (h.equals("date") || h.contains("transaction date") || h.contains("txn date")) return 2;
        return h.contains("date") ? 1 : 0;
    }

    private Optional<AmountLayout> guessAmount(RawFrame sample, List<String> columns) {
        String debit = firstHeaderMatch(columns, DEBIT_HEADER_HINTS, Set.of("dr"));
        String credit = firstHeaderMatch(columns, CREDIT_HEADER_HINTS, Set.of("cr"));
        if (debit != null && credit != null && !debit.equals(credit)) {
            return Optional.of(new AmountLayout.DualColumn(debit, credit));
        }

        String amount = null;
        for (String column : columns) {
            String h = header(column);
            if (h.contains("balance")) continue;
            if (AMOUNT_HEADER_HINTS.stream().anyMatch(h::contains) && numericShare(sample.column(column)) > 0.5) {
                amount = column;
                break;
            }
        }
        if (amount == null) {
            for (String column : columns) {
                if (header(column).contains("balance")) continue;
                if (numericShare(sample.column(column)) == 1.0) {
                    amount = column;
                    break;
                }
            }
        }
        if (amount == null) {
            return Optional.empty();
        }

        List<String> others = new ArrayList<>(columns);
        others.remove(amount);
        Optional<AmountLayout> typed = guessTypeIndicator(sample, amount, others);
        if (typed.isPresent()) {
            return typed;
        }
        return Optional.of(new AmountLayout.SignedColumn(amount));
    }

    private Optional<AmountLayout> guessTypeIndicator(RawFrame sample, String amountColumn, List<String> columns) {
        List<String> ordered = new ArrayList<>();
        for (String column : columns) {
            if (TYPE_HEADER_HINTS.stream().anyMatch(header(column)::contains)) ordered.add(column);
        }
        for (String column : columns) {
            if (!ordered.contains(column)) ordered.add(column);
        }

        for (String column : ordered) {
            Set<String> distinct = new LinkedHashSet<>();
            for (Object v : nonBlank(sample.column(column))) {
                distinct.add(CellValues.text(v));
            }
            if (distinct.isEmpty() || distinct.size() > 4) continue;

            String debitId = null;
            String creditId = null;
            boolean allKnown = true;
            for (String value : distinct) {
                String token = value.toLowerCase(Locale.ROOT);
                if (DEBIT_TOKENS.contains(token)) {
                    if (debitId == null) debitId = value;
                } else if (CREDIT_TOKENS.contains(token)) {
                    if (creditId == null) creditId = value;
                } else {
                    allKnown = false;
                    break;
                }
            }
            if (!allKnown) continue;
            return Optional.of(new AmountLayout.TypeIndicator(amountColumn, column,
                    debitId != null ? debitId : "DR",
                    creditId != null ? creditId : "CR"));
        }
        return Optional.empty();
    }

    private static String firstHeaderMatch(List<String> columns, List<String> hints, Set<String> exact) {
        for (String column : columns) {
            String h = header(column);
            if (h.contains("balance")) continue;
            if (exact.contains(h) || hints.stream().anyMatch(h::contains)) {
                return column;
            }
        }
        return null;
    }

    private static double numericShare(List<Object> values) {
        List<Object> present = nonBlank(values);
        if (present.isEmpty()) return 0.0;
        long numeric = present.stream().filter(AmountParser::isAmount).count();
        return (double) numeric / present.size();
    }

    private static List<Object> nonBlank(List<Object> values) {
        List<Object> out = new ArrayList<>();
        for (Object v : values) {
            if (!CellValues.isBlank(v)) out.add(v);
        }
        return out;
    }

    private static String header(String column) {
        return column.toLowerCase(Locale.ROOT).replace('_', ' ').trim();
    }

    private record DateGuess(String column, String pattern, double ratio, int headerHint) {
    }
}
