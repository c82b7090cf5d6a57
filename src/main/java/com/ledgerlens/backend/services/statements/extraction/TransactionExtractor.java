package com.ledgerlens.backend.services.statements.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.exceptions.RowExtractionException;
import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.statements.analysis.DateFormats;
import com.ledgerlens.backend.services.statements.model.AmountLayout;
import com.ledgerlens.backend.services.statements.model.CellValues;
import com.ledgerlens.backend.services.statements.model.NormalizedTransaction;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.RowIssue;
import com.ledgerlens.backend.services.statements.model.SemanticMapping;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns every input row into (description, date, signed amount). Rows whose date or
 * amount cannot be read are dropped and reported; they never abort the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionExtractor {

    static final String DESCRIPTION_SEPARATOR = " | ";

    private final ImportProperties properties;

    public ExtractionResult extract(RawFrame frame, StructuralInfo info, SemanticMapping mapping) {
        DateTimeFormatter formatter;
        try {
            formatter = DateFormats.formatter(info.dateFormat());
        } catch (IllegalArgumentException e) {
            throw new StructuralDiscoveryException("invalid date format '" + info.dateFormat() + "'", e);
        }

        List<String> fallbackColumns = mapping.hasDescriptionColumn()
                ? List.of()
                : textualColumns(frame, info.consumedColumns());

        List<NormalizedTransaction> rows = new ArrayList<>(frame.rowCount());
        List<RowIssue> dropped = new ArrayList<>();
        List<RowIssue> warnings = new ArrayList<>();
        Map<DuplicateKey, Integer> seen = new HashMap<>();

        for (int r = 0; r < frame.rowCount(); r++) {
            try {
                LocalDate date = readDate(frame, r, info.dateColumn(), formatter);
                BigDecimal amount = readAmount(frame, r, info.amount(), warnings);
                String description = describe(frame, r, mapping, fallbackColumns);
                rows.add(new NormalizedTransaction(r, description, date, amount));

                Integer first = seen.putIfAbsent(new DuplicateKey(date, amount.stripTrailingZeros(), description), r);
                if (first != null) {
                    warnings.add(new RowIssue(r, "possible duplicate of row " + first));
                }
            } catch (RowExtractionException e) {
                dropped.add(new RowIssue(r, e.getMessage()));
            }
        }

        if (!dropped.isEmpty()) {
            log.warn("[Extraction] dropped {} of {} rows (first: {})", dropped.size(), frame.rowCount(),
                    dropped.get(0).message());
        }
        log.info("[Extraction] extracted {} rows, {} warnings", rows.size(), warnings.size());
        return new ExtractionResult(rows, dropped, warnings, frame.rowCount());
    }

    private static LocalDate readDate(RawFrame frame, int row, String column, DateTimeFormatter formatter) {
        Object raw = frame.value(column, row);
        if (CellValues.isBlank(raw)) {
            throw new RowExtractionException(row, "missing date");
        }
        return DateFormats.parse(raw, formatter)
                .orElseThrow(() -> new RowExtractionException(row, "unparseable date '" + raw + "'"));
    }

    private static BigDecimal readAmount(RawFrame frame, int row, AmountLayout layout, List<RowIssue> warnings) {
        if (layout instanceof AmountLayout.DualColumn dual) {
            BigDecimal debit = parseOrZero(frame, row, dual.debitColumn());
            BigDecimal credit = parseOrZero(frame, row, dual.creditColumn());
            if (debit.signum() < 0 || credit.signum() < 0) {
                warnings.add(new RowIssue(row, "negative value in a debit/credit column; taken as credit minus debit"));
            }
            if (debit.signum() != 0 && credit.signum() != 0) {
                warnings.add(new RowIssue(row, "both debit and credit populated; amounts netted"));
            }
            return credit.subtract(debit);
        }
        if (layout instanceof AmountLayout.SignedColumn signed) {
            return parseRequired(frame, row, signed.amountColumn());
        }
        AmountLayout.TypeIndicator typed = (AmountLayout.TypeIndicator) layout;
        BigDecimal magnitude = parseRequired(frame, row, typed.amountColumn()).abs();
        String indicator = CellValues.text(frame.value(typed.typeColumn(), row));
        return switch (direction(indicator, typed)) {
            case DEBIT -> magnitude.negate();
            case CREDIT -> magnitude;
            case UNKNOWN -> throw new RowExtractionException(row, "unrecognized type indicator '" + indicator + "'");
        };
    }

    private static Direction direction(String indicator, AmountLayout.TypeIndicator typed) {
        if (indicator.isEmpty()) return Direction.UNKNOWN;
        String debitId = typed.debitIdentifier().trim();
        String creditId = typed.creditIdentifier().trim();
        if (indicator.equalsIgnoreCase(debitId)) return Direction.DEBIT;
        if (indicator.equalsIgnoreCase(creditId)) return Direction.CREDIT;

        String lower = indicator.toLowerCase(Locale.ROOT);
        boolean debit = lower.contains(debitId.toLowerCase(Locale.ROOT));
        boolean credit = lower.contains(creditId.toLowerCase(Locale.ROOT));
        if (debit && !credit) return Direction.DEBIT;
        if (credit && !debit) return Direction.CREDIT;
        return Direction.UNKNOWN;
    }

    private static BigDecimal parseOrZero(RawFrame frame, int row, String column) {
        try {
            return AmountParser.parse(frame.value(column, row)).orElse(BigDecimal.ZERO);
        } catch (NumberFormatException e) {
            throw new RowExtractionException(row, "unparseable amount in '" + column + "': " + e.getMessage());
        }
    }

    private static BigDecimal parseRequired(RawFrame frame, int row, String column) {
        try {
            return AmountParser.parse(frame.value(column, row))
                    .orElseThrow(() -> new RowExtractionException(row, "missing amount in '" + column + "'"));
        } catch (NumberFormatException e) {
            throw new RowExtractionException(row, "unparseable amount in '" + column + "': " + e.getMessage());
        }
    }

    private String describe(RawFrame frame, int row, SemanticMapping mapping, List<String> fallbackColumns) {
        String text;
        if (mapping.hasDescriptionColumn()) {
            text = CellValues.text(frame.value(mapping.descriptionColumn(), row));
        } else {
            List<String> parts = new ArrayList<>();
            for (String column : fallbackColumns) {
                String v = CellValues.text(frame.value(column, row));
                if (!v.isEmpty()) parts.add(v);
            }
            text = String.join(DESCRIPTION_SEPARATOR, parts);
        }
        int max = properties.descriptionMaxLength();
        if (text.codePointCount(0, text.length()) <= max) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, max));
    }

    // Columns with at least one non-numeric value, in input order.
    static List<String> textualColumns(RawFrame frame, Set<String> consumed) {
        List<String> out = new ArrayList<>();
        for (String column : frame.columnNames()) {
            if (consumed.contains(column)) continue;
            for (Object v : frame.column(column)) {
                if (!CellValues.isBlank(v) && !AmountParser.isAmount(v)) {
                    out.add(column);
                    break;
                }
            }
        }
        return out;
    }

    private enum Direction { DEBIT, CREDIT, UNKNOWN }

    private record DuplicateKey(LocalDate date, BigDecimal amount, String description) {
    }
}
