package com.ledgerlens.backend.services.statements.schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.exceptions.SchemaViolationException;
import com.ledgerlens.backend.services.statements.model.CategorizedTransaction;
import com.ledgerlens.backend.services.statements.model.CellValues;

/**
 * Last step of every processor: coerces results into {@link FinalTable}.
 *
 * <p>Required fields are description, transaction_date and amount; a missing or
 * unconvertible value fails the whole table. Category defaults to "Uncategorized" and
 * sub-category to the empty string. Amounts are scaled to two decimals. Extra columns in
 * untyped records are ignored.</p>
 */
@Component
public class SchemaGuard {

    public FinalTable enforce(List<CategorizedTransaction> rows) {
        if (rows == null) {
            throw new SchemaViolationException(null, null, "processor returned no table");
        }
        List<FinalRow> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            CategorizedTransaction tx = rows.get(i);
            if (tx == null) {
                throw new SchemaViolationException(null, i, "row is missing");
            }
            out.add(toRow(i, tx.description(), tx.transactionDate(), tx.amount(), tx.category(), tx.subCategory()));
        }
        return new FinalTable(out);
    }

    /**
     * Variant for untyped intermediate results keyed by column name.
     */
    public FinalTable enforceRecords(List<? extends Map<String, ?>> records) {
        if (records == null) {
            throw new SchemaViolationException(null, null, "processor returned no table");
        }
        List<FinalRow> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            Map<String, ?> record = records.get(i);
            if (record == null) {
                throw new SchemaViolationException(null, i, "row is missing");
            }
            Object description = required(record, "description", i);
            LocalDate date = toDate(required(record, "transaction_date", i), i);
            BigDecimal amount = toAmount(required(record, "amount", i), i);
            Object category = record.get("category");
            Object sub = record.get("sub_category");
            out.add(toRow(i, description.toString(), date, amount,
                    category == null ? null : category.toString(),
                    sub == null ? null : sub.toString()));
        }
        return new FinalTable(out);
    }

    private static FinalRow toRow(int index, String description, LocalDate date, BigDecimal amount,
                                  String category, String subCategory) {
        if (description == null) {
            throw new SchemaViolationException("description", index, "is missing");
        }
        if (date == null) {
            throw new SchemaViolationException("transaction_date", index, "is missing");
        }
        if (amount == null) {
            throw new SchemaViolationException("amount", index, "is missing");
        }
        String cat = category == null || category.isBlank() ? CategorizedTransaction.UNCATEGORIZED : category.trim();
        String sub = subCategory == null ? "" : subCategory.trim();
        return new FinalRow(description.trim(), date, amount.setScale(2, RoundingMode.HALF_UP), cat, sub);
    }

    private static Object required(Map<String, ?> record, String column, int index) {
        if (!record.containsKey(column)) {
            throw new SchemaViolationException(column, index, "is missing");
        }
        Object value = record.get(column);
        if (value == null) {
            throw new SchemaViolationException(column, index, "is null");
        }
        return value;
    }

    private static LocalDate toDate(Object value, int index) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        if (value instanceof java.sql.Date sqlDate) return sqlDate.toLocalDate();
        if (value instanceof Date date) return date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate();
        String text = CellValues.text(value);
        try {
            return text.length() > 10 ? LocalDateTime.parse(text).toLocalDate() : LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new SchemaViolationException("transaction_date", index, "is not a date: '" + text + "'");
        }
    }

    private static BigDecimal toAmount(Object value, int index) {
        if (value instanceof BigDecimal bd) return bd;
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SchemaViolationException("amount", index, "is not a number: '" + value + "'");
        }
    }
}
