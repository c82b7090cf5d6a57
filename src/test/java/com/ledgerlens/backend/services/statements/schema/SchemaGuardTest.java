package com.ledgerlens.backend.services.statements.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.exceptions.PipelineStage;
import com.ledgerlens.backend.exceptions.SchemaViolationException;
import com.ledgerlens.backend.services.statements.model.CategorizedTransaction;

class SchemaGuardTest {

    private final SchemaGuard guard = new SchemaGuard();

    @Test
    void enforce_fillsDefaults_andScalesAmounts() {
        FinalTable table = guard.enforce(List.of(
                new CategorizedTransaction(0, " Coffee ", LocalDate.of(2024, 1, 15), new BigDecimal("-4.5"), null, null),
                new CategorizedTransaction(1, "Rent", LocalDate.of(2024, 1, 16), new BigDecimal("1200.005"), "Housing", " Rent ")));

        assertEquals(FinalTable.COLUMNS, table.columns());
        assertEquals(2, table.size());

        FinalRow first = table.row(0);
        assertEquals("Coffee", first.description());
        assertEquals(new BigDecimal("-4.50"), first.amount());
        assertEquals("Uncategorized", first.category());
        assertEquals("", first.subCategory());

        FinalRow second = table.row(1);
        assertEquals(new BigDecimal("1200.01"), second.amount());
        assertEquals("Rent", second.subCategory());
    }

    @Test
    void enforce_missingDate_failsTheTable() {
        SchemaViolationException ex = assertThrows(SchemaViolationException.class, () -> guard.enforce(List.of(
                new CategorizedTransaction(0, "Coffee", null, BigDecimal.ONE, "Food", ""))));

        assertEquals("transaction_date", ex.getColumn());
        assertEquals(0, ex.getRowIndex());
        assertEquals(PipelineStage.SCHEMA_ENFORCEMENT, ex.getStage());
    }

    @Test
    void enforce_emptyInput_isAnEmptyTable() {
        assertEquals(0, guard.enforce(List.of()).size());
        assertThrows(SchemaViolationException.class, () -> guard.enforce(null));
    }

    @Test
    void enforceRecords_convertsTextAndIgnoresExtraColumns() {
        Map<String, Object> record = new HashMap<>();
        record.put("description", "Salary");
        record.put("transaction_date", "2024-02-01");
        record.put("amount", "2500");
        record.put("balance", "9999.99");

        FinalTable table = guard.enforceRecords(List.of(record));

        FinalRow row = table.row(0);
        assertEquals(LocalDate.of(2024, 2, 1), row.transactionDate());
        assertEquals(new BigDecimal("2500.00"), row.amount());
        assertEquals("Uncategorized", row.category());
    }

    @Test
    void enforceRecords_rejectsMissingAndUnconvertibleValues() {
        Map<String, Object> noAmount = Map.of("description", "x", "transaction_date", "2024-02-01");
        SchemaViolationException missing = assertThrows(SchemaViolationException.class,
                () -> guard.enforceRecords(List.of(noAmount)));
        assertEquals("amount", missing.getColumn());

        Map<String, Object> badDate = Map.of("description", "x", "transaction_date", "yesterday", "amount", "1");
        SchemaViolationException unconvertible = assertThrows(SchemaViolationException.class,
                () -> guard.enforceRecords(List.of(badDate)));
        assertEquals("transaction_date", unconvertible.getColumn());
    }
}
