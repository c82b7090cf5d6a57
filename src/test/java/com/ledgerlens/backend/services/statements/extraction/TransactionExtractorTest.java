package com.ledgerlens.backend.services.statements.extraction;

import static com.ledgerlens.backend.services.statements.model.TestFrames.frame;
import static com.ledgerlens.backend.services.statements.model.TestFrames.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.statements.model.AmountLayout;
import com.ledgerlens.backend.services.statements.model.NormalizedTransaction;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.SemanticMapping;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

class TransactionExtractorTest {

    private final TransactionExtractor extractor = new TransactionExtractor(ImportProperties.defaults());

    @Test
    void dualColumn_debitIsNegative_creditIsPositive() {
        RawFrame frame = frame(List.of("Date", "Description", "Debit", "Credit"),
                row("2024-01-15", "Coffee", "50.00", ""),
                row("2024-01-16", "Salary", "", "1000.00"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.DualColumn("Debit", "Credit"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Description"));

        List<NormalizedTransaction> rows = result.transactions();
        assertEquals(2, rows.size());
        assertEquals(new BigDecimal("-50.00"), rows.get(0).amount());
        assertEquals(new BigDecimal("1000.00"), rows.get(1).amount());
        assertEquals(LocalDate.of(2024, 1, 15), rows.get(0).transactionDate());
        assertEquals("Coffee", rows.get(0).description());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void dualColumn_bothPopulated_isNettedWithWarning() {
        RawFrame frame = frame(List.of("Date", "Description", "Debit", "Credit"),
                row("2024-01-17", "Adjustment", "10.00", "15.00"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.DualColumn("Debit", "Credit"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Description"));

        assertEquals(new BigDecimal("5.00"), result.transactions().get(0).amount());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).message().contains("both debit and credit"));
    }

    @Test
    void dualColumn_negativeCell_isCreditMinusDebitAsGiven() {
        RawFrame frame = frame(List.of("Date", "Description", "Debit", "Credit"),
                row("2024-01-18", "Reversal", "-50.00", ""),
                row("2024-01-19", "Chargeback", "", "-20.00"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.DualColumn("Debit", "Credit"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Description"));

        assertEquals(new BigDecimal("50.00"), result.transactions().get(0).amount());
        assertEquals(new BigDecimal("-20.00"), result.transactions().get(1).amount());
        assertEquals(2, result.warnings().size());
        assertTrue(result.warnings().get(0).message().contains("negative value"));
    }

    @Test
    void signedColumn_acceptsAccountingParentheses() {
        RawFrame frame = frame(List.of("Date", "Memo", "Amount"),
                row("03/02/2024", "Refund fee", "(25.00)"));
        StructuralInfo info = new StructuralInfo("Date", "%d/%m/%Y", new AmountLayout.SignedColumn("Amount"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Memo"));

        NormalizedTransaction tx = result.transactions().get(0);
        assertEquals(new BigDecimal("-25.00"), tx.amount());
        assertEquals(LocalDate.of(2024, 2, 3), tx.transactionDate());
    }

    @Test
    void typeIndicator_signsByIdentifier_andDropsUnreadableRows() {
        RawFrame frame = frame(List.of("Date", "Details", "Amount", "Type"),
                row("2024-01-15", "Coffee", "4.50", "DR"),
                row("2024-01-16", "Salary", "1000", "cr"),
                row("2024-01-17", "Mystery", "3.00", "??"),
                row("2024-13-45", "Bad date", "1.00", "DR"),
                row("2024-01-18", "Bad amount", "n/a", "DR"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd",
                new AmountLayout.TypeIndicator("Amount", "Type", "DR", "CR"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Details"));

        assertEquals(5, result.inputRows());
        assertEquals(2, result.transactions().size());
        assertEquals(new BigDecimal("-4.50"), result.transactions().get(0).amount());
        assertEquals(new BigDecimal("1000"), result.transactions().get(1).amount());

        assertEquals(List.of(2, 3, 4), result.droppedRows().stream().map(r -> r.rowIndex()).toList());
        assertTrue(result.droppedRows().get(0).message().contains("unrecognized type indicator"));
        assertTrue(result.droppedRows().get(1).message().contains("unparseable date"));
        assertTrue(result.droppedRows().get(2).message().contains("unparseable amount"));
    }

    @Test
    void typeIndicator_matchesLongerLabelsContainingTheIdentifier() {
        RawFrame frame = frame(List.of("Date", "Details", "Amount", "Type"),
                row("2024-01-15", "Card", "9.99", "Debit Card"),
                row("2024-01-16", "Refund", "9.99", "Credit Note"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd",
                new AmountLayout.TypeIndicator("Amount", "Type", "Debit", "Credit"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Details"));

        assertEquals(new BigDecimal("-9.99"), result.transactions().get(0).amount());
        assertEquals(new BigDecimal("9.99"), result.transactions().get(1).amount());
    }

    @Test
    void withoutDescriptionColumn_joinsTextualLeftovers() {
        RawFrame frame = frame(List.of("Date", "Amount", "Ref", "Payee", "Notes"),
                row("2024-01-15", "-12.00", "10001", "ACME", "lunch"),
                row("2024-01-16", "-3.00", "10002", "BOB", ""));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.SignedColumn("Amount"));

        ExtractionResult result = extractor.extract(frame, info, SemanticMapping.none());

        assertEquals("ACME | lunch", result.transactions().get(0).description());
        assertEquals("BOB", result.transactions().get(1).description());
    }

    @Test
    void longDescriptions_areTruncated() {
        RawFrame frame = frame(List.of("Date", "Description", "Amount"),
                row("2024-01-15", "x".repeat(600), "1.00"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.SignedColumn("Amount"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Description"));

        assertEquals(500, result.transactions().get(0).description().length());
    }

    @Test
    void truncation_neverSplitsASurrogatePair() {
        String smile = new String(Character.toChars(0x1F600));
        RawFrame frame = frame(List.of("Date", "Description", "Amount"),
                row("2024-01-15", "x".repeat(499) + smile + smile, "1.00"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.SignedColumn("Amount"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Description"));

        String description = result.transactions().get(0).description();
        assertEquals(500, description.codePointCount(0, description.length()));
        assertTrue(description.endsWith(smile));
    }

    @Test
    void repeatedRows_areKeptButFlagged() {
        RawFrame frame = frame(List.of("Date", "Description", "Amount"),
                row("2024-01-15", "Coffee", "-4.50"),
                row("2024-01-15", "Coffee", "-4.5"));
        StructuralInfo info = new StructuralInfo("Date", "yyyy-MM-dd", new AmountLayout.SignedColumn("Amount"));

        ExtractionResult result = extractor.extract(frame, info, new SemanticMapping("Description"));

        assertEquals(2, result.transactions().size());
        assertEquals(1, result.warnings().size());
        assertEquals(1, result.warnings().get(0).rowIndex());
        assertEquals("possible duplicate of row 0", result.warnings().get(0).message());
    }

    @Test
    void invalidDateFormat_isStructural() {
        RawFrame frame = frame(List.of("Date", "Amount"), row("2024-01-15", "1.00"));
        StructuralInfo info = new StructuralInfo("Date", "%Q", new AmountLayout.SignedColumn("Amount"));

        assertThrows(StructuralDiscoveryException.class,
                () -> extractor.extract(frame, info, SemanticMapping.none()));
    }
}
