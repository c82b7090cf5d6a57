package com.ledgerlens.backend.services.statements.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class AmountParserTest {

    @Test
    void currencySymbolAndThousandsSeparator_areStripped() {
        assertEquals(Optional.of(new BigDecimal("1234.56")), AmountParser.parse("$1,234.56"));
        assertEquals(Optional.of(new BigDecimal("1234.56")), AmountParser.parse("€ 1.234,56"));
    }

    @Test
    void abbreviatedCurrencyPrefix_dotIsNotTheDecimalPoint() {
        assertEquals(Optional.of(new BigDecimal("500")), AmountParser.parse("Rs. 500"));
        assertEquals(Optional.of(new BigDecimal("1250.00")), AmountParser.parse("Rs.1,250.00"));
        assertEquals(Optional.of(new BigDecimal("1250")), AmountParser.parse("Rs. 1,250"));
    }

    @Test
    void currencyCodesAndDrCrSuffixes_areStripped() {
        assertEquals(Optional.of(new BigDecimal("12.00")), AmountParser.parse("12.00 EUR"));
        assertEquals(Optional.of(new BigDecimal("-12.00")), AmountParser.parse("USD -12.00"));
        assertEquals(Optional.of(new BigDecimal("300.00")), AmountParser.parse("300.00 Dr."));
        assertEquals(Optional.of(new BigDecimal("300.00")), AmountParser.parse("300.00CR"));
    }

    @Test
    void parenthesesAndTrailingMinus_meanNegative() {
        assertEquals(Optional.of(new BigDecimal("-25.00")), AmountParser.parse("(25.00)"));
        assertEquals(Optional.of(new BigDecimal("-25.00")), AmountParser.parse("25.00-"));
        assertEquals(Optional.of(new BigDecimal("-4.50")), AmountParser.parse(" -4.50 "));
    }

    @Test
    void singleCommaWithTwoDecimals_isDecimalSeparator() {
        assertEquals(Optional.of(new BigDecimal("12.50")), AmountParser.parse("12,50"));
        assertEquals(Optional.of(new BigDecimal("12500")), AmountParser.parse("12,500"));
    }

    @Test
    void numbersPassThrough() {
        assertEquals(Optional.of(BigDecimal.valueOf(42)), AmountParser.parse(42));
        assertEquals(Optional.of(new BigDecimal("3.25")), AmountParser.parse(3.25d));
    }

    @Test
    void blankCells_areEmpty() {
        assertEquals(Optional.empty(), AmountParser.parse(null));
        assertEquals(Optional.empty(), AmountParser.parse("  "));
        assertEquals(Optional.empty(), AmountParser.parse("NaN"));
    }

    @Test
    void text_isNotAnAmount() {
        assertThrows(NumberFormatException.class, () -> AmountParser.parse("pending"));
        assertFalse(AmountParser.isAmount("DR"));
        assertTrue(AmountParser.isAmount("1,000.00"));
    }
}
