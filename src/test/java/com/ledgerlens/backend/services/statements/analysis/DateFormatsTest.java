package com.ledgerlens.backend.services.statements.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class DateFormatsTest {

    @Test
    void strftime_isTranslated() {
        assertEquals("d/M/uuuu", DateFormats.fromStrftime("%d/%m/%Y"));
        assertEquals("uuuuMMdd", DateFormats.fromStrftime("%Y%m%d"));
        assertEquals("d MMM uuuu", DateFormats.fromStrftime("%d %b %Y"));
    }

    @Test
    void strftime_andJavaPatterns_parseTheSameDate() {
        LocalDate expected = LocalDate.of(2024, 1, 15);

        assertEquals(expected, DateFormats.parse("15/01/2024", DateFormats.formatter("%d/%m/%Y")).orElseThrow());
        assertEquals(expected, DateFormats.parse("15/01/2024", DateFormats.formatter("dd/MM/yyyy")).orElseThrow());
        assertEquals(expected, DateFormats.parse("15-JAN-2024", DateFormats.formatter("%d-%b-%Y")).orElseThrow());
    }

    @Test
    void impossibleDates_doNotParse() {
        assertTrue(DateFormats.parse("31/02/2024", DateFormats.formatter("dd/MM/yyyy")).isEmpty());
        assertTrue(DateFormats.parse("01/15/2024", DateFormats.formatter("dd/MM/yyyy")).isEmpty());
    }

    @Test
    void temporalCells_passThrough() {
        LocalDateTime dt = LocalDateTime.of(2024, 3, 1, 10, 30);

        assertEquals(LocalDate.of(2024, 3, 1), DateFormats.parse(dt, DateFormats.formatter("yyyy-MM-dd")).orElseThrow());
    }

    @Test
    void unknownDirective_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> DateFormats.formatter("%Q/%m"));
    }
}
