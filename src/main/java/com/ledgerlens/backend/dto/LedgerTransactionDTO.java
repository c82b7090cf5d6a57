package com.ledgerlens.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record LedgerTransactionDTO(
        UUID id,
        String description,
        LocalDate transactionDate,
        BigDecimal amount,
        String category,
        String subCategory
) {
}
