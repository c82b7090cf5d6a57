package com.ledgerlens.backend.controllers;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerlens.backend.dto.ApiResponse;
import com.ledgerlens.backend.dto.LedgerTransactionDTO;
import com.ledgerlens.backend.services.ledger.LedgerQueryService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerQueryService ledgerQueryService;

    @GetMapping("/transactions")
    public ResponseEntity<ApiResponse<List<LedgerTransactionDTO>>> listTransactions() {
        return ResponseEntity.ok(ApiResponse.success(ledgerQueryService.listTransactions(), "Transactions"));
    }

    @GetMapping("/categories")
    public ResponseEntity<ApiResponse<Map<String, List<String>>>> categoryTree() {
        return ResponseEntity.ok(ApiResponse.success(ledgerQueryService.categoryTree(), "Category hierarchy"));
    }
}
