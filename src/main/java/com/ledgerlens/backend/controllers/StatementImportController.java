package com.ledgerlens.backend.controllers;

import java.util.ArrayList;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerlens.backend.dto.ApiResponse;
import com.ledgerlens.backend.dto.ImportRequestDTO;
import com.ledgerlens.backend.exceptions.BadRequestException;
import com.ledgerlens.backend.services.imports.ImportReport;
import com.ledgerlens.backend.services.imports.StatementImportService;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.RowIssue;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
@Slf4j
public class StatementImportController {

    private final StatementImportService statementImportService;

    @PostMapping
    public ResponseEntity<ApiResponse<ImportReport>> importStatement(@Valid @RequestBody ImportRequestDTO request) {
        RawFrame frame = toFrame(request);
        ImportReport report = statementImportService.importStatement(frame, request.getMode(),
                (fraction, message) -> log.debug("[StatementImport] {}% {}", Math.round(fraction * 100), message));

        String message = report.fullyStored() ? "Statement imported" : "Statement imported with errors";
        return ResponseEntity.status(201).body(ApiResponse.success(report, message, rowWarnings(report)));
    }

    private static RawFrame toFrame(ImportRequestDTO request) {
        try {
            return RawFrame.of(request.columnsOrEmpty());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid statement frame: " + e.getMessage(), e);
        }
    }

    private static List<String> rowWarnings(ImportReport report) {
        List<String> out = new ArrayList<>();
        for (RowIssue issue : report.pipeline().droppedRows()) {
            out.add("row " + issue.rowIndex() + " dropped: " + issue.message());
        }
        for (RowIssue issue : report.pipeline().warnings()) {
            out.add("row " + issue.rowIndex() + ": " + issue.message());
        }
        return out;
    }
}
