package com.ledgerlens.backend.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ledgerlens.backend.config.ImportProperties.ProcessingMode;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw statement as ordered columns, e.g. {@code {"columns": {"Date": [...], "Amount": [...]}}}.
 */
@Data
@NoArgsConstructor
public class ImportRequestDTO {

    @NotEmpty
    private LinkedHashMap<String, List<Object>> columns;

    // falls back to ledger.import.mode
    private ProcessingMode mode;

    public Map<String, List<Object>> columnsOrEmpty() {
        return columns == null ? Map.of() : columns;
    }
}
