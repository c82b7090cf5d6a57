package com.ledgerlens.backend.services.statements.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.SemanticMapping;

/**
 * Matches leftover column headers against description keywords, most specific keyword first.
 */
@Component
public class HeuristicSemanticMapper implements SemanticMapper {

    static final List<String> DESCRIPTION_KEYWORDS = List.of(
            "description", "narrative", "narration", "details", "particulars", "transaction", "memo", "remarks", "payee");

    @Override
    public SemanticMapping map(RawFrame sample, Set<String> consumedColumns) {
        List<String> remaining = sample.columnNames().stream()
                .filter(c -> !consumedColumns.contains(c))
                .toList();
        for (String keyword : DESCRIPTION_KEYWORDS) {
            for (String column : remaining) {
                if (column.toLowerCase(Locale.ROOT).contains(keyword)) {
                    return new SemanticMapping(column);
                }
            }
        }
        return SemanticMapping.none();
    }
}
