package com.ledgerlens.backend.services.statements.analysis;

import java.time.format.DateTimeFormatter;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.statements.model.CellValues;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

/**
 * Checks a proposed structure against the sample it was derived from.
 */
@Component
public class StructuralInfoValidator {

    public void validate(StructuralInfo info, RawFrame sample) {
        for (String column : info.consumedColumns()) {
            if (!sample.hasColumn(column)) {
                throw new StructuralDiscoveryException("column '" + column + "' does not exist in the input "
                        + sample.columnNames());
            }
        }

        DateTimeFormatter formatter;
        try {
            formatter = DateFormats.formatter(info.dateFormat());
        } catch (IllegalArgumentException e) {
            throw new StructuralDiscoveryException("invalid date format '" + info.dateFormat() + "'", e);
        }

        boolean sawValue = false;
        for (Object value : sample.column(info.dateColumn())) {
            if (CellValues.isBlank(value)) continue;
            sawValue = true;
            if (DateFormats.parse(value, formatter).isPresent()) {
                return;
            }
        }
        throw new StructuralDiscoveryException(sawValue
                ? "date format '" + info.dateFormat() + "' parses none of the sampled values in '" + info.dateColumn() + "'"
                : "date column '" + info.dateColumn() + "' is empty in the sample");
    }
}
