package com.ledgerlens.backend.services.statements.analysis;

import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.backend.exceptions.InferenceException;
import com.ledgerlens.backend.exceptions.SemanticMappingException;
import com.ledgerlens.backend.services.ai.InferenceClient;
import com.ledgerlens.backend.services.ai.ModelOutput;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.SemanticMapping;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Asks the model which leftover column is the narrative. Any failure falls back to
 * {@link HeuristicSemanticMapper}, and from there to no description column at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AiSemanticMapper implements SemanticMapper {

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;
    private final HeuristicSemanticMapper fallback;

    @Override
    public SemanticMapping map(RawFrame sample, Set<String> consumedColumns) {
        List<String> remaining = sample.columnNames().stream()
                .filter(c -> !consumedColumns.contains(c))
                .toList();
        if (remaining.isEmpty()) {
            log.info("[SemanticMapping] no columns left after structural analysis");
            return SemanticMapping.none();
        }

        try {
            String column = askModel(sample, remaining);
            log.info("[SemanticMapping] description column: {}", column);
            return new SemanticMapping(column);
        } catch (SemanticMappingException e) {
            SemanticMapping guessed = fallback.map(sample, consumedColumns);
            log.warn("[SemanticMapping] {}; keyword fallback chose {}", e.getMessage(),
                    guessed.hasDescriptionColumn() ? guessed.descriptionColumn() : "no column");
            return guessed;
        }
    }

    private String askModel(RawFrame sample, List<String> remaining) {
        String output;
        try {
            output = inferenceClient.complete(buildPrompt(sample, remaining));
        } catch (InferenceException e) {
            throw new SemanticMappingException("inference call failed: " + e.getMessage(), e);
        }

        DescriptionAnswer answer;
        try {
            answer = objectMapper.readValue(ModelOutput.stripCodeFences(output), DescriptionAnswer.class);
        } catch (JsonProcessingException e) {
            throw new SemanticMappingException("model answer is not valid JSON", e);
        }

        String column = answer == null ? null : answer.descriptionColumn();
        if (column == null || column.isBlank()) {
            throw new SemanticMappingException("model named no description column");
        }
        String trimmed = column.trim();
        if (!remaining.contains(trimmed)) {
            throw new SemanticMappingException("model named unknown column '" + trimmed + "'");
        }
        return trimmed;
    }

    private String buildPrompt(RawFrame sample, List<String> remaining) {
        return "The following bank statement columns are not yet mapped: " + remaining + "\n"
                + "Which ONE of them holds the transaction description (narrative, payee, memo)?\n\n"
                + "Return ONLY a JSON object: {\"description_column\": \"<column name>\"}\n\n"
                + "Sample rows (CSV):\n"
                + sample.toCsv();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DescriptionAnswer(@JsonProperty("description_column") String descriptionColumn) {
    }
}
