package com.ledgerlens.backend.services.statements.analysis;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.backend.exceptions.InferenceException;
import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.ai.InferenceClient;
import com.ledgerlens.backend.services.ai.ModelOutput;
import com.ledgerlens.backend.services.statements.model.AmountLayout;
import com.ledgerlens.backend.services.statements.model.AmountRepresentation;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Asks the model, in a single call, where the date and amounts are. The answer is
 * validated against the sample before it is trusted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AiStructuralAnalyzer implements StructuralAnalyzer {

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;
    private final StructuralInfoValidator validator;

    @Override
    public StructuralInfo analyze(RawFrame sample) {
        if (sample == null || sample.isEmpty()) {
            throw new StructuralDiscoveryException("input has no rows");
        }

        String output;
        try {
            output = inferenceClient.complete(buildPrompt(sample));
        } catch (InferenceException e) {
            log.error("[StructuralAnalysis] inference call failed: {}", e.getMessage());
            throw new StructuralDiscoveryException("inference call failed: " + e.getMessage(), e);
        }

        StructuralInfo info = parse(output);
        validator.validate(info, sample);
        log.info("[StructuralAnalysis] date={} ({}), amounts={}",
                info.dateColumn(), info.dateFormat(), info.representation().wireName());
        return info;
    }

    StructuralInfo parse(String output) {
        StructuralAnswer answer;
        try {
            answer = objectMapper.readValue(ModelOutput.stripCodeFences(output), StructuralAnswer.class);
        } catch (JsonProcessingException e) {
            throw new StructuralDiscoveryException("model answer is not valid JSON: "
                    + ModelOutput.abbreviate(output, 200), e);
        }
        if (answer == null || answer.dateInfo() == null || answer.amountInfo() == null) {
            throw new StructuralDiscoveryException("model answer lacks date_info or amount_info");
        }

        try {
            AmountInfo a = answer.amountInfo();
            AmountLayout layout = switch (AmountRepresentation.fromWireName(a.representation())) {
                case DUAL_COLUMN_DEBIT_CREDIT -> new AmountLayout.DualColumn(a.debitColumn(), a.creditColumn());
                case SINGLE_COLUMN_SIGNED -> new AmountLayout.SignedColumn(a.amountColumn());
                case SINGLE_COLUMN_WITH_TYPE -> new AmountLayout.TypeIndicator(
                        a.amountColumn(), a.typeColumn(), a.debitIdentifier(), a.creditIdentifier());
            };
            return new StructuralInfo(answer.dateInfo().columnName(), answer.dateInfo().formatString(), layout);
        } catch (IllegalArgumentException e) {
            throw new StructuralDiscoveryException("inconsistent structure: " + e.getMessage(), e);
        }
    }

    private String buildPrompt(RawFrame sample) {
        return "You are analysing a bank statement table. Identify its structure.\n\n"
                + "Return ONLY a JSON object, no explanations, in this format:\n"
                + "{\n"
                + "  \"date_info\": {\"column_name\": \"<column>\", \"format_string\": \"<strftime format, e.g. %d/%m/%Y>\"},\n"
                + "  \"amount_info\": {\n"
                + "    \"representation\": \"dual_column_debit_credit | single_column_signed | single_column_with_type\",\n"
                + "    \"debit_column\": \"<column, dual_column_debit_credit only>\",\n"
                + "    \"credit_column\": \"<column, dual_column_debit_credit only>\",\n"
                + "    \"amount_column\": \"<column, single_column_* only>\",\n"
                + "    \"type_column\": \"<column, single_column_with_type only>\",\n"
                + "    \"debit_identifier\": \"<value marking money out, single_column_with_type only>\",\n"
                + "    \"credit_identifier\": \"<value marking money in, single_column_with_type only>\"\n"
                + "  }\n"
                + "}\n\n"
                + "Use the exact column names from the header. Columns: " + sample.columnNames() + "\n\n"
                + "Sample rows (CSV):\n"
                + sample.toCsv();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StructuralAnswer(
            @JsonProperty("date_info") DateInfo dateInfo,
            @JsonProperty("amount_info") AmountInfo amountInfo
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DateInfo(
            @JsonProperty("column_name") String columnName,
            @JsonProperty("format_string") String formatString
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AmountInfo(
            @JsonProperty("representation") String representation,
            @JsonProperty("debit_column") String debitColumn,
            @JsonProperty("credit_column") String creditColumn,
            @JsonProperty("amount_column") String amountColumn,
            @JsonProperty("type_column") String typeColumn,
            @JsonProperty("debit_identifier") String debitIdentifier,
            @JsonProperty("credit_identifier") String creditIdentifier
    ) {
    }
}
