package com.ledgerlens.backend.services.statements.categorization;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.exceptions.CategorizationBatchException;
import com.ledgerlens.backend.exceptions.InferenceException;
import com.ledgerlens.backend.services.ai.InferenceClient;
import com.ledgerlens.backend.services.ai.ModelOutput;
import com.ledgerlens.backend.services.statements.model.CategorizedTransaction;
import com.ledgerlens.backend.services.statements.model.NormalizedTransaction;
import com.ledgerlens.backend.services.statements.model.ProgressListener;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Categorizes rows with the language model in fixed-size batches.
 *
 * <p>Each batch is attempted {@code max-retries + 1} times. A batch that still fails
 * (timeout, bad JSON, wrong length, invalid record) is filled with "Uncategorized"
 * and the run moves on; one bad batch never affects another.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCategorizer implements TransactionCategorizer {

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ImportProperties properties;

    @Override
    public CategorizationResult categorize(List<NormalizedTransaction> rows, CategoryHierarchy hierarchy,
                                           ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNoop(progress);
        int batchSize = properties.batchSize();
        int totalBatches = (rows.size() + batchSize - 1) / batchSize;
        String hierarchyJson = toJson(hierarchy);

        List<CategorizedTransaction> out = new ArrayList<>(rows.size());
        List<Integer> failedBatches = new ArrayList<>();
        int defaulted = 0;

        for (int b = 0; b < totalBatches; b++) {
            List<NormalizedTransaction> batch = rows.subList(b * batchSize, Math.min(rows.size(), (b + 1) * batchSize));
            List<CategoryAssignment> assigned = categorizeBatch(b, batch, hierarchyJson);
            double fraction = (double) (b + 1) / totalBatches;

            if (assigned == null) {
                batch.forEach(tx -> out.add(CategorizedTransaction.uncategorized(tx)));
                failedBatches.add(b);
                defaulted += batch.size();
                listener.onProgress(fraction, "batch " + (b + 1) + " failed, rows defaulted");
                continue;
            }

            for (int i = 0; i < batch.size(); i++) {
                CategoryAssignment a = assigned.get(i);
                String category = hierarchy.canonicalCategory(a.category()).orElse(a.category().trim());
                String sub = hierarchy.canonicalSubCategory(category, a.subCategory()).orElse(a.subCategory().trim());
                out.add(CategorizedTransaction.of(batch.get(i), category, sub));
            }
            listener.onProgress(fraction, "batch " + (b + 1) + " ok");
        }

        if (!failedBatches.isEmpty()) {
            log.warn("[Categorization] {} of {} batches defaulted to {} ({} rows)",
                    failedBatches.size(), totalBatches, CategorizedTransaction.UNCATEGORIZED, defaulted);
        }
        return new CategorizationResult(out, defaulted, failedBatches);
    }

    private List<CategoryAssignment> categorizeBatch(int batchIndex, List<NormalizedTransaction> batch,
                                                     String hierarchyJson) {
        String prompt = buildPrompt(batch, hierarchyJson);
        int maxAttempts = properties.maxRetries() + 1;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String output = inferenceClient.complete(prompt);
                return parse(batchIndex, output, batch.size());
            } catch (InferenceException e) {
                log.warn("[Categorization] batch {} attempt {}/{} failed: {}",
                        batchIndex, attempt, maxAttempts, e.getMessage());
            } catch (CategorizationBatchException e) {
                log.warn("[Categorization] attempt {}/{} rejected: {}", attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                sleepBackoff(attempt);
            }
        }
        return null;
    }

    List<CategoryAssignment> parse(int batchIndex, String output, int expectedSize) {
        JsonNode root;
        try {
            root = objectMapper.readTree(ModelOutput.stripCodeFences(output));
        } catch (JsonProcessingException e) {
            throw new CategorizationBatchException(batchIndex, "answer is not valid JSON", e);
        }

        JsonNode array = root;
        if (root != null && root.isObject()) {
            array = null;
            Iterator<JsonNode> values = root.elements();
            while (values.hasNext()) {
                JsonNode candidate = values.next();
                if (candidate.isArray()) {
                    array = candidate;
                    break;
                }
            }
        }
        if (array == null || !array.isArray()) {
            throw new CategorizationBatchException(batchIndex, "answer is not a JSON array");
        }
        if (array.size() != expectedSize) {
            throw new CategorizationBatchException(batchIndex,
                    "expected " + expectedSize + " assignments, got " + array.size());
        }

        List<CategoryAssignment> assignments = new ArrayList<>(expectedSize);
        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i);
            if (node == null || !node.isObject()) {
                throw new CategorizationBatchException(batchIndex, "element " + i + " is not an object");
            }
            CategoryAssignment a;
            try {
                a = objectMapper.treeToValue(node, CategoryAssignment.class);
            } catch (JsonProcessingException e) {
                throw new CategorizationBatchException(batchIndex, "element " + i + " is malformed", e);
            }
            Set<ConstraintViolation<CategoryAssignment>> violations = validator.validate(a);
            if (!violations.isEmpty()) {
                String detail = violations.stream()
                        .map(v -> v.getPropertyPath() + " " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining(", "));
                throw new CategorizationBatchException(batchIndex, "element " + i + " invalid: " + detail);
            }
            assignments.add(a);
        }
        return assignments;
    }

    private String buildPrompt(List<NormalizedTransaction> batch, String hierarchyJson) {
        StringBuilder rows = new StringBuilder();
        for (int i = 0; i < batch.size(); i++) {
            rows.append(i).append(": ").append(batch.get(i).description().replace('\n', ' ')).append('\n');
        }
        return "Categorize each bank transaction below using this category hierarchy "
                + "(top-level category -> sub-categories):\n"
                + hierarchyJson + "\n\n"
                + "Rules:\n"
                + "- Answer with ONLY a JSON array with exactly " + batch.size() + " objects, in the same order.\n"
                + "- Each object: {\"category\": \"<top-level category>\", \"sub_category\": \"<sub-category or empty string>\"}\n"
                + "- Prefer existing names; use \"" + CategorizedTransaction.UNCATEGORIZED + "\" when nothing fits.\n\n"
                + "Transactions (index: description):\n"
                + rows;
    }

    private String toJson(CategoryHierarchy hierarchy) {
        try {
            return objectMapper.writeValueAsString(hierarchy.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize category hierarchy", e);
        }
    }

    private void sleepBackoff(int attempt) {
        Duration base = properties.inferenceRetryBackoff();
        if (base.isZero() || base.isNegative()) return;
        try {
            Thread.sleep(base.toMillis() * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
