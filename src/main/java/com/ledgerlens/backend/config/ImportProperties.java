package com.ledgerlens.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs for the statement import pipeline ({@code ledger.import.*}).
 * Missing values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "ledger.import")
public record ImportProperties(
        Integer batchSize,
        Integer maxRetries,
        Duration inferenceRetryBackoff,
        Integer sampleSize,
        Integer middleSampleSize,
        Integer descriptionMaxLength,
        HierarchyCachePolicy hierarchyCache,
        Duration hierarchyCacheTtl,
        Integer persistenceRetryAttempts,
        Duration persistenceRetryBackoff,
        Integer smallBatchLimit,
        Integer mediumBatchLimit,
        Integer chunkSize,
        ProcessingMode mode
) {

    public enum HierarchyCachePolicy {
        /** Re-read the category table on every pipeline run. */
        NONE,
        /** Keep the last snapshot for {@code hierarchy-cache-ttl}, dropped early on writes. */
        TTL
    }

    public enum ProcessingMode {
        AI,
        RULES
    }

    public ImportProperties {
        if (batchSize == null || batchSize < 1) {
            batchSize = 25;
        }
        if (maxRetries == null || maxRetries < 0) {
            maxRetries = 1;
        }
        if (inferenceRetryBackoff == null) {
            inferenceRetryBackoff = Duration.ofMillis(400);
        }
        if (sampleSize == null || sampleSize < 1) {
            sampleSize = 20;
        }
        if (middleSampleSize == null || middleSampleSize < 0) {
            middleSampleSize = 5;
        }
        if (descriptionMaxLength == null || descriptionMaxLength < 1) {
            descriptionMaxLength = 500;
        }
        if (hierarchyCache == null) {
            hierarchyCache = HierarchyCachePolicy.NONE;
        }
        if (hierarchyCacheTtl == null) {
            hierarchyCacheTtl = Duration.ofMinutes(5);
        }
        if (persistenceRetryAttempts == null || persistenceRetryAttempts < 1) {
            persistenceRetryAttempts = 3;
        }
        if (persistenceRetryBackoff == null) {
            persistenceRetryBackoff = Duration.ofMillis(400);
        }
        if (smallBatchLimit == null || smallBatchLimit < 1) {
            smallBatchLimit = 100;
        }
        if (mediumBatchLimit == null || mediumBatchLimit < smallBatchLimit) {
            mediumBatchLimit = Math.max(1000, smallBatchLimit);
        }
        if (chunkSize == null || chunkSize < 1) {
            chunkSize = 500;
        }
        if (mode == null) {
            mode = ProcessingMode.AI;
        }
    }

    public static ImportProperties defaults() {
        return new ImportProperties(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }
}
