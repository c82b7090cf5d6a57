package com.ledgerlens.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledger.inference")
public record InferenceProperties(
        String apiKey,
        String model,
        Integer maxTokens,
        Double temperature,
        Integer timeoutSeconds,
        String baseUrl
) {
    public InferenceProperties {
        if (model == null || model.isBlank()) {
            model = "gpt-4o-mini";
        }
        if (maxTokens == null || maxTokens < 1) {
            maxTokens = 4000;
        }
        if (temperature == null) {
            temperature = 0.0;
        }
        if (timeoutSeconds == null || timeoutSeconds < 1) {
            timeoutSeconds = 60;
        }
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
