package com.ledgerlens.backend.services.ai;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.config.InferenceProperties;
import com.ledgerlens.backend.exceptions.InferenceUnavailableException;

class OpenAiInferenceClientTest {

    @Test
    void missingApiKey_isUnavailable_andRetryable() {
        OpenAiInferenceClient client = new OpenAiInferenceClient(
                new InferenceProperties(" ", null, null, null, null, null));

        InferenceUnavailableException ex = assertThrows(InferenceUnavailableException.class,
                () -> client.complete("hello"));
        assertTrue(ex.isRetryable());
    }
}
