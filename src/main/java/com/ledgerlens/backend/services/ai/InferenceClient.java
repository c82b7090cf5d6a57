package com.ledgerlens.backend.services.ai;

import com.ledgerlens.backend.exceptions.InferenceException;

/**
 * Sends one prompt to a language model and returns its text answer.
 */
public interface InferenceClient {

    /**
     * @return the raw model output, never blank
     * @throws InferenceException when the call fails, times out, or returns nothing
     */
    String complete(String prompt);
}
