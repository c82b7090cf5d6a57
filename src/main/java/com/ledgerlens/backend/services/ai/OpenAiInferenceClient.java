package com.ledgerlens.backend.services.ai;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.InferenceProperties;
import com.ledgerlens.backend.exceptions.InferenceException;
import com.ledgerlens.backend.exceptions.InferenceTimeoutException;
import com.ledgerlens.backend.exceptions.InferenceUnavailableException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.responses.Response;
import com.openai.models.responses.ResponseCreateParams;
import com.openai.models.responses.ResponseOutputItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link InferenceClient} backed by the OpenAI Responses API. Retries are left to callers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OpenAiInferenceClient implements InferenceClient {

    private final InferenceProperties properties;

    private volatile OpenAIClient client;

    @Override
    public String complete(String prompt) {
        if (!properties.hasApiKey()) {
            throw new InferenceUnavailableException("no inference API key configured (ledger.inference.api-key)");
        }

        OpenAIClient c = getOrCreateClient();
        long start = System.currentTimeMillis();
        try {
            ResponseCreateParams params = ResponseCreateParams.builder()
                    .model(properties.model())
                    .input(prompt)
                    .maxOutputTokens(properties.maxTokens().longValue())
                    .temperature(properties.temperature().doubleValue())
                    .build();

            Response response = c.responses().create(params);
            String output = extractOutputText(response);
            long elapsed = System.currentTimeMillis() - start;

            if (output.isBlank()) {
                log.warn("[OpenAI] Empty response (model={} elapsedMs={})", properties.model(), elapsed);
                throw new InferenceException("model returned an empty response");
            }
            log.debug("[OpenAI] Completed (promptLen={} outputLen={} elapsedMs={})",
                    prompt.length(), output.length(), elapsed);
            return output;
        } catch (OpenAIIoException e) {
            long elapsed = System.currentTimeMillis() - start;
            if (hasCause(e, InterruptedIOException.class)) {
                log.warn("[OpenAI] Timed out after {}ms", elapsed);
                throw new InferenceTimeoutException("inference call timed out after " + elapsed + "ms", e);
            }
            if (hasCause(e, ConnectException.class) || hasCause(e, UnknownHostException.class)) {
                throw new InferenceUnavailableException("inference service unreachable: " + e.getMessage(), e);
            }
            throw new InferenceUnavailableException("I/O failure calling inference service: " + e.getMessage(), e);
        } catch (OpenAIServiceException e) {
            log.warn("[OpenAI] Service error: {}", e.getMessage());
            throw new InferenceException("inference service rejected the request: " + e.getMessage(), e);
        } catch (OpenAIException e) {
            throw new InferenceException("inference call failed: " + e.getMessage(), e);
        }
    }

    private OpenAIClient getOrCreateClient() {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                    .apiKey(properties.apiKey().trim())
                    .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                    .maxRetries(0);
            if (properties.baseUrl() != null && !properties.baseUrl().isBlank()) {
                builder.baseUrl(properties.baseUrl().trim());
            }
            client = builder.build();
            return client;
        }
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable cur = t;
        while (cur != null) {
            if (type.isInstance(cur)) return true;
            cur = cur.getCause() == cur ? null : cur.getCause();
        }
        return false;
    }

    private static String extractOutputText(Response response) {
        if (response == null) return "";
        StringBuilder sb = new StringBuilder();
        List<ResponseOutputItem> output = response.output();
        if (output == null || output.isEmpty()) return "";

        for (ResponseOutputItem item : output) {
            if (item == null) continue;
            item.message().ifPresent(message -> {
                if (message.content() == null) return;
                for (var content : message.content()) {
                    if (content == null) continue;
                    content.outputText().ifPresent(t -> {
                        String v = t.text();
                        if (v != null && !v.isBlank()) {
                            if (!sb.isEmpty()) sb.append('\n');
                            sb.append(v);
                        }
                    });
                }
            });
        }
        return sb.toString();
    }
}
