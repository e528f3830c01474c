package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.config.properties.LlmProperties;
import com.phillippitts.classmate.exception.AnalysisException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;

/**
 * Chat-completions client for OpenAI-compatible providers (OpenAI, Qwen compatible mode,
 * local servers). The provider only decides the default endpoint and model.
 */
@Component
public class OpenAiCompatibleAnalyzerBackend implements AnalyzerBackend {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleAnalyzerBackend.class);

    private final HttpClient httpClient;
    private final LlmProperties llm;
    private final Duration requestTimeout;

    public OpenAiCompatibleAnalyzerBackend(LlmProperties llm, AnalysisProperties analysis) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), llm,
                Duration.ofMillis(analysis.getCallTimeoutMs()));
    }

    OpenAiCompatibleAnalyzerBackend(HttpClient httpClient, LlmProperties llm, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.llm = llm;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return llm.getProvider().name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String complete(CompletionRequest request) {
        String url = normalizeBaseUrl(llm.resolveBaseUrl()) + "/chat/completions";
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildPayload(request).toString()));
        if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + llm.getApiKey());
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AnalysisException("Model request failed: " + e.getMessage(), request.kind().label(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted during model request", request.kind().label(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AnalysisException("Model request failed (" + status + ")", request.kind().label());
        }
        return extractContent(response.body(), request.kind());
    }

    JSONObject buildPayload(CompletionRequest request) {
        JSONArray messages = new JSONArray();
        if (!request.systemPrompt().isBlank()) {
            messages.put(new JSONObject().put("role", "system").put("content", request.systemPrompt()));
        }
        messages.put(new JSONObject().put("role", "user").put("content", request.prompt()));
        return new JSONObject()
                .put("model", llm.resolveModel())
                .put("messages", messages)
                .put("temperature", request.temperature())
                .put("max_tokens", request.maxTokens());
    }

    static String extractContent(String body, AnalyzerKind kind) {
        try {
            JSONObject json = new JSONObject(body);
            JSONArray choices = json.optJSONArray("choices");
            if (choices != null && !choices.isEmpty()) {
                JSONObject choice = choices.getJSONObject(0);
                JSONObject message = choice.optJSONObject("message");
                if (message != null && !message.optString("content", "").isBlank()) {
                    return message.getString("content");
                }
                if (!choice.optString("text", "").isBlank()) {
                    return choice.getString("text");
                }
            }
            throw new AnalysisException("Model response carried no content", kind.label());
        } catch (JSONException e) {
            LOG.debug("Unparseable model response body: {}", e.getMessage());
            throw new AnalysisException("Unparseable model response", kind.label(), e);
        }
    }

    private static String normalizeBaseUrl(String baseUrl) {
        String url = baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
