package com.phillippitts.classmate.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the language-model provider used by all analyzers.
 *
 * <p>Every supported provider speaks the OpenAI-compatible chat-completions API; they differ
 * in default endpoint and model. Blank {@code baseUrl}/{@code model} fall back to the
 * provider defaults.
 */
@Validated
@ConfigurationProperties(prefix = "classmate.llm")
public class LlmProperties {

    public enum Provider {
        OPENAI("https://api.openai.com/v1", "gpt-4o"),
        QWEN("https://dashscope.aliyuncs.com/compatible-mode/v1", "qwen-plus"),
        CUSTOM("http://localhost:1234/v1", "");

        private final String defaultBaseUrl;
        private final String defaultModel;

        Provider(String defaultBaseUrl, String defaultModel) {
            this.defaultBaseUrl = defaultBaseUrl;
            this.defaultModel = defaultModel;
        }

        public String getDefaultBaseUrl() {
            return defaultBaseUrl;
        }

        public String getDefaultModel() {
            return defaultModel;
        }
    }

    @NotNull
    private Provider provider = Provider.OPENAI;

    private String apiKey = "";

    private String baseUrl = "";

    private String model = "";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.7;

    @Positive
    private int maxTokens = 2048;

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    /** Configured base URL, or the provider default when blank. */
    public String resolveBaseUrl() {
        return baseUrl == null || baseUrl.isBlank() ? provider.getDefaultBaseUrl() : baseUrl;
    }

    /** Configured model, or the provider default when blank. */
    public String resolveModel() {
        return model == null || model.isBlank() ? provider.getDefaultModel() : model;
    }
}
