package com.collectivestrategist.aigateway.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationOptions(
        @JsonProperty("model") String model,
        @JsonProperty("max_tokens") Integer maxTokens,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("system_prompt") String systemPrompt) {

    public static final int DEFAULT_MAX_TOKENS = 4000;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    private static final GenerationOptions DEFAULTS = new GenerationOptions(null, null, null, null);

    public static GenerationOptions defaults() {
        return DEFAULTS;
    }

    public static GenerationOptions orDefaults(GenerationOptions options) {
        return options != null ? options : DEFAULTS;
    }

    public int effectiveMaxTokens() {
        return maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    public double effectiveTemperature() {
        return temperature != null ? temperature : DEFAULT_TEMPERATURE;
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }

    public GenerationOptions withModel(String model) {
        return new GenerationOptions(model, maxTokens, temperature, systemPrompt);
    }

    public GenerationOptions withMaxTokens(int maxTokens) {
        return new GenerationOptions(model, maxTokens, temperature, systemPrompt);
    }

    public GenerationOptions withTemperature(double temperature) {
        return new GenerationOptions(model, maxTokens, temperature, systemPrompt);
    }

    public GenerationOptions withSystemPrompt(String systemPrompt) {
        return new GenerationOptions(model, maxTokens, temperature, systemPrompt);
    }
}
