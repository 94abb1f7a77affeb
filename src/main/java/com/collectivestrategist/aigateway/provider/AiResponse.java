package com.collectivestrategist.aigateway.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AiResponse(
        @JsonProperty("content") String content,
        @JsonProperty("provider") ProviderName provider,
        @JsonProperty("model_used") String modelUsed,
        @JsonProperty("tokens_used") int tokensUsed,
        @JsonProperty("generation_time_ms") long generationTimeMs,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static final String ACTUAL_PROVIDER = "actual_provider";
    public static final String RATE_LIMITED = "rate_limited";

    public AiResponse {
        metadata = metadata != null ? withoutNulls(metadata) : Map.of();
    }

    public AiResponse asProvider(ProviderName logicalProvider, Map<String, Object> extraMetadata) {
        var merged = new LinkedHashMap<>(metadata);
        merged.putAll(extraMetadata);
        return new AiResponse(content, logicalProvider, modelUsed, tokensUsed, generationTimeMs, merged);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
