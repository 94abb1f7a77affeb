package com.collectivestrategist.aigateway.provider;

import com.collectivestrategist.aigateway.error.ProviderCapabilityUnsupportedException;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.LinkedHashMap;
import java.util.Map;

public class AnthropicProviderAdapter extends ChatModelProvider {

    public AnthropicProviderAdapter(ChatModel chatModel, String defaultModel, String healthCheckModel) {
        super(chatModel, defaultModel, healthCheckModel);
    }

    @Override
    public ProviderName name() {
        return ProviderName.ANTHROPIC;
    }

    @Override
    protected ChatOptions callOptions(String model, Integer maxTokens, Double temperature) {
        return AnthropicChatOptions.builder()
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }

    @Override
    protected Map<String, Object> usageMetadata(Usage usage, String finishReason) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("input_tokens", usage.getPromptTokens());
        metadata.put("output_tokens", usage.getCompletionTokens());
        metadata.put("stop_reason", finishReason);
        return metadata;
    }

    @Override
    public float[] generateEmbedding(String text) {
        throw new ProviderCapabilityUnsupportedException(ProviderName.ANTHROPIC, "embedding",
                "Anthropic does not provide embedding endpoints");
    }

    @Override
    public boolean supportsEmbeddings() {
        return false;
    }
}
