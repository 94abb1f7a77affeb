package com.collectivestrategist.aigateway.provider;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatOptions;

public class GoogleProviderAdapter extends ChatModelProvider {

    private final EmbeddingModel embeddingModel;

    public GoogleProviderAdapter(ChatModel chatModel, EmbeddingModel embeddingModel,
                                 String defaultModel, String healthCheckModel) {
        super(chatModel, defaultModel, healthCheckModel);
        this.embeddingModel = embeddingModel;
    }

    @Override
    public ProviderName name() {
        return ProviderName.GOOGLE;
    }

    @Override
    protected ChatOptions callOptions(String model, Integer maxTokens, Double temperature) {
        return OpenAiChatOptions.builder()
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }

    @Override
    public float[] generateEmbedding(String text) {
        return embedWith(embeddingModel, text);
    }

    @Override
    public boolean supportsEmbeddings() {
        return true;
    }
}
