package com.collectivestrategist.aigateway.provider;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

@Component
public class ProviderAdapterFactory {

    // Callers own retry policy, so Spring AI's own retries are switched off.
    private static final RetryTemplate SINGLE_ATTEMPT = RetryTemplate.builder().maxAttempts(1).build();

    private final String openAiModel;
    private final String openAiHealthModel;
    private final String openAiEmbeddingModel;
    private final String anthropicModel;
    private final String anthropicHealthModel;
    private final String googleBaseUrl;
    private final String googleModel;
    private final String googleHealthModel;
    private final String googleEmbeddingModel;

    public ProviderAdapterFactory(
            @Value("${gateway.providers.openai.model:gpt-4o}") String openAiModel,
            @Value("${gateway.providers.openai.health-model:gpt-4o-mini}") String openAiHealthModel,
            @Value("${gateway.providers.openai.embedding-model:text-embedding-3-small}") String openAiEmbeddingModel,
            @Value("${gateway.providers.anthropic.model:claude-sonnet-4-20250514}") String anthropicModel,
            @Value("${gateway.providers.anthropic.health-model:claude-3-5-haiku-latest}") String anthropicHealthModel,
            @Value("${gateway.providers.google.base-url:https://generativelanguage.googleapis.com/v1beta/openai}") String googleBaseUrl,
            @Value("${gateway.providers.google.model:gemini-2.0-flash}") String googleModel,
            @Value("${gateway.providers.google.health-model:gemini-2.0-flash}") String googleHealthModel,
            @Value("${gateway.providers.google.embedding-model:text-embedding-004}") String googleEmbeddingModel) {
        this.openAiModel = openAiModel;
        this.openAiHealthModel = openAiHealthModel;
        this.openAiEmbeddingModel = openAiEmbeddingModel;
        this.anthropicModel = anthropicModel;
        this.anthropicHealthModel = anthropicHealthModel;
        this.googleBaseUrl = googleBaseUrl;
        this.googleModel = googleModel;
        this.googleHealthModel = googleHealthModel;
        this.googleEmbeddingModel = googleEmbeddingModel;
    }

    public AiProvider create(ProviderName provider, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException(provider.id() + " API key is required");
        }
        return switch (provider) {
            case OPENAI -> createOpenAi(apiKey);
            case ANTHROPIC -> createAnthropic(apiKey);
            case GOOGLE -> createGoogle(apiKey);
            case DEFAULT -> throw new IllegalArgumentException("The default provider is not built from a tenant key");
        };
    }

    public AnthropicProviderAdapter createAnthropic(String apiKey) {
        var api = AnthropicApi.builder()
                .apiKey(apiKey)
                .build();
        var chatModel = AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(AnthropicChatOptions.builder()
                        .model(anthropicModel)
                        .maxTokens(GenerationOptions.DEFAULT_MAX_TOKENS)
                        .build())
                .retryTemplate(SINGLE_ATTEMPT)
                .build();
        return new AnthropicProviderAdapter(chatModel, anthropicModel, anthropicHealthModel);
    }

    private OpenAiProviderAdapter createOpenAi(String apiKey) {
        var api = OpenAiApi.builder()
                .apiKey(apiKey)
                .build();
        var chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(openAiModel)
                        .build())
                .retryTemplate(SINGLE_ATTEMPT)
                .build();
        var embeddingModel = new OpenAiEmbeddingModel(api, MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(openAiEmbeddingModel).build(), SINGLE_ATTEMPT);
        return new OpenAiProviderAdapter(chatModel, embeddingModel, openAiModel, openAiHealthModel);
    }

    private GoogleProviderAdapter createGoogle(String apiKey) {
        var api = OpenAiApi.builder()
                .apiKey(apiKey)
                .baseUrl(googleBaseUrl)
                .completionsPath("/chat/completions")
                .embeddingsPath("/embeddings")
                .build();
        var chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(googleModel)
                        .build())
                .retryTemplate(SINGLE_ATTEMPT)
                .build();
        var embeddingModel = new OpenAiEmbeddingModel(api, MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(googleEmbeddingModel).build(), SINGLE_ATTEMPT);
        return new GoogleProviderAdapter(chatModel, embeddingModel, googleModel, googleHealthModel);
    }
}
