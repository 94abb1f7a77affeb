package com.collectivestrategist.aigateway.provider;

import com.collectivestrategist.aigateway.error.ProviderCapabilityUnsupportedException;
import com.collectivestrategist.aigateway.error.ProviderGenerationException;

import java.util.Map;

public class DefaultProviderAdapter implements AiProvider {

    private final AnthropicProviderAdapter delegate;
    private final String defaultModel;

    public DefaultProviderAdapter(AnthropicProviderAdapter delegate, String defaultModel) {
        this.delegate = delegate;
        this.defaultModel = defaultModel;
    }

    @Override
    public ProviderName name() {
        return ProviderName.DEFAULT;
    }

    @Override
    public AiResponse generateText(String prompt, GenerationOptions options) {
        var effective = GenerationOptions.orDefaults(options);
        if (effective.model() == null) {
            effective = effective.withModel(defaultModel);
        }
        try {
            return delegate.generateText(prompt, effective)
                    .asProvider(ProviderName.DEFAULT, Map.of(
                            AiResponse.ACTUAL_PROVIDER, delegate.name().id(),
                            AiResponse.RATE_LIMITED, true));
        } catch (ProviderGenerationException e) {
            throw new ProviderGenerationException(ProviderName.DEFAULT, prompt, effective,
                    e.getCause() != null ? e.getCause() : e);
        }
    }

    @Override
    public float[] generateEmbedding(String text) {
        throw new ProviderCapabilityUnsupportedException(ProviderName.DEFAULT, "embedding",
                "The default provider does not support embeddings; connect your own OpenAI or Google key");
    }

    @Override
    public boolean supportsEmbeddings() {
        return false;
    }

    @Override
    public boolean isHealthy() {
        return delegate.isHealthy();
    }

    public String defaultModel() {
        return defaultModel;
    }
}
