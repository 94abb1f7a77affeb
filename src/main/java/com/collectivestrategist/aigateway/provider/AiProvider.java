package com.collectivestrategist.aigateway.provider;

public interface AiProvider {

    ProviderName name();

    AiResponse generateText(String prompt, GenerationOptions options);

    default AiResponse generateText(String prompt) {
        return generateText(prompt, GenerationOptions.defaults());
    }

    /**
     * @throws com.collectivestrategist.aigateway.error.ProviderCapabilityUnsupportedException if the
     *         provider offers no embeddings
     * @throws com.collectivestrategist.aigateway.error.ProviderGenerationException if the vendor call fails
     */
    float[] generateEmbedding(String text);

    boolean supportsEmbeddings();

    /**
     * Issues a minimal real generation against the vendor. Never throws.
     */
    boolean isHealthy();
}
