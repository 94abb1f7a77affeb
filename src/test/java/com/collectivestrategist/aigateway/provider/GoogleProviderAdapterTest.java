package com.collectivestrategist.aigateway.provider;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.EmbeddingModel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GoogleProviderAdapterTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
    private final GoogleProviderAdapter adapter =
            new GoogleProviderAdapter(chatModel, embeddingModel, "gemini-2.0-flash", "gemini-2.0-flash");

    @Test
    void generateTextReportsGoogleProvider() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(ChatResponses.of("Bonjour", "gemini-2.0-flash", 4, 3, "STOP"));

        var response = adapter.generateText("Translate hello");

        assertEquals(ProviderName.GOOGLE, response.provider());
        assertEquals("gemini-2.0-flash", response.modelUsed());
        assertEquals(7, response.tokensUsed());
        assertEquals(4, response.metadata().get("prompt_tokens"));
    }

    @Test
    void generateEmbeddingReturnsNonEmptyVector() {
        when(embeddingModel.embed("venture summary")).thenReturn(new float[] {0.5f, -0.25f});

        var vector = adapter.generateEmbedding("venture summary");

        assertTrue(vector.length > 0);
        assertEquals(-0.25f, vector[1]);
    }
}
