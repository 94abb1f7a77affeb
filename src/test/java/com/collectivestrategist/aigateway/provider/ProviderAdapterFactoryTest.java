package com.collectivestrategist.aigateway.provider;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderAdapterFactoryTest {

    private final ProviderAdapterFactory factory = new ProviderAdapterFactory(
            "gpt-4o", "gpt-4o-mini", "text-embedding-3-small",
            "claude-sonnet-4-20250514", "claude-3-5-haiku-latest",
            "https://generativelanguage.googleapis.com/v1beta/openai",
            "gemini-2.0-flash", "gemini-2.0-flash", "text-embedding-004");

    @Test
    void buildsOneAdapterPerVendor() {
        var openAi = factory.create(ProviderName.OPENAI, "sk-test");
        var anthropic = factory.create(ProviderName.ANTHROPIC, "sk-ant-test");
        var google = factory.create(ProviderName.GOOGLE, "AIza-test");

        assertInstanceOf(OpenAiProviderAdapter.class, openAi);
        assertInstanceOf(AnthropicProviderAdapter.class, anthropic);
        assertInstanceOf(GoogleProviderAdapter.class, google);
        assertEquals(ProviderName.OPENAI, openAi.name());
        assertEquals(ProviderName.ANTHROPIC, anthropic.name());
        assertEquals(ProviderName.GOOGLE, google.name());
        assertTrue(openAi.supportsEmbeddings());
        assertFalse(anthropic.supportsEmbeddings());
        assertTrue(google.supportsEmbeddings());
    }

    @Test
    void rejectsMissingKey() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(ProviderName.OPENAI, " "));
        assertThrows(IllegalArgumentException.class, () -> factory.create(ProviderName.GOOGLE, null));
    }

    @Test
    void defaultProviderIsNotBuiltFromTenantKeys() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(ProviderName.DEFAULT, "sk-ant-test"));
    }
}
