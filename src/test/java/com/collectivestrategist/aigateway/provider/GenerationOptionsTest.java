package com.collectivestrategist.aigateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationOptionsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsSnakeCaseOptions() throws Exception {
        var options = objectMapper.readValue(
                "{\"model\":\"gpt-4o\",\"max_tokens\":300,\"temperature\":0.2,\"system_prompt\":\"Be brief\",\"seed\":1}",
                GenerationOptions.class);

        assertEquals("gpt-4o", options.model());
        assertEquals(300, options.effectiveMaxTokens());
        assertEquals(0.2, options.effectiveTemperature());
        assertTrue(options.hasSystemPrompt());
    }

    @Test
    void zeroTemperatureIsKept() {
        assertEquals(0.0, GenerationOptions.defaults().withTemperature(0.0).effectiveTemperature());
    }

    @Test
    void unsetFieldsUseDefaults() {
        var options = GenerationOptions.orDefaults(null);

        assertNull(options.model());
        assertEquals(4000, options.effectiveMaxTokens());
        assertEquals(0.7, options.effectiveTemperature());
        assertFalse(options.withSystemPrompt("  ").hasSystemPrompt());
    }

    @Test
    void responseSerializesWithWireNames() throws Exception {
        var response = new AiResponse("hi", ProviderName.DEFAULT, "claude-3-5-haiku-latest", 5, 120,
                Map.of(AiResponse.RATE_LIMITED, true));

        var json = objectMapper.readTree(objectMapper.writeValueAsString(response));

        assertEquals("default", json.get("provider").asText());
        assertEquals(5, json.get("tokens_used").asInt());
        assertEquals(120, json.get("generation_time_ms").asLong());
        assertTrue(json.get("metadata").get("rate_limited").asBoolean());
    }
}
