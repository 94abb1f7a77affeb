package com.collectivestrategist.aigateway.provider;

import com.collectivestrategist.aigateway.error.ProviderGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public abstract class ChatModelProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatModelProvider.class);

    static final String HEALTH_CHECK_PROMPT = "Health check";
    static final int HEALTH_CHECK_MAX_TOKENS = 10;

    private final ChatModel chatModel;
    private final String defaultModel;
    private final String healthCheckModel;

    protected ChatModelProvider(ChatModel chatModel, String defaultModel, String healthCheckModel) {
        this.chatModel = chatModel;
        this.defaultModel = defaultModel;
        this.healthCheckModel = healthCheckModel != null ? healthCheckModel : defaultModel;
    }

    protected abstract ChatOptions callOptions(String model, Integer maxTokens, Double temperature);

    @Override
    public AiResponse generateText(String prompt, GenerationOptions options) {
        var effective = GenerationOptions.orDefaults(options);
        var model = effective.model() != null ? effective.model() : defaultModel;
        try {
            var request = new Prompt(messages(prompt, effective),
                    callOptions(model, effective.effectiveMaxTokens(), effective.effectiveTemperature()));
            long start = System.nanoTime();
            var response = chatModel.call(request);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            return toResponse(response, model, elapsedMs);
        } catch (RuntimeException e) {
            throw new ProviderGenerationException(name(), prompt, effective, e);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            chatModel.call(new Prompt(new UserMessage(HEALTH_CHECK_PROMPT),
                    callOptions(healthCheckModel, HEALTH_CHECK_MAX_TOKENS, null)));
            return true;
        } catch (RuntimeException e) {
            log.warn("Health check against {} failed: {}", name(), e.getMessage());
            return false;
        }
    }

    protected float[] embedWith(EmbeddingModel embeddingModel, String text) {
        try {
            var vector = embeddingModel.embed(text);
            if (vector == null || vector.length == 0) {
                throw new IllegalStateException("Vendor returned an empty embedding");
            }
            return vector;
        } catch (RuntimeException e) {
            throw ProviderGenerationException.embedding(name(), text, e);
        }
    }

    protected Map<String, Object> usageMetadata(Usage usage, String finishReason) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("prompt_tokens", usage.getPromptTokens());
        metadata.put("completion_tokens", usage.getCompletionTokens());
        metadata.put("finish_reason", finishReason);
        return metadata;
    }

    private AiResponse toResponse(ChatResponse response, String requestedModel, long elapsedMs) {
        var generation = response.getResult();
        var output = generation != null ? generation.getOutput() : null;
        var text = output != null ? output.getText() : null;
        var finishReason = generation != null && generation.getMetadata() != null
                ? generation.getMetadata().getFinishReason() : null;

        var responseMetadata = response.getMetadata();
        var usage = responseMetadata.getUsage();
        var reportedModel = responseMetadata.getModel();
        var modelUsed = reportedModel != null && !reportedModel.isBlank() ? reportedModel : requestedModel;
        var totalTokens = usage.getTotalTokens();

        return new AiResponse(
                text != null ? text : "",
                name(),
                modelUsed,
                totalTokens != null ? totalTokens : 0,
                elapsedMs,
                usageMetadata(usage, finishReason));
    }

    private static List<Message> messages(String prompt, GenerationOptions options) {
        var messages = new ArrayList<Message>();
        if (options.hasSystemPrompt()) {
            messages.add(new SystemMessage(options.systemPrompt()));
        }
        messages.add(new UserMessage(prompt));
        return messages;
    }
}
