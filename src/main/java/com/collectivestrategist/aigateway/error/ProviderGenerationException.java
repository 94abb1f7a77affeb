package com.collectivestrategist.aigateway.error;

import com.collectivestrategist.aigateway.provider.GenerationOptions;
import com.collectivestrategist.aigateway.provider.ProviderName;

import java.util.HashMap;
import java.util.Map;

public class ProviderGenerationException extends AiGatewayException {

    public ProviderGenerationException(ProviderName provider, String prompt, GenerationOptions options, Throwable cause) {
        super(provider.id() + " generation failed: " + describe(cause), provider, replay("prompt", prompt, options), cause);
    }

    public static ProviderGenerationException embedding(ProviderName provider, String text, Throwable cause) {
        return new ProviderGenerationException(provider.id() + " embedding failed: " + describe(cause),
                provider, replay("text", text, null), cause);
    }

    private ProviderGenerationException(String message, ProviderName provider, Map<String, Object> context,
                                        Throwable cause) {
        super(message, provider, context, cause);
    }

    public String prompt() {
        var prompt = context().get("prompt");
        return prompt != null ? prompt.toString() : null;
    }

    public GenerationOptions options() {
        return (GenerationOptions) context().get("options");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.GENERATION_FAILED;
    }

    private static Map<String, Object> replay(String inputKey, String input, GenerationOptions options) {
        var context = new HashMap<String, Object>();
        if (input != null) {
            context.put(inputKey, input);
        }
        if (options != null) {
            context.put("options", options);
        }
        return context;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
