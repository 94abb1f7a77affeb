package com.collectivestrategist.aigateway.error;

import com.collectivestrategist.aigateway.provider.ProviderName;

import java.util.Map;

public abstract class AiGatewayException extends RuntimeException {

    private final ProviderName provider;
    private final Map<String, Object> context;

    protected AiGatewayException(String message, ProviderName provider,
                                 Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public abstract ErrorKind kind();

    public ProviderName provider() {
        return provider;
    }

    public Map<String, Object> context() {
        return context;
    }
}
