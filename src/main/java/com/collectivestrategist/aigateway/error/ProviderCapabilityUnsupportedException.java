package com.collectivestrategist.aigateway.error;

import com.collectivestrategist.aigateway.provider.ProviderName;

import java.util.Map;

public class ProviderCapabilityUnsupportedException extends AiGatewayException {

    private final String operation;

    public ProviderCapabilityUnsupportedException(ProviderName provider, String operation, String message) {
        super(message, provider, Map.of("operation", operation), null);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CAPABILITY_UNSUPPORTED;
    }
}
