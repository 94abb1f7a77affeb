package com.collectivestrategist.aigateway.error;

import com.collectivestrategist.aigateway.provider.ProviderName;

import java.util.HashMap;

public class ProviderConfigurationException extends AiGatewayException {

    public ProviderConfigurationException(String message, ProviderName provider, String tenantId) {
        super(message, provider, CredentialDecryptionException.tenantContext(tenantId), null);
    }

    public ProviderConfigurationException(String message, String rawProviderName, String tenantId) {
        super(message, null, unknownProviderContext(rawProviderName, tenantId), null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION_INVALID;
    }

    private static HashMap<String, Object> unknownProviderContext(String rawProviderName, String tenantId) {
        var context = new HashMap<>(CredentialDecryptionException.tenantContext(tenantId));
        context.put("provider_name", String.valueOf(rawProviderName));
        return context;
    }
}
