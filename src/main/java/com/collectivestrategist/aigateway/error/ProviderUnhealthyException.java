package com.collectivestrategist.aigateway.error;

import com.collectivestrategist.aigateway.provider.ProviderName;

public class ProviderUnhealthyException extends AiGatewayException {

    public ProviderUnhealthyException(ProviderName provider, String tenantId) {
        super("Provider " + provider.id() + " failed its health check; the connected API key appears invalid",
                provider, CredentialDecryptionException.tenantContext(tenantId), null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_UNHEALTHY;
    }
}
