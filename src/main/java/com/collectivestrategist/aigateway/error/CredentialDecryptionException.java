package com.collectivestrategist.aigateway.error;

import com.collectivestrategist.aigateway.provider.ProviderName;

import java.util.HashMap;
import java.util.Map;

public class CredentialDecryptionException extends AiGatewayException {

    public CredentialDecryptionException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public CredentialDecryptionException(String message, ProviderName provider, String tenantId, Throwable cause) {
        super(message, provider, tenantContext(tenantId), cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CREDENTIAL_DECRYPTION_FAILED;
    }

    static Map<String, Object> tenantContext(String tenantId) {
        var context = new HashMap<String, Object>();
        if (tenantId != null) {
            context.put("tenant_id", tenantId);
        }
        return context;
    }
}
