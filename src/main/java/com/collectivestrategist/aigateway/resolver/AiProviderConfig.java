package com.collectivestrategist.aigateway.resolver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AiProviderConfig(
        @JsonProperty("id") String id,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("provider_name") String providerName,
        @JsonProperty("api_key_encrypted") String apiKeyEncrypted,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("rate_limit_per_day") Integer rateLimitPerDay,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static AiProviderConfig of(String tenantId, String providerName, String apiKeyEncrypted, boolean active) {
        var now = Instant.now();
        return new AiProviderConfig(null, tenantId, providerName, apiKeyEncrypted, active, null, now, now);
    }

    public boolean hasEncryptedKey() {
        return apiKeyEncrypted != null && !apiKeyEncrypted.isBlank();
    }
}
