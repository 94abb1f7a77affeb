package com.collectivestrategist.aigateway.resolver;

import com.collectivestrategist.aigateway.credential.CredentialCodec;
import com.collectivestrategist.aigateway.error.CredentialDecryptionException;
import com.collectivestrategist.aigateway.error.ProviderConfigurationException;
import com.collectivestrategist.aigateway.error.ProviderUnhealthyException;
import com.collectivestrategist.aigateway.provider.AiProvider;
import com.collectivestrategist.aigateway.provider.DefaultProviderAdapter;
import com.collectivestrategist.aigateway.provider.ProviderAdapterFactory;
import com.collectivestrategist.aigateway.provider.ProviderName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class ProviderResolver {

    private static final Logger log = LoggerFactory.getLogger(ProviderResolver.class);

    private final CredentialCodec credentialCodec;
    private final ProviderAdapterFactory adapterFactory;
    private final DefaultProviderAdapter defaultProvider;
    private final Map<ProviderCacheKey, AiProvider> cache = new ConcurrentHashMap<>();

    public ProviderResolver(CredentialCodec credentialCodec,
                            ProviderAdapterFactory adapterFactory,
                            DefaultProviderAdapter defaultProvider) {
        this.credentialCodec = credentialCodec;
        this.adapterFactory = adapterFactory;
        this.defaultProvider = defaultProvider;
    }

    public AiProvider resolveProvider(String tenantId, List<AiProviderConfig> configs) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id is required to resolve a provider");
        }
        var active = activeConfig(tenantId, configs);
        if (active == null) {
            return defaultProvider;
        }

        var provider = ProviderName.fromId(active.providerName())
                .orElseThrow(() -> new ProviderConfigurationException(
                        "Unknown provider: " + active.providerName(), active.providerName(), tenantId));
        if (provider == ProviderName.DEFAULT) {
            return defaultProvider;
        }

        var key = new ProviderCacheKey(tenantId, provider);
        // No health check on a hit; trust holds until evictTenant or revalidation.
        var cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        if (!active.hasEncryptedKey()) {
            throw new ProviderConfigurationException(
                    "Active " + provider.id() + " configuration has no API key", provider, tenantId);
        }

        String apiKey;
        try {
            apiKey = credentialCodec.decrypt(active.apiKeyEncrypted());
        } catch (CredentialDecryptionException e) {
            log.error("Credential integrity failure: stored {} key for tenant {} could not be decrypted",
                    provider, tenantId, e);
            throw new CredentialDecryptionException(
                    "Stored " + provider.id() + " credential could not be decrypted", provider, tenantId, e);
        }

        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderConfigurationException(
                    "Stored " + provider.id() + " credential decrypted to an empty key", provider, tenantId);
        }
        var adapter = adapterFactory.create(provider, apiKey);
        if (!adapter.isHealthy()) {
            log.warn("BYOK {} key for tenant {} failed its health check", provider, tenantId);
            throw new ProviderUnhealthyException(provider, tenantId);
        }

        cache.put(key, adapter);
        log.info("Resolved and cached {} provider for tenant {}", provider, tenantId);
        return adapter;
    }

    public void evictTenant(String tenantId) {
        int before = cache.size();
        cache.keySet().removeIf(key -> Objects.equals(key.tenantId(), tenantId));
        log.info("Evicted {} cached provider(s) for tenant {}", before - cache.size(), tenantId);
    }

    public boolean validateProviderConfig(ProviderName provider, String apiKey) {
        try {
            return adapterFactory.create(provider, apiKey).isHealthy();
        } catch (RuntimeException e) {
            log.warn("Validation of {} key failed: {}", provider, e.getMessage());
            return false;
        }
    }

    public String encryptApiKey(String apiKey) {
        return credentialCodec.encrypt(apiKey);
    }

    public Map<String, Boolean> providerHealth() {
        var health = new LinkedHashMap<String, Boolean>();
        health.put(ProviderName.DEFAULT.id(), defaultProvider.isHealthy());
        cache.forEach((key, adapter) -> health.put(key.toString(), adapter.isHealthy()));
        return health;
    }

    public int cachedProviderCount() {
        return cache.size();
    }

    public int revalidateCachedProviders() {
        int evicted = 0;
        for (var entry : Map.copyOf(cache).entrySet()) {
            if (!entry.getValue().isHealthy() && cache.remove(entry.getKey(), entry.getValue())) {
                log.warn("Evicted cached {} provider: key no longer passes its health check", entry.getKey());
                evicted++;
            }
        }
        return evicted;
    }

    private static AiProviderConfig activeConfig(String tenantId, List<AiProviderConfig> configs) {
        if (configs == null) {
            return null;
        }
        var active = configs.stream().filter(AiProviderConfig::active).toList();
        if (active.size() > 1) {
            log.warn("Tenant {} has {} active provider configurations, using {}",
                    tenantId, active.size(), active.get(0).providerName());
        }
        return active.isEmpty() ? null : active.get(0);
    }
}
