package com.collectivestrategist.aigateway.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "gateway.cache.revalidation.enabled", havingValue = "true")
public class ProviderCacheRevalidator {

    private static final Logger log = LoggerFactory.getLogger(ProviderCacheRevalidator.class);

    private final ProviderResolver resolver;

    public ProviderCacheRevalidator(ProviderResolver resolver) {
        this.resolver = resolver;
    }

    @Scheduled(fixedDelayString = "${gateway.cache.revalidation.interval:PT15M}",
            initialDelayString = "${gateway.cache.revalidation.interval:PT15M}")
    void revalidate() {
        int cached = resolver.cachedProviderCount();
        if (cached == 0) {
            return;
        }
        int evicted = resolver.revalidateCachedProviders();
        log.info("Revalidated {} cached provider(s), evicted {}", cached, evicted);
    }
}
