package com.collectivestrategist.aigateway.resolver;

import com.collectivestrategist.aigateway.provider.ProviderName;

record ProviderCacheKey(String tenantId, ProviderName provider) {

    @Override
    public String toString() {
        return tenantId + ":" + provider.id();
    }
}
