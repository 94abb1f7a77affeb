package com.collectivestrategist.aigateway.config;

import com.collectivestrategist.aigateway.provider.DefaultProviderAdapter;
import com.collectivestrategist.aigateway.provider.ProviderAdapterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public DefaultProviderAdapter defaultProviderAdapter(
            ProviderAdapterFactory adapterFactory,
            @Value("${gateway.default-provider.api-key:}") String apiKey,
            @Value("${gateway.default-provider.model:claude-3-5-haiku-latest}") String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                    "gateway.default-provider.api-key is not set; provide DEFAULT_ANTHROPIC_API_KEY");
        }
        log.info("Default provider configured on anthropic with model {}", model);
        return new DefaultProviderAdapter(adapterFactory.createAnthropic(apiKey), model);
    }
}
