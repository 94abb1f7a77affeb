package com.collectivestrategist.aigateway.config;

import com.collectivestrategist.aigateway.provider.DefaultProviderAdapter;
import com.collectivestrategist.aigateway.provider.ProviderAdapterFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.NestedExceptionUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(GatewayConfig.class, ProviderAdapterFactory.class);

    @Test
    void missingOperatorKeyFailsStartup() {
        contextRunner.run(context -> {
            var failure = context.getStartupFailure();
            assertNotNull(failure);
            var rootCause = NestedExceptionUtils.getRootCause(failure);
            assertInstanceOf(IllegalStateException.class, rootCause);
            assertTrue(rootCause.getMessage().contains("DEFAULT_ANTHROPIC_API_KEY"));
        });
    }

    @Test
    void blankOperatorKeyFailsStartup() {
        contextRunner
                .withPropertyValues("gateway.default-provider.api-key=   ")
                .run(context -> assertInstanceOf(IllegalStateException.class,
                        NestedExceptionUtils.getRootCause(context.getStartupFailure())));
    }

    @Test
    void operatorKeyBuildsTheDefaultProvider() {
        contextRunner
                .withPropertyValues(
                        "gateway.default-provider.api-key=sk-ant-test",
                        "gateway.default-provider.model=claude-3-5-haiku-latest")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertEquals("claude-3-5-haiku-latest",
                            context.getBean(DefaultProviderAdapter.class).defaultModel());
                });
    }
}
