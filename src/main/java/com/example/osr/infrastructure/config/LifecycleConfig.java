package com.example.osr.infrastructure.config;

import com.example.osr.application.service.LifecycleSettings;
import com.example.osr.domain.document.OrderDocumentBuilder;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the order lifecycle engine's collaborators from {@link OsrProperties}.
 */
@Configuration
public class LifecycleConfig {

    private static final Logger log = LoggerFactory.getLogger(LifecycleConfig.class);

    public static final String SUBMIT_RETRY = "osrSubmit";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OrderDocumentBuilder orderDocumentBuilder(OsrProperties properties) {
        return new OrderDocumentBuilder(properties.document().toSettings());
    }

    @Bean
    public LifecycleSettings lifecycleSettings(OsrProperties properties) {
        LifecycleSettings settings = properties.toLifecycleSettings();
        log.info("OSR {} lifecycle: callTimeout={}, dryRun={}", properties.osrId(),
                settings.callTimeout(), settings.dryRun());
        return settings;
    }

    /**
     * Retry applied to order transmission. Attempts, backoff and the retried
     * exception types come from {@code resilience4j.retry.instances.osrSubmit}.
     */
    @Bean
    public Retry osrSubmitRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(SUBMIT_RETRY);
    }
}
