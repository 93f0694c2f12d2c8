package com.example.osr.infrastructure.scheduling;

import com.example.osr.application.exception.StorageException;
import com.example.osr.application.port.in.PurgeHistoryUseCase;
import com.example.osr.infrastructure.config.OsrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Purges aged history records on a fixed delay.
 * Enabled by setting {@code osr.history.retention}.
 */
@Component
@ConditionalOnProperty(name = "osr.history.retention")
public class RetentionPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionPurgeScheduler.class);

    private final PurgeHistoryUseCase purgeHistoryUseCase;
    private final Duration retention;

    public RetentionPurgeScheduler(PurgeHistoryUseCase purgeHistoryUseCase, OsrProperties properties) {
        this.purgeHistoryUseCase = purgeHistoryUseCase;
        Duration configured = properties.history().retention();
        if (configured == null || configured.isNegative()) {
            throw new IllegalArgumentException("osr.history.retention must be zero or positive: " + configured);
        }
        this.retention = configured;
        log.info("Scheduled history purge enabled: retention={}, interval={}ms",
                retention, properties.history().purgeIntervalMs());
    }

    @Scheduled(fixedDelayString = "${osr.history.purge-interval-ms:3600000}",
            initialDelayString = "${osr.history.purge-interval-ms:3600000}")
    public void purgeExpired() {
        try {
            int removed = purgeHistoryUseCase.purge(retention);
            if (removed > 0) {
                log.info("Scheduled purge removed {} order record(s)", removed);
            }
        } catch (StorageException e) {
            // retried on the next run
            log.error("Scheduled purge failed: {}", e.getMessage());
        }
    }
}
