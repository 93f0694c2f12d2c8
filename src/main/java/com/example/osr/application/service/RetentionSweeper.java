package com.example.osr.application.service;

import com.example.osr.application.port.in.PurgeHistoryUseCase;
import com.example.osr.application.port.out.HistoryStorePort;
import com.example.osr.domain.model.OrderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Removes history records that have not been updated within a retention threshold.
 * Orders with an operation in progress are skipped and picked up by a later run.
 */
@Service
public class RetentionSweeper implements PurgeHistoryUseCase {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final HistoryStorePort history;
    private final OrderLockRegistry locks;
    private final Clock clock;

    public RetentionSweeper(HistoryStorePort history, OrderLockRegistry locks, Clock clock) {
        this.history = history;
        this.locks = locks;
        this.clock = clock;
    }

    @Override
    public int purge(Duration olderThan) {
        Objects.requireNonNull(olderThan, "Threshold cannot be null");
        if (olderThan.isNegative()) {
            throw new IllegalArgumentException("Threshold cannot be negative: " + olderThan);
        }

        Instant cutoff = clock.instant().minus(olderThan);
        List<OrderId> candidates = history.findIdsLastUpdatedBefore(cutoff);
        log.debug("Purge found {} candidate(s) last updated before {}", candidates.size(), cutoff);

        int removed = 0;
        int skipped = 0;
        for (OrderId orderId : candidates) {
            Optional<Boolean> outcome = locks.tryWithLock(orderId, () -> removeIfStale(orderId, cutoff));
            if (outcome.isEmpty()) {
                skipped++;
                log.debug("Purge skipped busy order {}", orderId);
            } else if (outcome.get()) {
                removed++;
            }
        }

        log.info("Purged {} order record(s) older than {} (skipped {} busy)", removed, olderThan, skipped);
        return removed;
    }

    private boolean removeIfStale(OrderId orderId, Instant cutoff) {
        // the record may have been touched since the scan
        return history.get(orderId)
                .filter(record -> record.isStaleAt(cutoff))
                .map(record -> history.remove(orderId))
                .orElse(false);
    }
}
