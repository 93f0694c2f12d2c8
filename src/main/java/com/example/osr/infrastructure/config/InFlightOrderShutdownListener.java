package com.example.osr.infrastructure.config;

import com.example.osr.application.service.OrderLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Handles graceful shutdown by waiting for in-flight order operations to complete,
 * so no submission is cut off between transmission and its history write.
 */
@Component
public class InFlightOrderShutdownListener implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(InFlightOrderShutdownListener.class);
    private static final int MAX_WAIT_SECONDS = 25;

    private final OrderLockRegistry locks;

    public InFlightOrderShutdownListener(OrderLockRegistry locks) {
        this.locks = locks;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Shutdown signal received. In-flight orders: {}", locks.activeCount());

        int waitSeconds = MAX_WAIT_SECONDS;
        while (locks.activeCount() > 0 && waitSeconds > 0) {
            log.info("Waiting for {} in-flight order(s) to complete... ({} seconds remaining)",
                    locks.activeCount(), waitSeconds);
            try {
                Thread.sleep(1000);
                waitSeconds--;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted while waiting for in-flight orders");
                break;
            }
        }

        if (locks.activeCount() > 0) {
            log.warn("Graceful shutdown timeout. {} order operation(s) may be interrupted.",
                    locks.activeCount());
        } else {
            log.info("Graceful shutdown complete. No order operations in flight.");
        }
    }
}
