package com.example.osr.application.service;

import com.example.osr.application.exception.OrderBusyException;
import com.example.osr.domain.model.OrderId;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-order mutual exclusion for state-changing operations.
 * Locks are created on first use and reclaimed once no thread references them.
 * Acquisition never waits: a contended id is reported busy.
 */
@Component
public class OrderLockRegistry {

    private final ConcurrentHashMap<OrderId, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Runs the action while holding the order's lock.
     *
     * @throws OrderBusyException if another operation holds the lock
     */
    public <T> T withLock(OrderId orderId, Supplier<T> action) {
        LockEntry entry = acquire(orderId);
        if (!entry.lock.tryLock()) {
            release(orderId);
            throw new OrderBusyException(orderId);
        }
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(orderId);
        }
    }

    /**
     * Runs the action if the order's lock is free.
     *
     * @return the action's result, or empty if the order was busy
     */
    public <T> Optional<T> tryWithLock(OrderId orderId, Supplier<T> action) {
        try {
            return Optional.ofNullable(withLock(orderId, action));
        } catch (OrderBusyException e) {
            return Optional.empty();
        }
    }

    /**
     * Number of orders with an operation currently in progress.
     */
    public int activeCount() {
        return (int) locks.values().stream()
                .filter(entry -> entry.lock.isLocked())
                .count();
    }

    private LockEntry acquire(OrderId orderId) {
        return locks.compute(orderId, (id, entry) -> {
            LockEntry current = entry != null ? entry : new LockEntry();
            current.references++;
            return current;
        });
    }

    private void release(OrderId orderId) {
        locks.computeIfPresent(orderId, (id, entry) -> --entry.references == 0 ? null : entry);
    }

    // references is only touched inside compute/computeIfPresent for its key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
