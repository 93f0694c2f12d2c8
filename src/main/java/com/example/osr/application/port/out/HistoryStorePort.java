package com.example.osr.application.port.out;

import com.example.osr.application.dto.HistoryFilter;
import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Output port for the durable order history.
 * Every write is committed before the call returns.
 *
 * @throws com.example.osr.application.exception.StorageException from any method when the store fails
 */
public interface HistoryStorePort {

    /**
     * Inserts a new record.
     *
     * @throws com.example.osr.application.exception.DuplicateOrderIdException if the id exists or existed before
     */
    OrderRecord append(OrderRecord record);

    /**
     * Applies the mutator to the stored record as one atomic read-modify-write.
     * The record's last update time is stamped by the store.
     *
     * @return the record as committed
     * @throws com.example.osr.application.exception.OrderNotFoundException if no record exists for the id
     */
    OrderRecord update(OrderId id, Consumer<OrderRecord> mutator);

    Optional<OrderRecord> get(OrderId id);

    /**
     * Lists records in insertion order.
     */
    List<OrderRecord> list(HistoryFilter filter);

    /**
     * Removes a record and retires its id.
     *
     * @return true if a record was removed
     */
    boolean remove(OrderId id);

    List<OrderId> findIdsLastUpdatedBefore(Instant cutoff);
}
