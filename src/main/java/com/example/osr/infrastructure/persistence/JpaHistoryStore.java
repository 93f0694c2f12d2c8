package com.example.osr.infrastructure.persistence;

import com.example.osr.application.dto.HistoryFilter;
import com.example.osr.application.exception.DuplicateOrderIdException;
import com.example.osr.application.exception.OrderNotFoundException;
import com.example.osr.application.exception.StorageException;
import com.example.osr.application.port.out.HistoryStorePort;
import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderRecord;
import com.example.osr.infrastructure.persistence.entity.OrderRecordEntity;
import com.example.osr.infrastructure.persistence.entity.RetiredOrderIdEntity;
import com.example.osr.infrastructure.persistence.mapper.OrderRecordPersistenceMapper;
import com.example.osr.infrastructure.persistence.repository.OrderRecordJpaRepository;
import com.example.osr.infrastructure.persistence.repository.RetiredOrderIdRepository;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * History store backed by Spring Data JPA.
 * Every write runs in its own transaction and is flushed before the call returns;
 * updates hold a pessimistic row lock across the read-modify-write.
 */
@Component
public class JpaHistoryStore implements HistoryStorePort {

    private static final Logger log = LoggerFactory.getLogger(JpaHistoryStore.class);
    private static final Sort INSERTION_ORDER = Sort.by("seq");

    private final OrderRecordJpaRepository records;
    private final RetiredOrderIdRepository retiredIds;
    private final OrderRecordPersistenceMapper mapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaHistoryStore(
            OrderRecordJpaRepository records,
            RetiredOrderIdRepository retiredIds,
            OrderRecordPersistenceMapper mapper,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.records = records;
        this.retiredIds = retiredIds;
        this.mapper = mapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public OrderRecord append(OrderRecord record) {
        String orderId = record.getId().getValue();
        return inTransaction("append " + orderId, () -> {
            if (records.existsByOrderId(orderId) || retiredIds.existsById(orderId)) {
                throw new DuplicateOrderIdException(record.getId());
            }
            try {
                records.saveAndFlush(mapper.toEntity(record));
            } catch (DataIntegrityViolationException e) {
                throw new DuplicateOrderIdException(record.getId());
            }
            log.debug("Appended order record {}", orderId);
            return record;
        });
    }

    @Override
    public OrderRecord update(OrderId orderId, Consumer<OrderRecord> mutator) {
        return inTransaction("update " + orderId, () -> {
            OrderRecordEntity entity = records.findForUpdate(orderId.getValue())
                    .orElseThrow(() -> new OrderNotFoundException(orderId));
            OrderRecord record = mapper.toDomain(entity);
            mutator.accept(record);
            record.touch(clock.instant());
            mapper.copyState(record, entity);
            records.saveAndFlush(entity);
            return record;
        });
    }

    @Override
    public Optional<OrderRecord> get(OrderId orderId) {
        return inTransaction("read " + orderId, () -> records.findByOrderId(orderId.getValue())
                .map(mapper::toDomain));
    }

    @Override
    public List<OrderRecord> list(HistoryFilter filter) {
        return inTransaction("list", () -> records.findAll(matching(filter), INSERTION_ORDER).stream()
                .map(mapper::toDomain)
                .toList());
    }

    @Override
    public boolean remove(OrderId orderId) {
        return inTransaction("remove " + orderId, () -> {
            Optional<OrderRecordEntity> entity = records.findForUpdate(orderId.getValue());
            if (entity.isEmpty()) {
                return false;
            }
            records.delete(entity.get());
            retiredIds.save(new RetiredOrderIdEntity(orderId.getValue(), clock.instant()));
            records.flush();
            log.debug("Removed order record {}", orderId);
            return true;
        });
    }

    @Override
    public List<OrderId> findIdsLastUpdatedBefore(Instant cutoff) {
        return inTransaction("scan", () -> records.findOrderIdsLastUpdatedBefore(cutoff).stream()
                .map(OrderId::of)
                .toList());
    }

    private static Specification<OrderRecordEntity> matching(HistoryFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (!filter.statuses().isEmpty()) {
                predicates.add(root.get("status").in(filter.statuses()));
            }
            if (filter.osrId() != null) {
                predicates.add(cb.equal(root.get("osrId"), filter.osrId()));
            }
            if (filter.updatedAfter() != null) {
                predicates.add(cb.greaterThan(root.<Instant>get("lastUpdatedAt"), filter.updatedAfter()));
            }
            if (filter.updatedBefore() != null) {
                predicates.add(cb.lessThan(root.<Instant>get("lastUpdatedAt"), filter.updatedBefore()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("History store failed to {}: {}", operation, e.getMessage());
            throw new StorageException("History store failed to " + operation, e);
        }
    }
}
