package com.example.osr.infrastructure.persistence.repository;

import com.example.osr.infrastructure.persistence.entity.OrderRecordEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for OrderRecordEntity entities.
 */
@Repository
public interface OrderRecordJpaRepository extends JpaRepository<OrderRecordEntity, Long>,
        JpaSpecificationExecutor<OrderRecordEntity> {

    Optional<OrderRecordEntity> findByOrderId(String orderId);

    boolean existsByOrderId(String orderId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderRecordEntity o WHERE o.orderId = :orderId")
    Optional<OrderRecordEntity> findForUpdate(@Param("orderId") String orderId);

    @Query("SELECT o.orderId FROM OrderRecordEntity o WHERE o.lastUpdatedAt < :cutoff ORDER BY o.seq")
    List<String> findOrderIdsLastUpdatedBefore(@Param("cutoff") Instant cutoff);
}
