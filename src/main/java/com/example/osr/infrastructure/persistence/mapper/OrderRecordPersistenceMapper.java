package com.example.osr.infrastructure.persistence.mapper;

import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderRecord;
import com.example.osr.infrastructure.persistence.entity.OrderRecordEntity;
import org.springframework.stereotype.Component;

/**
 * Mapper between OrderRecord domain objects and JPA entities.
 */
@Component
public class OrderRecordPersistenceMapper {

    public OrderRecordEntity toEntity(OrderRecord record) {
        OrderRecordEntity entity = new OrderRecordEntity();
        entity.setOrderId(record.getId().getValue());
        entity.setOsrId(record.getOsrId());
        entity.setKind(record.getKind());
        entity.setDocument(record.getDocument());
        entity.setDocumentOrderNumber(record.getDocumentOrderNumber());
        entity.setCreatedAt(record.getCreatedAt());
        entity.setDryRun(record.isDryRun());
        copyState(record, entity);
        return entity;
    }

    /**
     * Copies the mutable lifecycle state onto an existing entity.
     */
    public void copyState(OrderRecord record, OrderRecordEntity entity) {
        entity.setStatus(record.getStatus());
        entity.setRemoteReference(record.getRemoteReference());
        entity.setAttempts(record.getAttempts());
        entity.setLastError(truncate(record.getLastError()));
        entity.setLastUpdatedAt(record.getLastUpdatedAt());
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= OrderRecordEntity.LAST_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, OrderRecordEntity.LAST_ERROR_LENGTH);
    }

    public OrderRecord toDomain(OrderRecordEntity entity) {
        return OrderRecord.reconstitute(
                OrderId.of(entity.getOrderId()),
                entity.getOsrId(),
                entity.getKind(),
                entity.getDocument(),
                entity.getDocumentOrderNumber(),
                entity.getStatus(),
                entity.getCreatedAt(),
                entity.getLastUpdatedAt(),
                entity.getRemoteReference(),
                entity.getAttempts(),
                entity.getLastError(),
                entity.isDryRun()
        );
    }
}
