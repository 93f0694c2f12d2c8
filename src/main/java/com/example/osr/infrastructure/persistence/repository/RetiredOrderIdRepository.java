package com.example.osr.infrastructure.persistence.repository;

import com.example.osr.infrastructure.persistence.entity.RetiredOrderIdEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA Repository for retired order ids.
 */
@Repository
public interface RetiredOrderIdRepository extends JpaRepository<RetiredOrderIdEntity, String> {
}
