package com.dashboard.infrastructure.persistence.repository;

import com.dashboard.infrastructure.persistence.entity.EventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Write path for events. Analytical reads go through the query catalog.
 */
@Repository
public interface EventRepository extends JpaRepository<EventEntity, UUID> {
}
