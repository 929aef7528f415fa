package com.dashboard.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entity representing a tracked user event.
 * 
 * Source table for the hourly metrics, cohort and funnel materialized views.
 * 
 * Indexing Strategy:
 * - created_at for time-range scans
 * - (user_id, created_at) for cohort activity
 * - (session_id, created_at) for funnel reconstruction
 * - (event_type, created_at) for per-type aggregation
 * - GIN on metadata for JSON containment filters (schema.sql only)
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_created_at", columnList = "createdAt"),
    @Index(name = "idx_events_user_time", columnList = "userId,createdAt"),
    @Index(name = "idx_events_session", columnList = "sessionId,createdAt"),
    @Index(name = "idx_events_type_time", columnList = "eventType,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(columnDefinition = "UUID")
    private UUID userId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID sessionId;

    @Column(nullable = false, length = 50)
    private String eventType;

    @Column(columnDefinition = "TEXT")
    private String pagePath;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSONB")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
