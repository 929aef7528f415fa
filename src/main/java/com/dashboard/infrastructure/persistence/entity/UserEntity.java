package com.dashboard.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Tracked user. Cohorts are keyed on firstSeenAt and acquisitionSource.
 * 
 * Rows are created by event ingestion through
 * {@link com.dashboard.infrastructure.persistence.repository.UserRepository#insertIfAbsent}.
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    private Instant createdAt;

    private Instant firstSeenAt;

    private Instant lastSeenAt;

    @Column(length = 100)
    private String acquisitionSource;

    @Column(length = 2, columnDefinition = "CHAR(2)")
    private String countryCode;

    @Column(length = 50)
    private String deviceType;
}
