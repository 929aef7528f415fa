package com.dashboard.infrastructure.persistence.repository;

import com.dashboard.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    /**
     * Creates a placeholder user unless one with this id exists.
     * 
     * Single statement, so concurrent ingestion for the same new user cannot
     * fail on the primary key.
     *
     * @return 1 if a row was inserted, 0 if the user already existed
     */
    @Modifying
    @Query(value = "INSERT INTO users (id, email, created_at, first_seen_at, last_seen_at) " +
           "VALUES (:id, :email, NOW(), NOW(), NOW()) " +
           "ON CONFLICT (id) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id, @Param("email") String email);
}
