package com.taskboard.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

import org.springframework.data.annotation.LastModifiedDate;

/**
 * Adds an {@code updated_at} column maintained by JPA auditing.
 * Bulk JPQL updates bypass auditing and must set the column themselves.
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity extends AbstractCreatedEntity {

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
