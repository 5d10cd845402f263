package com.fourpaws.backend.global.jpa;

import java.time.OffsetDateTime;

import com.fourpaws.backend.global.error.RetryableProblemException;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Version;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Mutable tenant entities: creation and update timestamps plus the optimistic-lock version that
 * workflow operations compare against the caller's {@code expectedVersion}.
 */
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AbstractTimestampedEntity {

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    /**
     * Fails with {@code CONCURRENT_MODIFICATION} when the caller read a different version than
     * the row now locked for update. A null expectation skips the check.
     */
    public void checkVersion(Long expectedVersion, String entityType) {
        if (expectedVersion != null && expectedVersion != version) {
            throw RetryableProblemException.concurrentModification(entityType);
        }
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
