package com.meterly.api.platform;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Version;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * <p>
 * {@link BasicEntity} is a {@link MappedSuperclass mapped superclass} that contains the following
 * common fields present in all billing records that must never be hard-deleted.
 * </p>
 * <ol>
 *     <li>{@link BasicEntity#id} - surrogate primary key of the row</li>
 *     <li>{@link BasicEntity#createdAt} - the creation timestamp of the row</li>
 *     <li>{@link BasicEntity#updatedAt} - the last modification timestamp of the row</li>
 *     <li>{@link BasicEntity#deletedAt} - the soft-deletion timestamp of the row</li>
 *     <li>{@link BasicEntity#version} - optimistic lock used by the JPA during update queries</li>
 * </ol>
 *
 * <p>
 * To enable soft deletes, clients must use {@link BasicEntityRepository} for database
 * interactions.
 * </p>
 */
@MappedSuperclass
@Data
@NoArgsConstructor
public abstract class BasicEntity {

    static final String SOFT_DELETE_FIELD = "deletedAt";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(updatable = false)
    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    /**
     * Deletion timestamp of this row in the table. It is used for facilitating soft-deletes.
     */
    private OffsetDateTime deletedAt;

    @Version
    private long version;

    /**
     * @return whether this row has been soft-deleted.
     */
    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Marks this row as deleted, unless it is already deleted.
     */
    public void markDeleted(@NonNull OffsetDateTime at) {
        if (deletedAt == null) {
            deletedAt = at;
        }
    }

    @PrePersist
    void onPrePersist() {
        createdAt = OffsetDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onPreUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
