package com.meterly.api.platform;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * <p>
 * {@link BasicEntityRepository} is a direct descendant of Spring's {@link CrudRepository}. It
 * implements soft-deletes for the descendants of {@link BasicEntity}. Billing history is never
 * hard-deleted, so all delete operations only set {@link BasicEntity#getDeletedAt()}.</p>
 * <p>
 * All read methods from the {@link CrudRepository} are overridden to skip soft-deleted entities.
 * {@link BasicEntityRepository} <b>doesn't support cascaded operations</b>. Any cascaded deletes
 * must be manually handled by the clients.</p>
 *
 * @param <T> type of the {@link BasicEntity}.
 */
@NoRepositoryBean
public interface BasicEntityRepository<T extends BasicEntity> extends CrudRepository<T, Long> {

    String WHERE_ACTIVE_CLAUSE = " e." + BasicEntity.SOFT_DELETE_FIELD + " is null ";

    /**
     * Retrieves an undeleted entity by its id.
     *
     * @param id must not be {@literal null}.
     * @return the entity with the given id or {@literal Optional#empty()} if none found.
     */
    @Override
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from #{#entityName} e where e.id = ?1 and" + WHERE_ACTIVE_CLAUSE)
    Optional<T> findById(@NonNull Long id);

    @Override
    @Transactional(readOnly = true)
    default boolean existsById(@NonNull Long id) {
        return findById(id).isPresent();
    }

    /**
     * Returns all undeleted instances of the type.
     */
    @Override
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from #{#entityName} e where" + WHERE_ACTIVE_CLAUSE)
    Iterable<T> findAll();

    @Override
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from #{#entityName} e where e.id in ?1 and" + WHERE_ACTIVE_CLAUSE)
    Iterable<T> findAllById(@NonNull Iterable<Long> ids);

    @Override
    @Transactional(readOnly = true)
    @Query("select count(e) from #{#entityName} e where" + WHERE_ACTIVE_CLAUSE)
    long count();

    /**
     * Marks the given entity as deleted.
     */
    @Override
    @Transactional
    default void delete(@NonNull T entity) {
        entity.markDeleted(OffsetDateTime.now());
        save(entity);
    }

    /**
     * Marks the entity with the given id as deleted.
     */
    @Override
    @Transactional
    default void deleteById(@NonNull Long id) {
        findById(id).ifPresent(this::delete);
    }

    @Override
    @Transactional
    default void deleteAllById(@NonNull Iterable<? extends Long> ids) {
        ids.forEach(this::deleteById);
    }

    @Override
    @Transactional
    default void deleteAll(@NonNull Iterable<? extends T> entities) {
        entities.forEach(this::delete);
    }

    @Override
    default void deleteAll() {
        throw new UnsupportedOperationException("deleting all entities is not supported");
    }
}
