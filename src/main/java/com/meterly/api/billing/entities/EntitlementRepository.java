package com.meterly.api.billing.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions with {@link Entitlement}.
 */
@Repository
public interface EntitlementRepository extends CrudRepository<Entitlement, Long> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Entitlement e where e.subscription.id = ?1 order by e.feature")
    List<Entitlement> findAllBySubscriptionId(long subscriptionId);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Entitlement e where e.subscription.id = ?1 and e.feature = ?2")
    Optional<Entitlement> findBySubscriptionIdAndFeature(long subscriptionId, @NonNull String feature);

    @Transactional(readOnly = true)
    @Query("select count(e) from Entitlement e where e.subscription.id = ?1")
    long countBySubscriptionId(long subscriptionId);

    /**
     * Adds {@code amount} to the cached usage counter in a single statement and bumps the row's
     * version, so writers holding an older copy of the entitlement fail their optimistic check.
     *
     * @return the number of updated rows, {@code 0} if the subscription has no such entitlement.
     */
    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update Entitlement e set e.used = e.used + ?3, e.version = e.version + 1"
        + " where e.subscription.id = ?1 and e.feature = ?2")
    int incrementUsage(long subscriptionId, @NonNull String feature, int amount);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("delete from Entitlement e where e.subscription.id = ?1")
    int deleteAllBySubscriptionId(long subscriptionId);
}
