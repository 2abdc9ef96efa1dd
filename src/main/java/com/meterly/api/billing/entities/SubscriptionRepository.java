package com.meterly.api.billing.entities;

import com.meterly.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions with {@link Subscription}.
 */
@Repository
public interface SubscriptionRepository extends BasicEntityRepository<Subscription> {

    /**
     * Looks up a subscription by its Stripe id. Soft-deleted subscriptions are included, since the
     * Stripe id remains reserved by them.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.stripeSubscriptionId = ?1")
    Optional<Subscription> findByStripeSubscriptionId(@NonNull String stripeSubscriptionId);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from Subscription e where e.status in ?1 and" + WHERE_ACTIVE_CLAUSE + "order by e.id")
    List<Long> findIdsByStatusIn(@NonNull Collection<Subscription.Status> statuses);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from Subscription e where e.status in ?1 and e.stripeSubscriptionId is not null and"
        + WHERE_ACTIVE_CLAUSE + "order by e.id")
    List<Long> findLinkedIdsByStatusIn(@NonNull Collection<Subscription.Status> statuses);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from Subscription e where e.status = ?1 and e.trialEnd < ?2 and" + WHERE_ACTIVE_CLAUSE + "order by e.id")
    List<Long> findIdsByStatusAndTrialEndBefore(@NonNull Subscription.Status status, @NonNull OffsetDateTime before);

    /**
     * @return ids of trialing subscriptions whose trial ended before {@code now}.
     */
    @NonNull
    @Transactional(readOnly = true)
    default List<Long> findIdsOfExpiredTrials(@NonNull OffsetDateTime now) {
        return findIdsByStatusAndTrialEndBefore(Subscription.Status.TRIALING, now);
    }

    @Transactional(readOnly = true)
    @Query("select count(e) from Subscription e where e.tenantId = ?1 and e.status in ?2 and" + WHERE_ACTIVE_CLAUSE)
    long countByTenantIdAndStatusIn(long tenantId, @NonNull Collection<Subscription.Status> statuses);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.stripeCustomerId from Subscription e where e.tenantId = ?1 and e.stripeCustomerId is not null"
        + " order by e.createdAt desc")
    List<String> findStripeCustomerIdsByTenantId(long tenantId);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select distinct e.tenantId from Subscription e where e.stripeCustomerId = ?1")
    List<Long> findTenantIdsByStripeCustomerId(@NonNull String stripeCustomerId);
}
