package com.meterly.api.billing.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A JPA repository declaration for database interactions with {@link UsageEvent}. Usage events are
 * append-only, so it extends the bare {@link Repository} and exposes no update or delete methods.
 */
@org.springframework.stereotype.Repository
public interface UsageEventRepository extends Repository<UsageEvent, Long> {

    @NonNull
    @Transactional
    UsageEvent save(@NonNull UsageEvent event);

    /**
     * @return per event type, the sum of quantities recorded for the subscription within
     * {@code [from, to]}.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.eventType as eventType, sum(e.quantity) as total from UsageEvent e"
        + " where e.subscription.id = ?1 and e.occurredAt >= ?2 and e.occurredAt <= ?3"
        + " group by e.eventType")
    List<UsageTotal> sumQuantitiesByEventType(long subscriptionId, @NonNull OffsetDateTime from, @NonNull OffsetDateTime to);

    @Transactional(readOnly = true)
    @Query("select coalesce(sum(e.quantity), 0) from UsageEvent e"
        + " where e.subscription.id = ?1 and e.eventType = ?2 and e.occurredAt >= ?3 and e.occurredAt <= ?4")
    long sumQuantity(long subscriptionId, @NonNull String eventType, @NonNull OffsetDateTime from, @NonNull OffsetDateTime to);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from UsageEvent e where e.subscription.id = ?1 and e.occurredAt >= ?2 and e.occurredAt <= ?3"
        + " order by e.occurredAt")
    List<UsageEvent> findAllBySubscriptionIdBetween(long subscriptionId, @NonNull OffsetDateTime from, @NonNull OffsetDateTime to);

    /**
     * A projection of the aggregated quantity of one event type.
     */
    interface UsageTotal {

        String getEventType();

        Long getTotal();
    }
}
