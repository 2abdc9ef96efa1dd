package com.meterly.api.billing.entities;

import com.meterly.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions with {@link Plan}.
 */
@Repository
public interface PlanRepository extends BasicEntityRepository<Plan> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e where e.name = ?1 and e.isActive = true and" + WHERE_ACTIVE_CLAUSE + "order by e.id")
    List<Plan> findAllActiveByName(@NonNull String name);

    /**
     * @return the oldest active plan with the given name, if one exists.
     */
    @NonNull
    @Transactional(readOnly = true)
    default Optional<Plan> findActiveByName(@NonNull String name) {
        return findAllActiveByName(name).stream().findFirst();
    }

    /**
     * Retired plans still match, since live subscriptions may reference their prices.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e where e.stripePriceId = ?1 and" + WHERE_ACTIVE_CLAUSE)
    Optional<Plan> findByStripePriceId(@NonNull String stripePriceId);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e where e.isActive = true and e.isPublic = true and" + WHERE_ACTIVE_CLAUSE + "order by e.price")
    List<Plan> findAllActivePublic();
}
