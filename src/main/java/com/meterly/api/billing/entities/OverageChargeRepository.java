package com.meterly.api.billing.entities;

import com.meterly.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions with {@link OverageCharge}.
 */
@Repository
public interface OverageChargeRepository extends BasicEntityRepository<OverageCharge> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from OverageCharge e where e.subscriptionId = ?1 and e.status = ?2 and"
        + WHERE_ACTIVE_CLAUSE + "order by e.id")
    List<OverageCharge> findAllBySubscriptionIdAndStatus(long subscriptionId, @NonNull OverageCharge.Status status);
}
