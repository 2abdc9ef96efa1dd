package com.meterly.api.billing.entities;

import com.meterly.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions with {@link Invoice}.
 */
@Repository
public interface InvoiceRepository extends BasicEntityRepository<Invoice> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.stripeInvoiceId = ?1")
    Optional<Invoice> findByStripeInvoiceId(@NonNull String stripeInvoiceId);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.tenantId = ?1 and e.status in ?2 and" + WHERE_ACTIVE_CLAUSE + "order by e.invoiceDate desc")
    List<Invoice> findAllByTenantIdAndStatusIn(long tenantId, @NonNull Collection<Invoice.Status> statuses);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.subscriptionId = ?1 and e.status in ?2 and" + WHERE_ACTIVE_CLAUSE)
    List<Invoice> findAllBySubscriptionIdAndStatusIn(long subscriptionId, @NonNull Collection<Invoice.Status> statuses);
}
