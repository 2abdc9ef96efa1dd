package com.meterly.api.billing;

import com.meterly.api.billing.entities.Entitlement;
import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.Plan;
import com.meterly.api.billing.entities.PlanRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.entities.UsageEventRepository;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import(UsageRecorder.class)
public class UsageRecorderJpaTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private UsageRecorder recorder;

    @Autowired
    private PlanRepository planRepository;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private EntitlementRepository entitlementRepository;

    @Autowired
    private UsageEventRepository usageEventRepository;

    private Subscription subscription;
    private long entitlementId;

    @BeforeEach
    void setUp() {
        val plan = planRepository.save(
            Plan.builder()
                .name("Starter")
                .price(new BigDecimal("29.00"))
                .build());

        subscription = subscriptionRepository.save(
            Subscription.builder()
                .tenantId(10L)
                .plan(plan)
                .status(Subscription.Status.ACTIVE)
                .build());

        entitlementId = entitlementRepository.save(
                Entitlement.builder()
                    .tenantId(10L)
                    .subscription(subscription)
                    .feature("messages_per_month")
                    .limitValue(1000)
                    .used(10)
                    .build())
            .getId();

        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void record_withConcurrentCounterWriter() throws Exception {
        // a copy held by another writer, e.g. a quota sweep, before the usage is recorded.
        val held = entitlementRepository.findById(entitlementId).orElseThrow();
        entityManager.detach(held);

        recorder.record(10L, subscription.getId(), "messages_per_month", 5, null);
        recorder.record(10L, subscription.getId(), "messages_per_month", 7, null);
        entityManager.clear();

        val current = entitlementRepository.findById(entitlementId).orElseThrow();
        assertEquals(22, current.getUsed());
        assertEquals(held.getVersion() + 2, current.getVersion());
        assertEquals(12, usageEventRepository.sumQuantity(
            subscription.getId(), "messages_per_month", OffsetDateTime.now().minusDays(1), OffsetDateTime.now()));

        // the other writer loses its optimistic check instead of overwriting the recorded usage.
        entityManager.clear();
        held.setUsed(0);
        assertThrows(OptimisticLockingFailureException.class, () -> entitlementRepository.save(held));
    }

    @Test
    void record_withUnmeteredFeature() throws Exception {
        recorder.record(10L, subscription.getId(), "api_calls", 3, null);
        entityManager.clear();

        assertEquals(10, entitlementRepository.findById(entitlementId).orElseThrow().getUsed());
        assertEquals(3, usageEventRepository.sumQuantity(
            subscription.getId(), "api_calls", OffsetDateTime.now().minusDays(1), OffsetDateTime.now()));
    }
}
