package com.meterly.api.billing.entities;

import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DataJpaTest
public class UsageEventRepositoryTest {

    @Autowired
    private PlanRepository planRepository;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private UsageEventRepository usageEventRepository;

    @Autowired
    private EntitlementRepository entitlementRepository;

    private Subscription subscription;
    private OffsetDateTime now;

    @BeforeEach
    void setUp() {
        val plan = planRepository.save(
            Plan.builder()
                .name("Basic")
                .price(new BigDecimal("29.00"))
                .build());

        subscription = subscriptionRepository.save(
            Subscription.builder()
                .tenantId(10L)
                .plan(plan)
                .status(Subscription.Status.ACTIVE)
                .build());

        now = OffsetDateTime.now();
    }

    @Test
    void sumQuantitiesByEventType() {
        recordUsage("messages_per_month", 700, now.minusDays(2));
        recordUsage("messages_per_month", 500, now.minusDays(1));
        recordUsage("messages_per_month", 300, now.minusDays(40));
        recordUsage("messages_per_month_overage", 200, now.minusHours(1));
        recordUsage("leads", 3, now.minusHours(1));

        val totals = usageEventRepository.sumQuantitiesByEventType(subscription.getId(), now.minusDays(30), now)
            .stream()
            .collect(Collectors.toMap(UsageEventRepository.UsageTotal::getEventType, UsageEventRepository.UsageTotal::getTotal));

        assertEquals(Map.of("messages_per_month", 1200L, "messages_per_month_overage", 200L, "leads", 3L), totals);
        assertEquals(1200, usageEventRepository.sumQuantity(subscription.getId(), "messages_per_month", now.minusDays(30), now));
        assertEquals(0, usageEventRepository.sumQuantity(subscription.getId(), "users", now.minusDays(30), now));
        assertEquals(4, usageEventRepository.findAllBySubscriptionIdBetween(subscription.getId(), now.minusDays(3), now).size());
    }

    @Test
    void entitlements_areHardDeleted() {
        entitlementRepository.save(
            Entitlement.builder()
                .tenantId(10L)
                .subscription(subscription)
                .feature("messages_per_month")
                .limitValue(1000)
                .build());

        assertEquals(1, entitlementRepository.countBySubscriptionId(subscription.getId()));
        assertEquals(1, entitlementRepository.deleteAllBySubscriptionId(subscription.getId()));
        assertEquals(0, entitlementRepository.countBySubscriptionId(subscription.getId()));
    }

    private void recordUsage(@NonNull String eventType, int quantity, @NonNull OffsetDateTime occurredAt) {
        usageEventRepository.save(
            UsageEvent.builder()
                .tenantId(10L)
                .subscription(subscription)
                .eventType(eventType)
                .quantity(quantity)
                .occurredAt(occurredAt)
                .build());
    }
}
