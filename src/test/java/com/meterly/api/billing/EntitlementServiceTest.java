package com.meterly.api.billing;

import com.meterly.api.billing.entities.Entitlement;
import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.meterly.api.billing.BillingTestUtils.buildEntitlement;
import static com.meterly.api.billing.BillingTestUtils.buildPlan;
import static com.meterly.api.billing.BillingTestUtils.buildSubscription;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class EntitlementServiceTest {

    @Mock
    private EntitlementRepository entitlementRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    private EntitlementService service;
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        service = new EntitlementService(entitlementRepository, subscriptionRepository);
        val plan = buildPlan(1L, "Basic", "price_basic", Map.of(
            "messages_per_month", 1000,
            "users", -1,
            "leads", 50));

        subscription = buildSubscription(1L, 10L, plan, Subscription.Status.ACTIVE);
        lenient().when(entitlementRepository.saveAll(any())).thenAnswer(i -> i.getArgument(0));
    }

    @Test
    void createEntitlements() {
        when(entitlementRepository.countBySubscriptionId(1L)).thenReturn(0L);

        val entitlements = service.createEntitlements(subscription);

        assertEquals(3, entitlements.size());
        val messages = find(entitlements, "messages_per_month");
        assertEquals(1000, messages.getLimitValue());
        assertEquals(0, messages.getUsed());
        assertEquals(Entitlement.ResetFrequency.MONTHLY, messages.getResetFrequency());
        assertEquals(subscription.getCurrentPeriodEnd(), messages.getResetAt());

        val users = find(entitlements, "users");
        assertEquals(Entitlement.ResetFrequency.NEVER, users.getResetFrequency());
        assertNull(users.getResetAt());
        assertEquals(10L, users.getTenantId());
    }

    @Test
    void createEntitlements_isIdempotent() {
        val existing = List.of(buildEntitlement(subscription, "messages_per_month", 1000, 120));
        when(entitlementRepository.countBySubscriptionId(1L)).thenReturn(1L);
        when(entitlementRepository.findAllBySubscriptionId(1L)).thenReturn(existing);

        assertEquals(existing, service.createEntitlements(subscription));
        verify(entitlementRepository, never()).saveAll(any());
    }

    @Test
    void replaceEntitlements() {
        val entitlements = service.replaceEntitlements(subscription);

        verify(entitlementRepository).deleteAllBySubscriptionId(1L);
        assertEquals(3, entitlements.size());
        entitlements.forEach(e -> assertEquals(0, e.getUsed()));
    }

    @Test
    void getUsageSummary() throws Exception {
        when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
        when(entitlementRepository.findAllBySubscriptionId(1L)).thenReturn(List.of(
            buildEntitlement(subscription, "leads", 50, 10),
            buildEntitlement(subscription, "messages_per_month", 1000, 120)));

        assertEquals(2, service.getUsageSummary(10L, 1L).size());
        assertThrows(SubscriptionNotFoundException.class, () -> service.getUsageSummary(11L, 1L));
    }

    private static Entitlement find(List<Entitlement> entitlements, String feature) {
        return entitlements.stream()
            .filter(e -> feature.equals(e.getFeature()))
            .findFirst()
            .orElseThrow();
    }
}
