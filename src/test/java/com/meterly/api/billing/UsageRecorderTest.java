package com.meterly.api.billing;

import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.entities.UsageEvent;
import com.meterly.api.billing.entities.UsageEventRepository;
import com.meterly.api.billing.exceptions.InvalidUsageException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Map;
import java.util.Optional;

import static com.meterly.api.billing.BillingTestUtils.buildEntitlement;
import static com.meterly.api.billing.BillingTestUtils.buildPlan;
import static com.meterly.api.billing.BillingTestUtils.buildSubscription;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class UsageRecorderTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private EntitlementRepository entitlementRepository;

    @Mock
    private UsageEventRepository usageEventRepository;

    private UsageRecorder recorder;
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        recorder = new UsageRecorder(subscriptionRepository, entitlementRepository, usageEventRepository);
        subscription = buildSubscription(1L, 10L, buildPlan(1L, "Pro", "price_pro", Map.of("messages_per_month", 1000)),
            Subscription.Status.ACTIVE);

        lenient().when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
        lenient().when(usageEventRepository.save(any())).thenAnswer(i -> i.getArgument(0));
    }

    @Test
    void record_incrementsMatchingEntitlement() throws Exception {
        when(entitlementRepository.incrementUsage(1L, "messages_per_month", 5)).thenReturn(1);

        val event = recorder.record(10L, 1L, "messages_per_month", 5, Map.of("channel", "web"));

        assertEquals(5, event.getQuantity());
        assertEquals(10L, event.getTenantId());
        assertEquals("web", event.getMetadata().get("channel"));
        verify(entitlementRepository).incrementUsage(1L, "messages_per_month", 5);
        verify(entitlementRepository, never()).save(any());
    }

    @Test
    void record_withUnmeteredFeature() throws Exception {
        when(entitlementRepository.incrementUsage(1L, "api_calls", 1)).thenReturn(0);
        val event = recorder.record(10L, 1L, "api_calls", 1, null);
        assertEquals("api_calls", event.getEventType());
    }

    @Test
    void record_withInvalidInput() {
        assertThrows(InvalidUsageException.class, () -> recorder.record(10L, 1L, "leads", 0, null));
        assertThrows(InvalidUsageException.class, () -> recorder.record(10L, 1L, " ", 1, null));
        assertThrows(SubscriptionNotFoundException.class, () -> recorder.record(11L, 1L, "leads", 1, null));

        when(subscriptionRepository.findById(2L)).thenReturn(Optional.empty());
        assertThrows(SubscriptionNotFoundException.class, () -> recorder.record(10L, 2L, "leads", 1, null));
        verify(usageEventRepository, never()).save(any());
    }

    @Test
    void recordUsage() {
        lenient().when(subscriptionRepository.findById(2L)).thenReturn(Optional.empty());

        assertTrue(recorder.recordUsage(1L, "leads", 3, null));
        assertFalse(recorder.recordUsage(1L, "leads", -1, null));
        assertFalse(recorder.recordUsage(2L, "leads", 1, null));

        when(usageEventRepository.save(any())).thenThrow(new DataIntegrityViolationException("test error"));
        assertFalse(recorder.recordUsage(1L, "leads", 1, null));
    }

    @Test
    void recordUsage_savesEventBeforeCounter() {
        assertTrue(recorder.recordUsage(1L, "leads", 2, Map.of("source", "import")));

        val captor = ArgumentCaptor.forClass(UsageEvent.class);
        val inOrder = inOrder(usageEventRepository, entitlementRepository);
        inOrder.verify(usageEventRepository).save(captor.capture());
        inOrder.verify(entitlementRepository).incrementUsage(1L, "leads", 2);
        assertEquals(subscription, captor.getValue().getSubscription());
        assertEquals(2, captor.getValue().getQuantity());
    }

    @Test
    void canUse() {
        when(entitlementRepository.findBySubscriptionIdAndFeature(1L, "messages_per_month"))
            .thenReturn(Optional.of(buildEntitlement(subscription, "messages_per_month", 1000, 1000)));
        when(entitlementRepository.findBySubscriptionIdAndFeature(1L, "api_calls")).thenReturn(Optional.empty());

        assertFalse(recorder.canUse(1L, "messages_per_month", 1));
        assertTrue(recorder.canUse(1L, "api_calls", 1_000_000));
    }
}
