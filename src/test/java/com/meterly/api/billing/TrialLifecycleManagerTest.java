package com.meterly.api.billing;

import com.meterly.api.billing.entities.Entitlement;
import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.Plan;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.contracts.NotificationServiceContract;
import com.meterly.api.contracts.NotificationType;
import com.stripe.exception.ApiConnectionException;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.meterly.api.billing.BillingTestUtils.buildPlan;
import static com.meterly.api.billing.BillingTestUtils.buildSnapshot;
import static com.meterly.api.billing.BillingTestUtils.buildSubscription;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TrialLifecycleManagerTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private EntitlementRepository entitlementRepository;

    @Mock
    private PlanCatalog planCatalog;

    @Mock
    private SubscriptionReconciler reconciler;

    @Mock
    private NotificationServiceContract notificationServiceContract;

    @Mock
    private StripeApi stripeApi;

    private TrialLifecycleManager manager;
    private Subscription subscription;
    private Plan freePlan;

    @BeforeEach
    void setUp() {
        val entitlementService = new EntitlementService(entitlementRepository, subscriptionRepository);
        manager = new TrialLifecycleManager(
            subscriptionRepository,
            planCatalog,
            entitlementService,
            reconciler,
            notificationServiceContract,
            stripeApi);

        val proPlan = buildPlan(2L, "Pro", "price_pro", Map.of("messages_per_month", 5000));
        freePlan = buildPlan(1L, "Free", null, Map.of("messages_per_month", 100));
        subscription = buildSubscription(1L, 10L, proPlan, Subscription.Status.TRIALING);
        subscription.setTrialEnd(OffsetDateTime.now().minusHours(1));

        lenient().when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
        lenient().when(subscriptionRepository.save(any())).thenAnswer(i -> i.getArgument(0));
        lenient().when(entitlementRepository.saveAll(any())).thenAnswer(i -> i.getArgument(0));
    }

    @Test
    void expireTrial_withPaymentMethod() throws Exception {
        when(stripeApi.hasDefaultPaymentMethod("cus_10")).thenReturn(true);

        val outcome = manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now()));

        assertEquals(SweepReport.Outcome.TRIAL_CONVERTED, outcome);
        assertEquals(Subscription.Status.ACTIVE, subscription.getStatus());
        assertEquals("Pro", subscription.getPlan().getName());
        verify(notificationServiceContract).requestNotification(eq(10L), eq(NotificationType.TRIAL_CONVERTED), any());
        verifyNoInteractions(entitlementRepository);
    }

    @Test
    @SuppressWarnings("unchecked")
    void expireTrial_withoutPaymentMethod_movesToFreePlan() throws Exception {
        when(stripeApi.hasDefaultPaymentMethod("cus_10")).thenReturn(false);
        when(planCatalog.findFreePlan("Free")).thenReturn(Optional.of(freePlan));

        val outcome = manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now()));

        assertEquals(SweepReport.Outcome.DOWNGRADED_TO_FREE, outcome);
        assertEquals(freePlan.getId(), subscription.getPlan().getId());
        assertEquals(Subscription.Status.ACTIVE, subscription.getStatus());
        verify(entitlementRepository).deleteAllBySubscriptionId(1L);

        val captor = ArgumentCaptor.forClass(Iterable.class);
        verify(entitlementRepository).saveAll(captor.capture());
        val entitlements = (List<Entitlement>) captor.getValue();
        assertEquals(1, entitlements.size());
        assertEquals("messages_per_month", entitlements.get(0).getFeature());
        assertEquals(100, entitlements.get(0).getLimitValue());
        assertEquals(0, entitlements.get(0).getUsed());

        // the free plan has no stripe price, so the stripe subscription is left as is.
        verify(stripeApi, never()).swapSubscriptionPrice(anyString(), anyString(), anyBoolean());

        val dataCaptor = ArgumentCaptor.forClass(Map.class);
        verify(notificationServiceContract)
            .requestNotification(eq(10L), eq(NotificationType.TRIAL_EXPIRED), dataCaptor.capture());
        assertEquals(true, dataCaptor.getValue().get("downgraded_to_free"));
    }

    @Test
    void expireTrial_withoutPaymentMethod_swapsPricedFreePlan() throws Exception {
        freePlan.setStripePriceId("price_free");
        val remote = BillingTestUtils.buildStripeSubscription("sub_1", "active", "price_free", "cus_10");
        when(stripeApi.hasDefaultPaymentMethod("cus_10")).thenReturn(false);
        when(planCatalog.findFreePlan("Free")).thenReturn(Optional.of(freePlan));
        when(stripeApi.swapSubscriptionPrice("sub_1", "price_free", false)).thenReturn(remote);

        // the reconciler moves the subscription to the plan of the new price.
        when(reconciler.apply(subscription, remote)).thenAnswer(i -> {
            subscription.setPlan(freePlan);
            return new SubscriptionReconciler.Result(subscription, Subscription.Status.TRIALING, false, true);
        });

        val outcome = manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now()));

        assertEquals(SweepReport.Outcome.DOWNGRADED_TO_FREE, outcome);
        assertEquals(freePlan, subscription.getPlan());
        assertEquals(Subscription.Status.ACTIVE, subscription.getStatus());

        // entitlements were replaced by the reconciler and are not replaced again.
        verify(entitlementRepository, never()).deleteAllBySubscriptionId(anyLong());
        verify(entitlementRepository, never()).saveAll(any());
    }

    @Test
    void expireTrial_withoutPaymentMethod_swapsPriceUnknownToCatalog() throws Exception {
        freePlan.setStripePriceId("price_free");
        val remote = BillingTestUtils.buildStripeSubscription("sub_1", "active", "price_free", "cus_10");
        when(stripeApi.hasDefaultPaymentMethod("cus_10")).thenReturn(false);
        when(planCatalog.findFreePlan("Free")).thenReturn(Optional.of(freePlan));
        when(stripeApi.swapSubscriptionPrice("sub_1", "price_free", false)).thenReturn(remote);
        when(reconciler.apply(subscription, remote))
            .thenReturn(new SubscriptionReconciler.Result(subscription, Subscription.Status.TRIALING, false, false));

        manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now()));

        assertEquals(freePlan, subscription.getPlan());
        verify(entitlementRepository, times(1)).deleteAllBySubscriptionId(1L);
        verify(entitlementRepository, times(1)).saveAll(any());
    }

    @Test
    void expireTrial_withoutPaymentMethodOrFreePlan() throws Exception {
        when(stripeApi.hasDefaultPaymentMethod("cus_10")).thenReturn(false);
        when(planCatalog.findFreePlan("Free")).thenReturn(Optional.empty());

        val outcome = manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now()));

        assertEquals(SweepReport.Outcome.MOVED_TO_PAST_DUE, outcome);
        assertEquals(Subscription.Status.PAST_DUE, subscription.getStatus());
        verify(notificationServiceContract).requestNotification(eq(10L), eq(NotificationType.TRIAL_EXPIRED), any());
    }

    @ParameterizedTest
    @EnumSource(value = Subscription.Status.class, names = {"ACTIVE", "PAST_DUE", "UNPAID", "CANCELED", "INCOMPLETE"})
    void expireTrial_whenNotTrialing(Subscription.Status status) throws Exception {
        subscription.setStatus(status);

        assertEquals(SweepReport.Outcome.NO_OP, manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now())));
        assertEquals(status, subscription.getStatus());
        verifyNoInteractions(stripeApi, planCatalog, notificationServiceContract, entitlementRepository);
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void expireTrial_beforeTrialEnd() throws Exception {
        subscription.setTrialEnd(OffsetDateTime.now().plusDays(1));
        assertEquals(SweepReport.Outcome.NO_OP, manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now())));
        verifyNoInteractions(stripeApi);
    }

    @Test
    void expireTrial_withStripeError() throws Exception {
        when(stripeApi.hasDefaultPaymentMethod("cus_10")).thenThrow(new ApiConnectionException("timeout"));

        assertThrows(ProcessorException.class, () -> manager.expireTrial(1L, buildSnapshot(OffsetDateTime.now())));
        assertEquals(Subscription.Status.TRIALING, subscription.getStatus());
        verify(subscriptionRepository, never()).save(any());
    }
}
