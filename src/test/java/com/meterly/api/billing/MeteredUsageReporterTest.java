package com.meterly.api.billing;

import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.entities.UsageEventRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.upstream.StripeApi;
import com.stripe.exception.ApiConnectionException;
import com.stripe.model.Price;
import com.stripe.model.SubscriptionItem;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.meterly.api.billing.BillingTestUtils.buildPlan;
import static com.meterly.api.billing.BillingTestUtils.buildSnapshot;
import static com.meterly.api.billing.BillingTestUtils.buildStripeSubscription;
import static com.meterly.api.billing.BillingTestUtils.buildSubscription;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class MeteredUsageReporterTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private UsageEventRepository usageEventRepository;

    @Mock
    private StripeApi stripeApi;

    private MeteredUsageReporter reporter;
    private Subscription subscription;
    private com.stripe.model.Subscription remote;
    private EnforcementSnapshot snapshot;

    @BeforeEach
    void setUp() throws Exception {
        reporter = new MeteredUsageReporter(subscriptionRepository, usageEventRepository, stripeApi);
        subscription = buildSubscription(1L, 10L, buildPlan(1L, "Pro", "price_pro", Map.of()), Subscription.Status.ACTIVE);
        remote = buildStripeSubscription("sub_1", "active", "price_pro", "cus_10");
        snapshot = buildSnapshot(OffsetDateTime.now());

        lenient().when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
        lenient().when(stripeApi.getSubscription("sub_1")).thenReturn(remote);
    }

    @Test
    void report_setsUsageOfMeteredItems() throws Exception {
        val messages = buildItem("si_messages", "metered", Map.of("feature", "messages_per_month"), null);
        val leads = buildItem("si_leads", "metered", Map.of(), "leads");
        remote.getItems().setData(List.of(remote.getItems().getData().get(0), messages, leads));

        val periodStart = subscription.getCurrentPeriodStart();
        when(usageEventRepository.sumQuantity(1L, "messages_per_month", periodStart, snapshot.getNow())).thenReturn(1250L);
        when(usageEventRepository.sumQuantity(1L, "leads", periodStart, snapshot.getNow())).thenReturn(0L);

        assertEquals(SweepReport.Outcome.UPDATED, reporter.report(1L, snapshot));

        val window = periodStart.toEpochSecond();
        verify(stripeApi).reportUsage("si_messages", 1250L, String.format("usage-si_messages-%d-1250", window));
        verify(stripeApi).reportUsage("si_leads", 0L, String.format("usage-si_leads-%d-0", window));
    }

    @Test
    void report_skipsLicensedItems() throws Exception {
        val seats = buildItem("si_seats", "licensed", Map.of("feature", "users"), null);
        remote.getItems().setData(List.of(seats));

        assertEquals(SweepReport.Outcome.NO_OP, reporter.report(1L, snapshot));
        verify(stripeApi, never()).reportUsage(any(), anyLong(), any());
    }

    @Test
    void report_withoutStripeSubscription() throws Exception {
        subscription.setStripeSubscriptionId(null);

        assertEquals(SweepReport.Outcome.NO_OP, reporter.report(1L, snapshot));
        verify(stripeApi, never()).getSubscription(any());
    }

    @Test
    void report_continuesPastFailedItem() throws Exception {
        val messages = buildItem("si_messages", "metered", Map.of("feature", "messages_per_month"), null);
        val leads = buildItem("si_leads", "metered", Map.of("feature", "leads"), null);
        remote.getItems().setData(List.of(messages, leads));
        when(usageEventRepository.sumQuantity(anyLong(), any(), any(), any())).thenReturn(5L);
        when(stripeApi.reportUsage(any(), anyLong(), any()))
            .thenThrow(new ApiConnectionException("timeout"))
            .thenReturn(null);

        val e = assertThrows(ProcessorException.class, () -> reporter.report(1L, snapshot));
        assertTrue(e.isRetryable());
        verify(stripeApi, times(2)).reportUsage(any(), anyLong(), any());
        verify(stripeApi).reportUsage(eq("si_leads"), eq(5L), any());
    }

    @Test
    void report_withMissingSubscription() {
        when(subscriptionRepository.findById(2L)).thenReturn(Optional.empty());
        assertThrows(SubscriptionNotFoundException.class, () -> reporter.report(2L, snapshot));
    }

    @NonNull
    private static SubscriptionItem buildItem(
        @NonNull String id,
        @NonNull String usageType,
        @NonNull Map<String, String> metadata,
        String lookupKey
    ) {
        val recurring = new Price.Recurring();
        recurring.setUsageType(usageType);

        val price = new Price();
        price.setId("price_" + id);
        price.setRecurring(recurring);
        price.setMetadata(metadata);
        price.setLookupKey(lookupKey);

        val item = new SubscriptionItem();
        item.setId(id);
        item.setPrice(price);
        return item;
    }
}
