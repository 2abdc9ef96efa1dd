package com.meterly.api.billing;

import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ErrorKind;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.OffsetDateTime;
import java.util.List;

import static com.meterly.api.billing.BillingTestUtils.buildSnapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class EnforcementJobsTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private QuotaEnforcer quotaEnforcer;

    @Mock
    private TrialLifecycleManager trialLifecycleManager;

    @Mock
    private DunningService dunningService;

    @Mock
    private SubscriptionService subscriptionService;

    @Mock
    private MeteredUsageReporter meteredUsageReporter;

    private EnforcementJobs jobs;
    private EnforcementSnapshot snapshot;

    @BeforeEach
    void setUp() {
        jobs = new EnforcementJobs(subscriptionRepository, quotaEnforcer, trialLifecycleManager, dunningService, subscriptionService,
            meteredUsageReporter);
        snapshot = buildSnapshot(OffsetDateTime.now());
    }

    @Test
    void enforceQuotas_continuesPastFailures() throws Exception {
        when(subscriptionRepository.findIdsByStatusIn(EnforcementJobs.ENFORCED_STATUSES)).thenReturn(List.of(1L, 2L, 3L));
        when(quotaEnforcer.enforce(1L, snapshot)).thenThrow(new DataIntegrityViolationException("constraint"));
        when(quotaEnforcer.enforce(2L, snapshot)).thenReturn(List.of(
            SweepReport.Entry.of(2L, SweepReport.Outcome.BILLED),
            SweepReport.Entry.failed(2L, SweepReport.Outcome.BILLING_FAILED, ErrorKind.PROCESSOR, "card declined")));
        when(quotaEnforcer.enforce(3L, snapshot)).thenThrow(new SubscriptionNotFoundException("subscription does not exist"));

        val report = jobs.enforceQuotas(snapshot);

        assertEquals("enforce-quotas", report.getJob());
        assertEquals(4, report.getEntries().size());
        assertEquals(1, report.count(SweepReport.Outcome.BILLED));
        assertEquals(3, report.getFailures().size());
        assertEquals(ErrorKind.PERSISTENCE, report.getEntries().get(0).getErrorKind());
        assertEquals(ErrorKind.VALIDATION, report.getEntries().get(3).getErrorKind());
        assertEquals(SweepReport.Outcome.FAILED, report.getEntries().get(3).getOutcome());
    }

    @Test
    void expireTrials() throws Exception {
        when(subscriptionRepository.findIdsOfExpiredTrials(snapshot.getNow())).thenReturn(List.of(1L, 2L));
        when(trialLifecycleManager.expireTrial(1L, snapshot)).thenReturn(SweepReport.Outcome.TRIAL_CONVERTED);
        when(trialLifecycleManager.expireTrial(2L, snapshot)).thenReturn(SweepReport.Outcome.DOWNGRADED_TO_FREE);

        val report = jobs.expireTrials(snapshot);

        assertTrue(report.getFailures().isEmpty());
        assertEquals(1, report.count(SweepReport.Outcome.TRIAL_CONVERTED));
        assertEquals(1, report.count(SweepReport.Outcome.DOWNGRADED_TO_FREE));
    }

    @Test
    void runDunning_recordsProcessorFailures() throws Exception {
        when(subscriptionRepository.findLinkedIdsByStatusIn(EnforcementJobs.DUNNING_STATUSES)).thenReturn(List.of(1L, 2L));
        when(dunningService.process(1L, snapshot)).thenThrow(new ProcessorException("stripe is unavailable", true));
        when(dunningService.process(2L, snapshot)).thenReturn(SweepReport.Outcome.REMINDED);

        val report = jobs.runDunning(snapshot);

        val failure = report.getFailures().get(0);
        assertEquals(1L, failure.getSubscriptionId());
        assertEquals(ErrorKind.PROCESSOR, failure.getErrorKind());
        assertEquals("stripe is unavailable", failure.getMessage());

        val reminded = report.getEntries().get(1);
        assertEquals(SweepReport.Outcome.REMINDED, reminded.getOutcome());
        assertNull(reminded.getErrorKind());
    }

    @Test
    void syncSubscriptions() throws Exception {
        when(subscriptionRepository.findLinkedIdsByStatusIn(EnforcementJobs.SYNCED_STATUSES)).thenReturn(List.of(5L));
        when(subscriptionService.syncFromProcessor(eq(5L), any())).thenReturn(SweepReport.Outcome.UPDATED);

        val report = jobs.syncSubscriptions(snapshot);

        assertEquals(1, report.count(SweepReport.Outcome.UPDATED));
        verify(subscriptionService).syncFromProcessor(5L, snapshot.getNow());
    }

    @Test
    void syncMeteredUsage() throws Exception {
        when(subscriptionRepository.findLinkedIdsByStatusIn(EnforcementJobs.ENFORCED_STATUSES)).thenReturn(List.of(1L, 2L));
        when(meteredUsageReporter.report(1L, snapshot)).thenReturn(SweepReport.Outcome.UPDATED);
        when(meteredUsageReporter.report(2L, snapshot)).thenThrow(new ProcessorException("stripe is unavailable", true));

        val report = jobs.syncMeteredUsage(snapshot);

        assertEquals("sync-metered-usage", report.getJob());
        assertEquals(1, report.count(SweepReport.Outcome.UPDATED));
        assertEquals(1, report.getFailures().size());
        assertEquals(ErrorKind.PROCESSOR, report.getFailures().get(0).getErrorKind());
    }
}
