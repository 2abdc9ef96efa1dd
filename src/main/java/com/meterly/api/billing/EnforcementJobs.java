package com.meterly.api.billing;

import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ErrorKind;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.ValidationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * <p>
 * Sweeps over subscriptions that enforce limits, trials and payments. Each subscription is
 * processed in its own transaction, so a failure rolls back only that subscription's changes and
 * the sweep carries on with the next one.</p>
 * <p>
 * All sweeps are idempotent and safe to run again, e.g. after a crash.</p>
 */
@Service
@Slf4j
class EnforcementJobs {

    static final Set<Subscription.Status> ENFORCED_STATUSES = EnumSet.of(
        Subscription.Status.ACTIVE, Subscription.Status.TRIALING);

    static final Set<Subscription.Status> DUNNING_STATUSES = EnumSet.of(
        Subscription.Status.PAST_DUE, Subscription.Status.UNPAID);

    static final Set<Subscription.Status> SYNCED_STATUSES = EnumSet.complementOf(
        EnumSet.of(Subscription.Status.CANCELED));

    private final SubscriptionRepository subscriptionRepository;
    private final QuotaEnforcer quotaEnforcer;
    private final TrialLifecycleManager trialLifecycleManager;
    private final DunningService dunningService;
    private final SubscriptionService subscriptionService;
    private final MeteredUsageReporter meteredUsageReporter;

    @Autowired
    EnforcementJobs(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull QuotaEnforcer quotaEnforcer,
        @NonNull TrialLifecycleManager trialLifecycleManager,
        @NonNull DunningService dunningService,
        @NonNull SubscriptionService subscriptionService,
        @NonNull MeteredUsageReporter meteredUsageReporter
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.quotaEnforcer = quotaEnforcer;
        this.trialLifecycleManager = trialLifecycleManager;
        this.dunningService = dunningService;
        this.subscriptionService = subscriptionService;
        this.meteredUsageReporter = meteredUsageReporter;
    }

    /**
     * Recomputes usage and bills overage of all active and trialing subscriptions.
     */
    @NonNull
    SweepReport enforceQuotas(@NonNull EnforcementSnapshot snapshot) {
        val report = new SweepReport.Collector("enforce-quotas");
        for (val id : subscriptionRepository.findIdsByStatusIn(ENFORCED_STATUSES)) {
            try {
                report.addAll(quotaEnforcer.enforce(id, snapshot));
            } catch (ValidationException | RuntimeException e) {
                report.add(failure(id, e));
            }
        }

        return finish(report);
    }

    /**
     * Ends trials whose trial end is before the snapshot's time.
     */
    @NonNull
    SweepReport expireTrials(@NonNull EnforcementSnapshot snapshot) {
        val report = new SweepReport.Collector("expire-trials");
        for (val id : subscriptionRepository.findIdsOfExpiredTrials(snapshot.getNow())) {
            try {
                report.add(SweepReport.Entry.of(id, trialLifecycleManager.expireTrial(id, snapshot)));
            } catch (ValidationException | ProcessorException | RuntimeException e) {
                report.add(failure(id, e));
            }
        }

        return finish(report);
    }

    /**
     * Retries payment of past due and unpaid subscriptions, sending reminders and canceling those
     * overdue for too long.
     */
    @NonNull
    SweepReport runDunning(@NonNull EnforcementSnapshot snapshot) {
        val report = new SweepReport.Collector("run-dunning");
        for (val id : subscriptionRepository.findLinkedIdsByStatusIn(DUNNING_STATUSES)) {
            try {
                report.add(SweepReport.Entry.of(id, dunningService.process(id, snapshot)));
            } catch (ValidationException | ProcessorException | RuntimeException e) {
                report.add(failure(id, e));
            }
        }

        return finish(report);
    }

    /**
     * Reconciles every live Stripe-linked subscription with Stripe, applies due plan changes and
     * refreshes outstanding invoices.
     */
    @NonNull
    SweepReport syncSubscriptions(@NonNull EnforcementSnapshot snapshot) {
        val report = new SweepReport.Collector("sync-subscriptions");
        for (val id : subscriptionRepository.findLinkedIdsByStatusIn(SYNCED_STATUSES)) {
            try {
                report.add(SweepReport.Entry.of(id, subscriptionService.syncFromProcessor(id, snapshot.getNow())));
            } catch (ValidationException | ProcessorException | RuntimeException e) {
                report.add(failure(id, e));
            }
        }

        return finish(report);
    }

    /**
     * Reports metered usage of all active and trialing Stripe-linked subscriptions to Stripe.
     */
    @NonNull
    SweepReport syncMeteredUsage(@NonNull EnforcementSnapshot snapshot) {
        val report = new SweepReport.Collector("sync-metered-usage");
        for (val id : subscriptionRepository.findLinkedIdsByStatusIn(ENFORCED_STATUSES)) {
            try {
                report.add(SweepReport.Entry.of(id, meteredUsageReporter.report(id, snapshot)));
            } catch (ValidationException | ProcessorException | RuntimeException e) {
                report.add(failure(id, e));
            }
        }

        return finish(report);
    }

    @NonNull
    private static SweepReport.Entry failure(long subscriptionId, @NonNull Exception e) {
        final ErrorKind kind;
        if (e instanceof ValidationException) {
            kind = ErrorKind.VALIDATION;
            log.warn("skipping subscription {}: {}", subscriptionId, e.getMessage());
        } else if (e instanceof ProcessorException) {
            kind = ErrorKind.PROCESSOR;
            log.warn("skipping subscription {}, retryable={}: {}",
                subscriptionId, ((ProcessorException) e).isRetryable(), e.getMessage());
        } else {
            kind = ErrorKind.PERSISTENCE;
            log.error("failed to process subscription {}", subscriptionId, e);
        }

        return SweepReport.Entry.failed(subscriptionId, SweepReport.Outcome.FAILED, kind, e.getMessage());
    }

    @NonNull
    private static SweepReport finish(@NonNull SweepReport.Collector collector) {
        val report = collector.build();
        log.info("finished sweep {}", report);
        return report;
    }
}
