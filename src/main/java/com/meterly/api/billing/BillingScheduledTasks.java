package com.meterly.api.billing;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Collection of scheduled tasks for {@link EnforcementJobs}.
 */
@Component
@Slf4j
class BillingScheduledTasks {

    private final BillingConfiguration billingConfig;
    private final EnforcementJobs enforcementJobs;

    @Autowired
    BillingScheduledTasks(@NonNull BillingConfiguration billingConfig, @NonNull EnforcementJobs enforcementJobs) {
        this.billingConfig = billingConfig;
        this.enforcementJobs = enforcementJobs;
    }

    @Scheduled(cron = "${app.billing.quota-enforcement-schedule}")
    void enforceQuotas() {
        log.info("enforcing usage quotas");
        enforcementJobs.enforceQuotas(snapshot());
    }

    @Scheduled(cron = "${app.billing.trial-expiry-schedule}")
    void expireTrials() {
        log.info("expiring ended trials");
        enforcementJobs.expireTrials(snapshot());
    }

    @Scheduled(cron = "${app.billing.dunning-schedule}")
    void runDunning() {
        log.info("running dunning");
        enforcementJobs.runDunning(snapshot());
    }

    @Scheduled(cron = "${app.billing.subscription-sync-schedule}")
    void syncSubscriptions() {
        log.info("syncing subscriptions with stripe");
        enforcementJobs.syncSubscriptions(snapshot());
    }

    @Scheduled(cron = "${app.billing.usage-sync-schedule}")
    void syncMeteredUsage() {
        log.info("reporting metered usage to stripe");
        enforcementJobs.syncMeteredUsage(snapshot());
    }

    @NonNull
    private EnforcementSnapshot snapshot() {
        return EnforcementSnapshot.of(billingConfig, OffsetDateTime.now());
    }
}
