package com.meterly.api.billing;

import com.meterly.api.billing.exceptions.ErrorKind;
import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The result of one enforcement sweep: an outcome for every subscription it visited. Failures are
 * recorded as entries with an {@link ErrorKind} instead of being thrown, so one bad subscription
 * never stops a sweep.
 */
@Value
public class SweepReport {

    @NonNull
    String job;

    @NonNull
    List<Entry> entries;

    /**
     * @return the number of entries with the given outcome.
     */
    public long count(@NonNull Outcome outcome) {
        return entries.stream().filter(e -> e.getOutcome() == outcome).count();
    }

    @NonNull
    public List<Entry> getFailures() {
        List<Entry> failures = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.getErrorKind() != null) {
                failures.add(entry);
            }
        }

        return failures;
    }

    @NonNull
    public Map<Outcome, Long> summarize() {
        Map<Outcome, Long> summary = new EnumMap<>(Outcome.class);
        for (Entry entry : entries) {
            summary.merge(entry.getOutcome(), 1L, Long::sum);
        }

        return summary;
    }

    @Override
    public String toString() {
        return String.format("%s: %d subscriptions, %s", job, entries.size(), summarize());
    }

    public enum Outcome {
        NO_OP,
        UPDATED,
        BILLED,
        BILLING_FAILED,
        TRIAL_CONVERTED,
        DOWNGRADED_TO_FREE,
        MOVED_TO_PAST_DUE,
        REACTIVATED,
        REMINDED,
        FINAL_NOTICE_SENT,
        CANCELED,
        FAILED,
    }

    @Value
    public static class Entry {

        long subscriptionId;

        @NonNull
        Outcome outcome;

        /**
         * Set only for failed entries.
         */
        ErrorKind errorKind;

        String message;

        @NonNull
        static Entry of(long subscriptionId, @NonNull Outcome outcome) {
            return new Entry(subscriptionId, outcome, null, null);
        }

        @NonNull
        static Entry failed(long subscriptionId, @NonNull Outcome outcome, @NonNull ErrorKind kind, String message) {
            return new Entry(subscriptionId, outcome, kind, message);
        }
    }

    /**
     * Collects entries while a sweep runs.
     */
    static class Collector {

        private final String job;
        private final List<Entry> entries = new ArrayList<>();

        Collector(@NonNull String job) {
            this.job = job;
        }

        void add(@NonNull Entry entry) {
            entries.add(entry);
        }

        void addAll(@NonNull List<Entry> more) {
            entries.addAll(more);
        }

        @NonNull
        SweepReport build() {
            return new SweepReport(job, Collections.unmodifiableList(new ArrayList<>(entries)));
        }
    }
}
