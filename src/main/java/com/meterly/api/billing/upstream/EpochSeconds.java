package com.meterly.api.billing.upstream;

import lombok.NonNull;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Converts the epoch-second timestamps used throughout Stripe's API objects.
 */
public final class EpochSeconds {

    private EpochSeconds() {
    }

    /**
     * @return the UTC date-time for {@code seconds}, or {@literal null} if it is {@literal null}.
     */
    public static OffsetDateTime toDateTime(Long seconds) {
        return seconds == null ? null : OffsetDateTime.ofInstant(Instant.ofEpochSecond(seconds), ZoneOffset.UTC);
    }

    public static long fromDateTime(@NonNull OffsetDateTime dateTime) {
        return dateTime.toEpochSecond();
    }
}
