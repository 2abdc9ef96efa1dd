package com.meterly.api.notification;

import com.meterly.api.contracts.NotificationType;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Published on the application event bus for every accepted notification request.
 */
@Value
public class NotificationRequestedEvent {

    long tenantId;

    @NonNull
    NotificationType type;

    @NonNull
    Map<String, Object> data;

    @NonNull
    OffsetDateTime requestedAt;
}
