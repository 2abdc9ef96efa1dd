package com.meterly.api.contracts;

import lombok.NonNull;

import java.util.Map;

/**
 * Defines a service contract for the notification collaborator to accept notification requests
 * from the billing engine. Implementations must not throw for delivery failures; billing state
 * changes never depend on a notification being delivered.
 */
public interface NotificationServiceContract {

    /**
     * @param tenantId id of the tenant that should be notified.
     * @param type     the kind of notification.
     * @param data     template data for the notification. Values must be JSON-serialisable.
     */
    void requestNotification(long tenantId, @NonNull NotificationType type, @NonNull Map<String, Object> data);
}
