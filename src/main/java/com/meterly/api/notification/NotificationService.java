package com.meterly.api.notification;

import com.meterly.api.contracts.NotificationServiceContract;
import com.meterly.api.contracts.NotificationType;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Accepts notification requests from the billing engine and hands them over to delivery adapters
 * once the requesting transaction commits. Delivery itself (email, push) happens outside this
 * service; the default listener only logs the request.
 */
@Service
@Slf4j
class NotificationService implements NotificationServiceContract {

    private final ApplicationEventPublisher eventPublisher;

    @Autowired
    NotificationService(@NonNull ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void requestNotification(long tenantId, @NonNull NotificationType type, @NonNull Map<String, Object> data) {
        log.debug("notification requested: tenant={} type={}", tenantId, type.getKey());
        eventPublisher.publishEvent(new NotificationRequestedEvent(tenantId, type, Collections.unmodifiableMap(new HashMap<>(data)), OffsetDateTime.now()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    void onNotificationRequested(@NonNull NotificationRequestedEvent event) {
        log.info("dispatching notification: tenant={} type={} data={}",
            event.getTenantId(), event.getType().getKey(), event.getData());
    }
}
