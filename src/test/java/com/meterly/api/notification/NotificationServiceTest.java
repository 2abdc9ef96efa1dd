package com.meterly.api.notification;

import com.meterly.api.contracts.NotificationType;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class NotificationServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private NotificationService service;

    @BeforeEach
    void setUp() {
        service = new NotificationService(eventPublisher);
    }

    @Test
    void requestNotification() {
        val data = new HashMap<String, Object>();
        data.put("subscription_id", 1L);
        data.put("hosted_invoice_url", null);

        service.requestNotification(10L, NotificationType.PAYMENT_REMINDER, data);
        data.put("subscription_id", 2L);

        val captor = ArgumentCaptor.forClass(NotificationRequestedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        val event = captor.getValue();
        assertEquals(10L, event.getTenantId());
        assertEquals(NotificationType.PAYMENT_REMINDER, event.getType());
        assertEquals(1L, event.getData().get("subscription_id"));
        assertNull(event.getData().get("hosted_invoice_url"));
        assertNotNull(event.getRequestedAt());
        assertThrows(UnsupportedOperationException.class, () -> event.getData().put("foo", "bar"));
    }
}
