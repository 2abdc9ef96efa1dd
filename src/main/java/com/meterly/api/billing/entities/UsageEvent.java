package com.meterly.api.billing.entities;

import com.meterly.api.platform.persistence.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A data access object that maps to the append-only {@code usage_events} table in the database.
 * The sum of {@link UsageEvent#quantity} per (subscription, event type) within a billing period is
 * the authoritative usage figure.
 */
@Entity
@Table(name = "usage_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private long tenantId;

    @NonNull
    @ManyToOne(optional = false)
    private Subscription subscription;

    @NonNull
    @Column(updatable = false)
    private String eventType;

    @Column(updatable = false)
    private int quantity;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime occurredAt = OffsetDateTime.now();

    @NonNull
    @Builder.Default
    @Column(length = 4000, updatable = false)
    @Convert(converter = JsonMapConverter.class)
    private Map<String, Object> metadata = new HashMap<>();
}
