package com.feedrelay.entity;

import com.feedrelay.domain.enums.DeliveryMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the subscriptions table.
 *
 * <p>Holds the delivery cursor ({@code last_delivered_id}) alongside the filter definition.
 * The cursor column is only ever written through
 * {@link com.feedrelay.repository.jpa.SubscriptionJpaRepository#advanceCursor}, which refuses
 * to move it backwards. The cursor columns are not updatable through entity saves, so saving a
 * subscription loaded before a concurrent poll cannot roll the cursor back.
 */
@Entity
@Table(name = "subscriptions", indexes = @Index(name = "idx_subscriptions_owner", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubscriptionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_mode", nullable = false, columnDefinition = "varchar(20)")
    private DeliveryMode deliveryMode;

    @Column(name = "scope_id")
    private Long scopeId;

    /** Filter map serialized as JSON. */
    @Column(columnDefinition = "TEXT")
    private String filters;

    @Column(name = "callback_url", length = 500)
    private String callbackUrl;

    @Column(name = "callback_endpoint_id", length = 40)
    private String callbackEndpointId;

    private boolean enabled;

    @Column(name = "last_delivered_id", updatable = false)
    private Long lastDeliveredId;

    @Column(name = "last_delivered_at", updatable = false)
    private LocalDateTime lastDeliveredAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
