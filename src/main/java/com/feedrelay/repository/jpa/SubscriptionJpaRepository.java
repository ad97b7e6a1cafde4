package com.feedrelay.repository.jpa;

import com.feedrelay.domain.enums.DeliveryMode;
import com.feedrelay.entity.SubscriptionEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the subscriptions table.
 */
@Repository
public interface SubscriptionJpaRepository extends JpaRepository<SubscriptionEntity, Long> {

    List<SubscriptionEntity> findByOwnerIdOrderByIdAsc(String ownerId, Pageable pageable);

    long countByOwnerId(String ownerId);

    List<SubscriptionEntity> findByDeliveryModeAndEnabledTrue(DeliveryMode deliveryMode);

    /**
     * Moves the cursor forward. Rows whose cursor is already at or past {@code lastId} are left
     * alone, so the column can never decrease.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying
    @Transactional
    @Query("UPDATE SubscriptionEntity s SET s.lastDeliveredId = :lastId, s.lastDeliveredAt = :deliveredAt "
            + "WHERE s.id = :id AND (s.lastDeliveredId IS NULL OR s.lastDeliveredId < :lastId)")
    int advanceCursor(
            @Param("id") Long id, @Param("lastId") Long lastId, @Param("deliveredAt") LocalDateTime deliveredAt);
}
