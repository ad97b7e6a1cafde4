package com.feedrelay.repository.jpa;

import com.feedrelay.entity.DataRecordEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the data_records table. Records are written by the ingestion side;
 * the delivery engine only reads them in id order.
 */
@Repository
public interface DataRecordJpaRepository extends JpaRepository<DataRecordEntity, Long> {

    /** Records after {@code afterId} in ascending id order, optionally restricted to one scope. */
    @Query("SELECT r FROM DataRecordEntity r WHERE r.id > :afterId "
            + "AND (:scopeId IS NULL OR r.scopeId = :scopeId) ORDER BY r.id ASC")
    List<DataRecordEntity> findBatchAfter(
            @Param("afterId") long afterId, @Param("scopeId") Long scopeId, Pageable pageable);
}
