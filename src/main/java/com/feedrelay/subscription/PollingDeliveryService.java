package com.feedrelay.subscription;

import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.domain.model.PollResult;
import com.feedrelay.domain.model.Subscription;
import com.feedrelay.entity.DataRecordEntity;
import com.feedrelay.exception.ForbiddenException;
import com.feedrelay.exception.ResourceNotFoundException;
import com.feedrelay.exception.ValidationException;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.mapper.SubscriptionMapper;
import com.feedrelay.observability.DeliveryMetricsService;
import com.feedrelay.repository.jpa.DataRecordJpaRepository;
import com.feedrelay.repository.jpa.SubscriptionJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Serves cursor polls: "give me the matching records I have not seen yet".
 *
 * <p>A poll reads records with id above {@code max(lastDeliveredId, since)}, keeps those that fall
 * in the subscription's scope and pass its filters, returns at most {@code limit} of them in id
 * order and moves the cursor to the highest id returned. The cursor moves as soon as the records
 * are selected; there is no acknowledgement step.
 *
 * <p>Load, select and advance run under a per-subscription lock, so two concurrent polls of the
 * same subscription never hand out the same batch. The UPDATE behind the advance also refuses to
 * move the cursor backwards. Polls of different subscriptions do not contend.
 */
@Service
public class PollingDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(PollingDeliveryService.class);
    private static final int SCAN_PAGE_SIZE = 500;

    private final SubscriptionJpaRepository subscriptionJpaRepository;
    private final DataRecordJpaRepository dataRecordJpaRepository;
    private final SubscriptionMapper subscriptionMapper;
    private final DataRecordMapper dataRecordMapper;
    private final RecordFilter recordFilter;
    private final DeliveryMetricsService deliveryMetricsService;
    private final int defaultLimit;
    private final int maxLimit;

    private final Map<Long, ReentrantLock> cursorLocks = new ConcurrentHashMap<>();

    public PollingDeliveryService(
            SubscriptionJpaRepository subscriptionJpaRepository,
            DataRecordJpaRepository dataRecordJpaRepository,
            SubscriptionMapper subscriptionMapper,
            DataRecordMapper dataRecordMapper,
            RecordFilter recordFilter,
            DeliveryMetricsService deliveryMetricsService,
            @Value("${feedrelay.polling.default-limit:100}") int defaultLimit,
            @Value("${feedrelay.polling.max-limit:1000}") int maxLimit) {
        this.subscriptionJpaRepository = subscriptionJpaRepository;
        this.dataRecordJpaRepository = dataRecordJpaRepository;
        this.subscriptionMapper = subscriptionMapper;
        this.dataRecordMapper = dataRecordMapper;
        this.recordFilter = recordFilter;
        this.deliveryMetricsService = deliveryMetricsService;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Returns the next batch of matching records and advances the cursor past them.
     *
     * @param since optional lower bound; records at or below it are skipped even if the cursor
     *     is behind. Never moves the cursor by itself.
     * @param limit optional batch size; null means the default, values above the maximum are
     *     clamped
     * @throws ResourceNotFoundException if the subscription does not exist
     * @throws ForbiddenException if {@code callerId} does not own the subscription
     * @throws ValidationException if {@code limit} is below 1
     */
    public PollResult poll(Long subscriptionId, String callerId, Long since, Integer limit) {
        int effectiveLimit = resolveLimit(limit);

        ReentrantLock lock = cursorLocks.computeIfAbsent(subscriptionId, id -> new ReentrantLock());
        lock.lock();
        try {
            Subscription subscription = loadOwned(subscriptionId, callerId);
            long cursor = subscription.getLastDeliveredId() != null ? subscription.getLastDeliveredId() : 0L;

            if (!subscription.isEnabled()) {
                log.debug("Subscription {} is disabled, returning empty poll", subscriptionId);
                return PollResult.builder()
                        .subscriptionId(subscriptionId)
                        .records(List.of())
                        .lastId(subscription.getLastDeliveredId())
                        .hasMore(false)
                        .build();
            }

            long lowerBound = Math.max(cursor, since != null ? since : 0L);
            List<DataRecord> matches = selectMatches(subscription, lowerBound, effectiveLimit + 1);

            boolean hasMore = matches.size() > effectiveLimit;
            List<DataRecord> batch = hasMore ? new ArrayList<>(matches.subList(0, effectiveLimit)) : matches;

            Long lastId = subscription.getLastDeliveredId();
            if (!batch.isEmpty()) {
                lastId = batch.get(batch.size() - 1).getId();
                subscriptionJpaRepository.advanceCursor(subscriptionId, lastId, LocalDateTime.now());
                deliveryMetricsService.recordPolledRecords(batch.size());
                log.debug("Subscription {} polled {} records, cursor now {}", subscriptionId, batch.size(), lastId);
            }

            return PollResult.builder()
                    .subscriptionId(subscriptionId)
                    .records(batch)
                    .lastId(lastId)
                    .hasMore(hasMore)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the cursor to {@code recordId} after a record was handed to the owner outside a poll
     * (callback delivery). Lower ids are ignored.
     */
    public void markDelivered(Long subscriptionId, Long recordId) {
        ReentrantLock lock = cursorLocks.computeIfAbsent(subscriptionId, id -> new ReentrantLock());
        lock.lock();
        try {
            subscriptionJpaRepository.advanceCursor(subscriptionId, recordId, LocalDateTime.now());
        } finally {
            lock.unlock();
        }
    }

    /** Drops the lock of a deleted subscription. */
    public void forget(Long subscriptionId) {
        cursorLocks.remove(subscriptionId);
    }

    private Subscription loadOwned(Long subscriptionId, String callerId) {
        Subscription subscription = subscriptionJpaRepository
                .findById(subscriptionId)
                .map(subscriptionMapper::toDomain)
                .orElseThrow(() -> ResourceNotFoundException.subscription(subscriptionId));
        if (!subscription.getOwnerId().equals(callerId)) {
            throw ForbiddenException.notOwner("Subscription", subscriptionId);
        }
        return subscription;
    }

    /** Scans forward page by page until {@code wanted} matches are found or the table runs out. */
    private List<DataRecord> selectMatches(Subscription subscription, long afterId, int wanted) {
        List<DataRecord> matches = new ArrayList<>();
        long scanFrom = afterId;
        while (matches.size() < wanted) {
            List<DataRecordEntity> page = dataRecordJpaRepository.findBatchAfter(
                    scanFrom, subscription.getScopeId(), PageRequest.of(0, SCAN_PAGE_SIZE));
            for (DataRecordEntity entity : page) {
                DataRecord dataRecord = dataRecordMapper.toDomain(entity);
                if (recordFilter.matches(subscription.getFilters(), dataRecord)) {
                    matches.add(dataRecord);
                    if (matches.size() == wanted) {
                        break;
                    }
                }
            }
            if (page.size() < SCAN_PAGE_SIZE) {
                break;
            }
            scanFrom = page.get(page.size() - 1).getId();
        }
        return matches;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1", Map.of("limit", limit));
        }
        return Math.min(limit, maxLimit);
    }
}
