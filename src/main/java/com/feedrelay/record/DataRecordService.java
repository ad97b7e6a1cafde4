package com.feedrelay.record;

import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.entity.DataRecordEntity;
import com.feedrelay.event.EventPublisherHelper;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.repository.jpa.DataRecordJpaRepository;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Producer-facing ingestion. Persists a record, which assigns its id, and then announces it
 * with a {@link com.feedrelay.event.RecordCreatedEvent}.
 */
@Service
public class DataRecordService {

    private static final Logger log = LoggerFactory.getLogger(DataRecordService.class);

    private final DataRecordJpaRepository dataRecordJpaRepository;
    private final DataRecordMapper dataRecordMapper;
    private final EventPublisherHelper eventPublisherHelper;

    public DataRecordService(
            DataRecordJpaRepository dataRecordJpaRepository,
            DataRecordMapper dataRecordMapper,
            EventPublisherHelper eventPublisherHelper) {
        this.dataRecordJpaRepository = dataRecordJpaRepository;
        this.dataRecordMapper = dataRecordMapper;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public DataRecord ingest(DataRecord dataRecord) {
        dataRecord.setId(null);
        dataRecord.setCreatedAt(LocalDateTime.now());

        DataRecordEntity saved = dataRecordJpaRepository.save(dataRecordMapper.toEntity(dataRecord));
        DataRecord stored = dataRecordMapper.toDomain(saved);
        log.debug("Ingested record {} ({} {})", stored.getId(), stored.getType(), stored.getSymbol());

        eventPublisherHelper.publishRecordCreated(this, stored);
        return stored;
    }
}
