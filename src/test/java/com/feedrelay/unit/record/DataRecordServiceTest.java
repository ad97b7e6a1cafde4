package com.feedrelay.unit.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.entity.DataRecordEntity;
import com.feedrelay.event.EventPublisherHelper;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.record.DataRecordService;
import com.feedrelay.repository.jpa.DataRecordJpaRepository;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DataRecordServiceTest {

    @Mock
    private DataRecordJpaRepository dataRecordJpaRepository;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private DataRecordService dataRecordService;

    @BeforeEach
    void setUp() {
        dataRecordService = new DataRecordService(
                dataRecordJpaRepository, Mappers.getMapper(DataRecordMapper.class), eventPublisherHelper);
    }

    @Test
    @DisplayName("Stores the record with a database id and announces the stored copy")
    void ingestsAndPublishes() {
        when(dataRecordJpaRepository.save(any(DataRecordEntity.class))).thenAnswer(invocation -> {
            DataRecordEntity entity = invocation.getArgument(0);
            entity.setId(17L);
            return entity;
        });

        DataRecord stored = dataRecordService.ingest(DataRecord.builder()
                .id(999L)
                .scopeId(3L)
                .type("signal")
                .symbol("AAPL")
                .payload(Map.of("price", 187.5))
                .build());

        assertThat(stored.getId()).isEqualTo(17L);
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(stored.getPayload()).containsEntry("price", 187.5);

        ArgumentCaptor<DataRecordEntity> saved = ArgumentCaptor.forClass(DataRecordEntity.class);
        verify(dataRecordJpaRepository).save(saved.capture());
        assertThat(saved.getValue().getPayload()).contains("\"price\"");

        ArgumentCaptor<DataRecord> published = ArgumentCaptor.forClass(DataRecord.class);
        verify(eventPublisherHelper).publishRecordCreated(eq(dataRecordService), published.capture());
        assertThat(published.getValue().getId()).isEqualTo(17L);
    }
}
