package com.feedrelay.mapper;

import com.feedrelay.api.dto.request.DataRecordRequest;
import com.feedrelay.api.dto.response.DataRecordResponse;
import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.entity.DataRecordEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface DataRecordMapper {

    @Mapping(source = "payload", target = "payload", qualifiedByName = "mapToJson")
    DataRecordEntity toEntity(DataRecord dataRecord);

    @Mapping(source = "payload", target = "payload", qualifiedByName = "jsonToMap")
    DataRecord toDomain(DataRecordEntity entity);

    List<DataRecord> toDomainList(List<DataRecordEntity> entities);

    @Mapping(source = "strategyId", target = "scopeId")
    DataRecord toDomain(DataRecordRequest request);

    @Mapping(source = "scopeId", target = "strategyId")
    DataRecordResponse toResponse(DataRecord dataRecord);

    List<DataRecordResponse> toResponseList(List<DataRecord> dataRecords);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> payload) {
        return JsonHelper.toJson(payload);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
