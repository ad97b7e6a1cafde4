package com.feedrelay.mapper;

import com.feedrelay.api.dto.request.SubscriptionCreateRequest;
import com.feedrelay.api.dto.response.SubscriptionResponse;
import com.feedrelay.domain.model.Subscription;
import com.feedrelay.entity.SubscriptionEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper for subscriptions.
 *
 * <p>The filter map is stored as a JSON string in the entity. The API calls the scope
 * {@code strategyId}; the domain calls it {@code scopeId}.
 */
@Mapper
public interface SubscriptionMapper {

    @Mapping(source = "filters", target = "filters", qualifiedByName = "mapToJson")
    SubscriptionEntity toEntity(Subscription subscription);

    @Mapping(source = "filters", target = "filters", qualifiedByName = "jsonToMap")
    Subscription toDomain(SubscriptionEntity entity);

    List<Subscription> toDomainList(List<SubscriptionEntity> entities);

    @Mapping(source = "strategyId", target = "scopeId")
    Subscription toDomain(SubscriptionCreateRequest request);

    @Mapping(source = "scopeId", target = "strategyId")
    SubscriptionResponse toResponse(Subscription subscription);

    List<SubscriptionResponse> toResponseList(List<Subscription> subscriptions);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> filters) {
        return filters == null || filters.isEmpty() ? null : JsonHelper.toJson(filters);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
