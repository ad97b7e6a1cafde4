package com.feedrelay.unit.subscription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.feedrelay.api.dto.request.SubscriptionUpdateRequest;
import com.feedrelay.domain.enums.DeliveryMode;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.Subscription;
import com.feedrelay.domain.model.WebhookEndpoint;
import com.feedrelay.entity.SubscriptionEntity;
import com.feedrelay.exception.ForbiddenException;
import com.feedrelay.exception.ValidationException;
import com.feedrelay.mapper.SubscriptionMapper;
import com.feedrelay.repository.jpa.SubscriptionJpaRepository;
import com.feedrelay.subscription.PollingDeliveryService;
import com.feedrelay.subscription.RecordFilter;
import com.feedrelay.subscription.SubscriptionService;
import com.feedrelay.webhook.WebhookService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    @Mock
    private SubscriptionJpaRepository subscriptionJpaRepository;

    @Mock
    private WebhookService webhookService;

    @Mock
    private PollingDeliveryService pollingDeliveryService;

    private SubscriptionService subscriptionService;

    @BeforeEach
    void setUp() {
        subscriptionService = new SubscriptionService(
                subscriptionJpaRepository,
                Mappers.getMapper(SubscriptionMapper.class),
                new RecordFilter(),
                webhookService,
                pollingDeliveryService);
    }

    private static SubscriptionEntity withId(SubscriptionEntity entity, long id) {
        entity.setId(id);
        return entity;
    }

    @Test
    @DisplayName("create stores a PULL subscription owned by the caller and announces it")
    void createPullSubscription() {
        when(subscriptionJpaRepository.save(any(SubscriptionEntity.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0), 11L));

        Subscription draft = Subscription.builder()
                .name("aapl")
                .deliveryMode(DeliveryMode.PULL)
                .filters(Map.of("symbol", "AAPL"))
                .callbackUrl("https://ignored.example.com")
                .lastDeliveredId(500L)
                .enabled(true)
                .build();

        Subscription created = subscriptionService.create("client-a", draft);

        assertThat(created.getId()).isEqualTo(11L);
        assertThat(created.getOwnerId()).isEqualTo("client-a");
        assertThat(created.getFilters()).containsEntry("symbol", "AAPL");
        assertThat(created.getLastDeliveredId()).isNull();
        assertThat(created.getCallbackUrl()).isNull();
        verify(webhookService, never()).register(any());
        verify(webhookService).trigger(eq(WebhookEventType.SUBSCRIPTION_CREATED), anyMap(), eq("client-a"));
    }

    @Test
    @DisplayName("create registers a bound webhook endpoint for a CALLBACK subscription")
    void createCallbackSubscription() {
        when(subscriptionJpaRepository.save(any(SubscriptionEntity.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0), 12L));
        when(webhookService.register(any(WebhookEndpoint.class)))
                .thenAnswer(inv -> ((WebhookEndpoint) inv.getArgument(0)).toBuilder().id("wh_0123456789abcdef").build());

        Subscription draft = Subscription.builder()
                .name("callbacks")
                .deliveryMode(DeliveryMode.CALLBACK)
                .callbackUrl("https://hooks.example.com/in")
                .enabled(true)
                .build();

        Subscription created = subscriptionService.create("client-a", draft);

        ArgumentCaptor<WebhookEndpoint> endpointCaptor = ArgumentCaptor.forClass(WebhookEndpoint.class);
        verify(webhookService).register(endpointCaptor.capture());
        WebhookEndpoint endpoint = endpointCaptor.getValue();
        assertThat(endpoint.getUrl()).isEqualTo("https://hooks.example.com/in");
        assertThat(endpoint.getOwnerId()).isEqualTo("client-a");
        assertThat(endpoint.getSubscriptionId()).isEqualTo(12L);
        assertThat(endpoint.getEvents()).containsExactly(WebhookEventType.DATA_CREATED);
        assertThat(created.getCallbackEndpointId()).isEqualTo("wh_0123456789abcdef");
    }

    @Test
    @DisplayName("create rejects a CALLBACK subscription without url")
    void callbackRequiresUrl() {
        Subscription draft = Subscription.builder().name("x").deliveryMode(DeliveryMode.CALLBACK).build();

        assertThatThrownBy(() -> subscriptionService.create("client-a", draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("callbackUrl");
    }

    @Test
    @DisplayName("create stores nothing when the callback url is not http(s)")
    void invalidCallbackUrlStoresNothing() {
        Subscription draft = Subscription.builder()
                .name("x")
                .deliveryMode(DeliveryMode.CALLBACK)
                .callbackUrl("ftp://nope")
                .build();

        assertThatThrownBy(() -> subscriptionService.create("client-a", draft))
                .isInstanceOf(ValidationException.class);
        verify(subscriptionJpaRepository, never()).save(any());
        verifyNoInteractions(webhookService);
    }

    @Test
    @DisplayName("create removes the stored row again when the endpoint cannot be registered")
    void failedRegistrationRollsBack() {
        when(subscriptionJpaRepository.save(any(SubscriptionEntity.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0), 13L));
        when(webhookService.register(any(WebhookEndpoint.class)))
                .thenThrow(new ValidationException("At least one event is required"));

        Subscription draft = Subscription.builder()
                .name("x")
                .deliveryMode(DeliveryMode.CALLBACK)
                .callbackUrl("https://hooks.example.com/in")
                .build();

        assertThatThrownBy(() -> subscriptionService.create("client-a", draft))
                .isInstanceOf(ValidationException.class);
        verify(subscriptionJpaRepository).deleteById(13L);
    }

    @Test
    @DisplayName("create rejects malformed filters before saving")
    void rejectsMalformedFilters() {
        Subscription draft = Subscription.builder()
                .name("x")
                .deliveryMode(DeliveryMode.PULL)
                .filters(Map.of("symbol", List.of()))
                .build();

        assertThatThrownBy(() -> subscriptionService.create("client-a", draft))
                .isInstanceOf(ValidationException.class);
        verify(subscriptionJpaRepository, never()).save(any());
    }

    @Test
    @DisplayName("get rejects callers that do not own the subscription")
    void getForeignSubscription() {
        when(subscriptionJpaRepository.findById(5L))
                .thenReturn(Optional.of(SubscriptionEntity.builder()
                        .id(5L)
                        .ownerId("client-b")
                        .deliveryMode(DeliveryMode.PULL)
                        .build()));

        assertThatThrownBy(() -> subscriptionService.get(5L, "client-a")).isInstanceOf(ForbiddenException.class);
        assertThat(subscriptionService.isOwnedBy(5L, "client-a")).isFalse();
        assertThat(subscriptionService.isOwnedBy(5L, "client-b")).isTrue();
    }

    @Test
    @DisplayName("list applies offset and limit within the caller's subscriptions")
    void listPagesByOffset() {
        List<SubscriptionEntity> rows = List.of(
                SubscriptionEntity.builder().id(1L).ownerId("client-a").deliveryMode(DeliveryMode.PULL).build(),
                SubscriptionEntity.builder().id(2L).ownerId("client-a").deliveryMode(DeliveryMode.PULL).build(),
                SubscriptionEntity.builder().id(3L).ownerId("client-a").deliveryMode(DeliveryMode.PULL).build());
        when(subscriptionJpaRepository.findByOwnerIdOrderByIdAsc(eq("client-a"), any(Pageable.class)))
                .thenReturn(rows);

        List<Subscription> page = subscriptionService.list("client-a", 2, 1);

        assertThat(page).extracting(Subscription::getId).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("list rejects an offset whose page end overflows")
    void listRejectsHugeOffset() {
        assertThatThrownBy(() -> subscriptionService.list("client-a", 50, Integer.MAX_VALUE - 10))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("offset");
        verifyNoInteractions(subscriptionJpaRepository);
    }

    @Test
    @DisplayName("disabling a CALLBACK subscription disables its endpoint and announces the change")
    void updatePropagatesEnabledToEndpoint() {
        SubscriptionEntity row = SubscriptionEntity.builder()
                .id(8L)
                .name("cb")
                .ownerId("client-a")
                .deliveryMode(DeliveryMode.CALLBACK)
                .callbackUrl("https://hooks.example.com/in")
                .callbackEndpointId("wh_aaaaaaaaaaaaaaaa")
                .enabled(true)
                .build();
        when(subscriptionJpaRepository.findById(8L)).thenReturn(Optional.of(row));
        when(subscriptionJpaRepository.save(any(SubscriptionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        Subscription updated = subscriptionService.update(
                8L, "client-a", SubscriptionUpdateRequest.builder().enabled(false).build());

        assertThat(updated.isEnabled()).isFalse();
        verify(webhookService)
                .update("wh_aaaaaaaaaaaaaaaa", "client-a", "https://hooks.example.com/in", null, false);
        verify(webhookService)
                .trigger(eq(WebhookEventType.SUBSCRIPTION_DEACTIVATED), anyMap(), eq("client-a"));
    }

    @Test
    @DisplayName("delete removes the bound endpoint and the cursor lock")
    void deleteCleansUp() {
        when(subscriptionJpaRepository.findById(9L))
                .thenReturn(Optional.of(SubscriptionEntity.builder()
                        .id(9L)
                        .name("cb")
                        .ownerId("client-a")
                        .deliveryMode(DeliveryMode.CALLBACK)
                        .callbackEndpointId("wh_bbbbbbbbbbbbbbbb")
                        .build()));

        subscriptionService.delete(9L, "client-a");

        verify(webhookService).unregisterInternal("wh_bbbbbbbbbbbbbbbb");
        verify(subscriptionJpaRepository).deleteById(9L);
        verify(pollingDeliveryService).forget(9L);
    }
}
