package com.threadline.notificationservice.service;

import com.threadline.common.model.EntityType;
import com.threadline.notificationservice.dto.RealtimeMessage;
import com.threadline.notificationservice.exception.DeliveryFailureException;
import com.threadline.notificationservice.model.MessageType;
import com.threadline.notificationservice.model.RealtimeEvent;
import com.threadline.notificationservice.transport.RealtimeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BroadcastRouterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private RealtimeTransport realtimeTransport;

    @Mock
    private EventStore eventStore;

    private BroadcastRouter broadcastRouter;

    private UUID tenantId;
    private UUID entityId;

    @BeforeEach
    void setUp() {
        broadcastRouter = new BroadcastRouter(realtimeTransport, eventStore, Clock.fixed(NOW, ZoneOffset.UTC));
        tenantId = UUID.randomUUID();
        entityId = UUID.randomUUID();
    }

    @Test
    void broadcastEvent_NoExplicitRecipients_SendsOnceToTenantThenMarksProcessed() {
        // Arrange
        RealtimeEvent event = event(EntityType.ORDER, "order_updated", true, null);

        // Act
        broadcastRouter.broadcastEvent(event);

        // Assert
        ArgumentCaptor<RealtimeMessage> captor = ArgumentCaptor.forClass(RealtimeMessage.class);
        InOrder inOrder = inOrder(realtimeTransport, eventStore);
        inOrder.verify(realtimeTransport, times(1)).sendToTenant(eq(tenantId), captor.capture());
        inOrder.verify(eventStore).markProcessed(event.getId());
        verify(realtimeTransport, never()).sendToUser(any(), any(), any());

        assertThat(captor.getValue().getType()).isEqualTo(MessageType.ORDER_UPDATE);
        assertThat(captor.getValue().getTenantId()).isEqualTo(tenantId);
    }

    @Test
    void broadcastEvent_DeliveryToFirstUserFails_StillDeliversToSecond() {
        // Arrange
        UUID u1 = UUID.randomUUID();
        UUID u2 = UUID.randomUUID();
        RealtimeEvent event = event(EntityType.ORDER, "order_updated", true, List.of(u1, u2));
        doThrow(new DeliveryFailureException("broker down", null))
                .when(realtimeTransport).sendToUser(eq(u1), eq(tenantId), any(RealtimeMessage.class));

        // Act
        broadcastRouter.broadcastEvent(event);

        // Assert
        verify(realtimeTransport).sendToUser(eq(u1), eq(tenantId), any(RealtimeMessage.class));
        verify(realtimeTransport).sendToUser(eq(u2), eq(tenantId), any(RealtimeMessage.class));
        verify(realtimeTransport, never()).sendToTenant(any(), any());
        verify(eventStore).markProcessed(event.getId());
    }

    @Test
    void broadcastEvent_BroadcastDisabled_SkipsDeliveryButMarksProcessed() {
        // Arrange
        RealtimeEvent event = event(EntityType.DESIGN_JOB, "design_job_updated", false, List.of(UUID.randomUUID()));

        // Act
        broadcastRouter.broadcastEvent(event);

        // Assert
        verifyNoInteractions(realtimeTransport);
        verify(eventStore).markProcessed(event.getId());
    }

    @Test
    void broadcastEvent_TenantDeliveryFails_SwallowsAndMarksProcessed() {
        // Arrange
        RealtimeEvent event = event(EntityType.WORK_ORDER, "work_order_updated", true, null);
        doThrow(new DeliveryFailureException("broker down", null))
                .when(realtimeTransport).sendToTenant(eq(tenantId), any(RealtimeMessage.class));

        // Act
        broadcastRouter.broadcastEvent(event);

        // Assert
        verify(eventStore).markProcessed(event.getId());
    }

    @Test
    void broadcastEvent_EventNotRecorded_ThrowsWithoutDelivery() {
        // Arrange
        RealtimeEvent event = RealtimeEvent.builder()
                .tenantId(tenantId)
                .eventType("order_updated")
                .entityType(EntityType.ORDER)
                .entityId(entityId)
                .broadcast(true)
                .build();

        // Act & Assert
        assertThatThrownBy(() -> broadcastRouter.broadcastEvent(event))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(realtimeTransport, eventStore);
    }

    @Test
    void toMessage_BuildsEnvelopeFromEvent() {
        // Arrange
        UUID actor = UUID.randomUUID();
        RealtimeEvent event = RealtimeEvent.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .eventType("purchase_order_created")
                .entityType(EntityType.PURCHASE_ORDER)
                .entityId(entityId)
                .actorUserId(actor)
                .payload(Map.of("supplier", "Acme"))
                .broadcast(true)
                .build();

        // Act
        RealtimeMessage message = broadcastRouter.toMessage(event);

        // Assert
        assertThat(message.getType()).isEqualTo(MessageType.PURCHASE_ORDER_UPDATE);
        assertThat(message.getTimestamp()).isEqualTo(NOW);
        assertThat(message.getTenantId()).isEqualTo(tenantId);
        assertThat(message.getUserId()).isNull();
        assertThat(message.getPayload())
                .containsEntry("event", "purchase_order_created")
                .containsEntry("entityType", "purchase_order")
                .containsEntry("entityId", entityId)
                .containsEntry("actorUserId", actor)
                .containsEntry("data", Map.of("supplier", "Acme"))
                .containsEntry("timestamp", NOW);
    }

    @Test
    void toMessage_NoEntityType_FallsBackToNotification() {
        // Arrange
        RealtimeEvent event = RealtimeEvent.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .eventType("system_notice")
                .entityId(entityId)
                .build();

        // Act
        RealtimeMessage message = broadcastRouter.toMessage(event);

        // Assert
        assertThat(message.getType()).isEqualTo(MessageType.NOTIFICATION);
        assertThat(message.getPayload()).containsEntry("actorUserId", null);
    }

    private RealtimeEvent event(EntityType entityType, String eventType, boolean broadcast, List<UUID> users) {
        return RealtimeEvent.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .eventType(eventType)
                .entityType(entityType)
                .entityId(entityId)
                .broadcastToUsers(users)
                .broadcast(broadcast)
                .createdAt(NOW)
                .build();
    }
}
