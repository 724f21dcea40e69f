package com.threadline.notificationservice;

import com.threadline.common.contracts.RealtimeEventContract;
import com.threadline.common.model.EntityType;
import com.threadline.notificationservice.config.TestJwtDecoderConfig;
import com.threadline.notificationservice.dto.CreateNotificationRequest;
import com.threadline.notificationservice.dto.NotificationDto;
import com.threadline.notificationservice.model.NotificationType;
import com.threadline.notificationservice.repository.NotificationRepository;
import com.threadline.notificationservice.repository.RealtimeEventRepository;
import com.threadline.notificationservice.service.EventPublisher;
import com.threadline.notificationservice.service.NotificationService;
import com.threadline.notificationservice.transport.StompPrincipal;
import com.threadline.notificationservice.transport.StompRealtimeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.messaging.simp.user.SimpSubscriptionMatcher;
import org.springframework.messaging.simp.user.SimpUserRegistry;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Integration tests for live delivery over STOMP: per-user queue, tenant
 * topic and subscription authorization.
 */
class WebSocketIntegrationTest extends AbstractIntegrationTest {

    private static final String USER_DESTINATION = "/user" + StompRealtimeTransport.USER_QUEUE;

    @LocalServerPort
    private int port;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private EventPublisher eventPublisher;

    @Autowired
    private SimpUserRegistry userRegistry;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private RealtimeEventRepository realtimeEventRepository;

    private WebSocketStompClient stompClient;
    private StompSession session;
    private UUID userId;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        tenantId = UUID.randomUUID();
        stompClient = new WebSocketStompClient(new StandardWebSocketClient());
        stompClient.setMessageConverter(new MappingJackson2MessageConverter());
    }

    @AfterEach
    void cleanup() {
        if (session != null && session.isConnected()) {
            session.disconnect();
        }
        stompClient.stop();
        notificationRepository.deleteAll();
        realtimeEventRepository.deleteAll();
    }

    @Test
    void should_push_created_notification_to_owner_session() throws Exception {
        // Arrange
        session = connect(new StompSessionHandlerAdapter() { });
        BlockingQueue<Map<String, Object>> received = subscribe(USER_DESTINATION);
        String principalName = StompPrincipal.nameFor(tenantId, userId);
        awaitSubscription(sub -> sub.getSession().getUser().getName().equals(principalName));

        // Act
        NotificationDto created = notificationService.createNotification(CreateNotificationRequest.builder()
                .tenantId(tenantId)
                .userId(userId)
                .type(NotificationType.INFO)
                .title("Welcome")
                .message("Your workspace is ready")
                .build());

        // Assert
        Map<String, Object> message = received.poll(10, TimeUnit.SECONDS);
        assertThat(message).isNotNull();
        assertThat(message.get("type")).isEqualTo("notification");
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) message.get("payload");
        assertThat(payload.get("action")).isEqualTo("created");
        @SuppressWarnings("unchecked")
        Map<String, Object> notification = (Map<String, Object>) payload.get("notification");
        assertThat(notification.get("id")).isEqualTo(created.getId().toString());
    }

    @Test
    void should_broadcast_event_to_tenant_topic() throws Exception {
        // Arrange
        String topic = StompRealtimeTransport.tenantDestination(tenantId);
        session = connect(new StompSessionHandlerAdapter() { });
        BlockingQueue<Map<String, Object>> received = subscribe(topic);
        awaitSubscription(sub -> topic.equals(sub.getDestination()));

        UUID orderId = UUID.randomUUID();

        // Act
        eventPublisher.publish(RealtimeEventContract.builder()
                .tenantId(tenantId)
                .eventType("order_created")
                .entityType(EntityType.ORDER)
                .entityId(orderId)
                .payload(Map.of("orderNumber", "SO-1001"))
                .build());

        // Assert
        Map<String, Object> message = received.poll(10, TimeUnit.SECONDS);
        assertThat(message).isNotNull();
        assertThat(message.get("type")).isEqualTo("order_update");
        assertThat(message.get("tenantId")).isEqualTo(tenantId.toString());
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) message.get("payload");
        assertThat(payload.get("event")).isEqualTo("order_created");
        assertThat(payload.get("entityId")).isEqualTo(orderId.toString());
    }

    @Test
    void should_reject_subscription_to_another_tenant_topic() throws Exception {
        // Arrange
        // The server answers with an ERROR frame and then drops the connection
        CompletableFuture<Boolean> rejected = new CompletableFuture<>();
        session = connect(new StompSessionHandlerAdapter() {
            @Override
            public void handleFrame(StompHeaders headers, Object payload) {
                rejected.complete(true);
            }

            @Override
            public void handleTransportError(StompSession stompSession, Throwable exception) {
                rejected.complete(true);
            }
        });

        // Act
        subscribe(StompRealtimeTransport.tenantDestination(UUID.randomUUID()));

        // Assert
        assertThat(rejected.get(10, TimeUnit.SECONDS)).isTrue();
        assertThat(userRegistry.findSubscriptions(sub -> sub.getDestination().contains(tenantId.toString())))
                .isEmpty();
    }

    @Test
    void should_advertise_broker_heartbeat_on_connect() throws Exception {
        // Arrange
        CompletableFuture<long[]> heartbeat = new CompletableFuture<>();

        // Act
        session = connect(new StompSessionHandlerAdapter() {
            @Override
            public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders) {
                heartbeat.complete(connectedHeaders.getHeartbeat());
            }
        });

        // Assert
        assertThat(heartbeat.get(10, TimeUnit.SECONDS)).containsExactly(30_000L, 30_000L);
    }

    private StompSession connect(StompSessionHandlerAdapter handler) throws Exception {
        StompHeaders connectHeaders = new StompHeaders();
        connectHeaders.add("Authorization", "Bearer " + TestJwtDecoderConfig.createToken(userId, tenantId));

        return stompClient.connectAsync("ws://localhost:" + port + "/ws", (WebSocketHttpHeaders) null, connectHeaders, handler)
                .get(10, TimeUnit.SECONDS);
    }

    private BlockingQueue<Map<String, Object>> subscribe(String destination) {
        BlockingQueue<Map<String, Object>> received = new LinkedBlockingQueue<>();
        session.subscribe(destination, new StompFrameHandler() {
            @Override
            public Type getPayloadType(StompHeaders headers) {
                return Map.class;
            }

            @Override
            @SuppressWarnings("unchecked")
            public void handleFrame(StompHeaders headers, Object payload) {
                received.add((Map<String, Object>) payload);
            }
        });
        return received;
    }

    private void awaitSubscription(SimpSubscriptionMatcher matcher) {
        await().atMost(Duration.ofSeconds(10))
                .until(() -> !userRegistry.findSubscriptions(matcher).isEmpty());
    }
}
