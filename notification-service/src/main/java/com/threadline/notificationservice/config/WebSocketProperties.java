package com.threadline.notificationservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * STOMP heartbeat settings. The broker pings idle sessions at this interval
 * and expects clients to do the same; a silent session is closed.
 */
@Data
@ConfigurationProperties(prefix = "notification.websocket")
public class WebSocketProperties {

    private Duration heartbeatInterval = Duration.ofSeconds(30);
}
