package com.threadline.notificationservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "notification.inbox")
public class InboxProperties {

    private int defaultPageSize = 50;

    // Larger requests are clamped, not rejected
    private int maxPageSize = 200;
}
