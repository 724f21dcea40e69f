package com.threadline.notificationservice.config;

import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets request parameters use the lower-case wire values, e.g. ?category=order.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, NotificationCategory.class, NotificationCategory::fromValue);
        registry.addConverter(String.class, NotificationPriority.class, NotificationPriority::fromValue);
    }
}
