package com.threadline.notificationservice.config;

import com.threadline.notificationservice.service.AudienceResolver;
import com.threadline.notificationservice.service.DefaultAudienceResolver;
import com.threadline.notificationservice.service.EmptyRoleDirectory;
import com.threadline.notificationservice.service.RoleDirectory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Audience policy wiring. Either bean can be replaced by declaring another
 * one of the same type.
 */
@Configuration
public class AudienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public RoleDirectory roleDirectory() {
        return new EmptyRoleDirectory();
    }

    @Bean
    @ConditionalOnMissingBean
    public AudienceResolver audienceResolver(RoleDirectory roleDirectory) {
        return new DefaultAudienceResolver(roleDirectory);
    }
}
