/*
 * Where: Events application configuration binding
 * What: Holds the global notification retention sweep settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.handreceipt.events.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retention")
@Validated
public record NotificationRetentionProperties(
    boolean enabled, @Positive int retentionDays, Duration cleanupInterval) {}
