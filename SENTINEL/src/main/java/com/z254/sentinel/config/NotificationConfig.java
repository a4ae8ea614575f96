package com.z254.sentinel.config;

import com.z254.sentinel.notification.provider.EmailNotificationProvider;
import com.z254.sentinel.notification.provider.PagerDutyNotificationProvider;
import com.z254.sentinel.notification.provider.SlackNotificationProvider;
import com.z254.sentinel.notification.provider.WebhookNotificationProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Notification provider beans. The dispatcher registers those whose channel is enabled.
 */
@Configuration
public class NotificationConfig {

    @Bean
    public EmailNotificationProvider emailNotificationProvider(WebClient.Builder webClientBuilder,
                                                               SentinelProperties properties) {
        return new EmailNotificationProvider(webClientBuilder, properties.getNotifications().getEmail());
    }

    @Bean
    public SlackNotificationProvider slackNotificationProvider(WebClient.Builder webClientBuilder,
                                                               SentinelProperties properties) {
        return new SlackNotificationProvider(webClientBuilder, properties.getNotifications().getSlack());
    }

    @Bean
    public WebhookNotificationProvider webhookNotificationProvider(WebClient.Builder webClientBuilder,
                                                                   SentinelProperties properties,
                                                                   Clock clock) {
        return new WebhookNotificationProvider(webClientBuilder, properties.getNotifications().getWebhook(),
                properties.getSource(), clock);
    }

    @Bean
    public PagerDutyNotificationProvider pagerDutyNotificationProvider(WebClient.Builder webClientBuilder,
                                                                       SentinelProperties properties) {
        return new PagerDutyNotificationProvider(webClientBuilder, properties.getNotifications().getPagerduty());
    }
}
