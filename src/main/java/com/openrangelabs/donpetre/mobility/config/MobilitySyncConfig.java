package com.openrangelabs.donpetre.mobility.config;

import com.openrangelabs.donpetre.mobility.notification.LoggingNotificationSink;
import com.openrangelabs.donpetre.mobility.notification.NotificationSink;
import com.openrangelabs.donpetre.mobility.notification.SnsNotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.services.sns.SnsAsyncClient;

import java.time.Clock;

/**
 * Core beans of the sync engine
 */
@Configuration
@EnableConfigurationProperties(MobilitySyncProperties.class)
public class MobilitySyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(MobilitySyncConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Timer for poll intervals and retry backoff. Tests replace it with a virtual-time scheduler.
     */
    @Bean
    public Scheduler timerScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public NotificationSink notificationSink(MobilitySyncProperties properties,
                                             ObjectProvider<SnsAsyncClient> snsClient) {
        String topicArn = properties.getNotifications().getSnsTopicArn();
        if (topicArn != null && !topicArn.isBlank()) {
            logger.info("Run summaries will be published to {}", topicArn);
            return new SnsNotificationSink(snsClient.getObject(), topicArn);
        }
        return new LoggingNotificationSink();
    }
}
