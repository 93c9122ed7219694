package com.openrangelabs.donpetre.mobility.notification;

import com.openrangelabs.donpetre.mobility.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Writes run summaries to the application log. Used when no SNS topic is configured.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public Mono<Void> publish(RunSummary summary) {
        return Mono.fromRunnable(() -> {
            if (summary.isSuccess()) {
                log.info("{}\n{}", RunSummaryFormatter.subject(summary), RunSummaryFormatter.body(summary));
            } else {
                log.warn("{}\n{}", RunSummaryFormatter.subject(summary), RunSummaryFormatter.body(summary));
            }
        });
    }
}
