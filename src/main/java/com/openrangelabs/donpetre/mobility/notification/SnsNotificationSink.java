package com.openrangelabs.donpetre.mobility.notification;

import com.openrangelabs.donpetre.mobility.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;

/**
 * Publishes run summaries to an SNS topic
 */
@Slf4j
public class SnsNotificationSink implements NotificationSink {

    // SNS rejects subjects longer than 100 characters
    private static final int MAX_SUBJECT = 100;

    private final SnsAsyncClient snsClient;
    private final String topicArn;

    public SnsNotificationSink(SnsAsyncClient snsClient, String topicArn) {
        this.snsClient = snsClient;
        this.topicArn = topicArn;
    }

    @Override
    public Mono<Void> publish(RunSummary summary) {
        String subject = RunSummaryFormatter.subject(summary);
        PublishRequest request = PublishRequest.builder()
                .topicArn(topicArn)
                .subject(subject.length() > MAX_SUBJECT ? subject.substring(0, MAX_SUBJECT) : subject)
                .message(RunSummaryFormatter.body(summary))
                .build();

        return Mono.fromFuture(() -> snsClient.publish(request))
                .doOnNext(response -> log.info("Published summary of run {} to {} (message {})",
                        summary.getRunId(), topicArn, response.messageId()))
                .then();
    }
}
