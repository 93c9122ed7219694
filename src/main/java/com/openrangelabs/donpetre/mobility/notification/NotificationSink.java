package com.openrangelabs.donpetre.mobility.notification;

import com.openrangelabs.donpetre.mobility.model.RunSummary;
import reactor.core.publisher.Mono;

/**
 * Receives the summary of every finished run
 */
public interface NotificationSink {

    Mono<Void> publish(RunSummary summary);
}
