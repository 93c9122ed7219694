package com.openrangelabs.donpetre.mobility.credentials;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.exception.AuthorizationException;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.exception.SyncException;
import com.openrangelabs.donpetre.mobility.model.TemporaryCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.sts.StsAsyncClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the assumed-role credentials used to read the vendor's output bucket.
 *
 * <p>The cached value is a {@link Mono} so that a refresh in progress can be shared:
 * callers arriving while an assume-role call is outstanding subscribe to the same
 * pending result rather than issuing their own. A refresh only replaces the entry it
 * observed as stale; if another caller has already replaced it, the newer entry wins.
 */
@Component
public class CredentialBroker {

    private static final Logger logger = LoggerFactory.getLogger(CredentialBroker.class);

    private final StsAsyncClient stsClient;
    private final MobilitySyncProperties.Credentials settings;
    private final Clock clock;

    private final AtomicReference<Mono<TemporaryCredentials>> cached = new AtomicReference<>();

    public CredentialBroker(StsAsyncClient stsClient, MobilitySyncProperties properties, Clock clock) {
        this.stsClient = stsClient;
        this.settings = properties.getCredentials();
        this.clock = clock;
    }

    /**
     * Returns valid credentials, refreshing them first if they expire within the
     * configured margin.
     */
    public Mono<TemporaryCredentials> current() {
        return Mono.defer(() -> {
            Mono<TemporaryCredentials> entry = cached.get();
            if (entry == null) {
                return refresh(null);
            }
            return entry.flatMap(credentials ->
                    credentials.expiresWithin(settings.getRefreshMargin(), clock.instant())
                            ? refresh(entry)
                            : Mono.just(credentials));
        });
    }

    /**
     * Called after the object store rejected {@code rejected}. Refreshes unless another
     * caller has already replaced those credentials, in which case the replacement is
     * returned.
     */
    public Mono<TemporaryCredentials> refreshAfterRejection(TemporaryCredentials rejected) {
        return Mono.defer(() -> {
            Mono<TemporaryCredentials> entry = cached.get();
            if (entry == null) {
                return refresh(null);
            }
            return entry.flatMap(credentials -> credentials.equals(rejected)
                    ? refresh(entry)
                    : Mono.just(credentials));
        });
    }

    private Mono<TemporaryCredentials> refresh(Mono<TemporaryCredentials> stale) {
        Mono<TemporaryCredentials> fresh = Mono.defer(this::assumeRole).cache();
        if (!cached.compareAndSet(stale, fresh)) {
            Mono<TemporaryCredentials> winner = cached.get();
            return winner != null ? winner : current();
        }
        // a failed refresh must not stay cached, the next caller tries again
        return fresh.doOnError(error -> cached.compareAndSet(fresh, null));
    }

    private Mono<TemporaryCredentials> assumeRole() {
        String roleArn = settings.getRoleArn();
        if (roleArn == null || roleArn.isBlank()) {
            return Mono.error(new ConfigurationException("mobility-sync.credentials.role-arn is not set"));
        }

        AssumeRoleRequest request = AssumeRoleRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(settings.getSessionName())
                .durationSeconds((int) settings.getSessionDuration().getSeconds())
                .build();

        logger.info("Assuming role {} for session {}", roleArn, settings.getSessionName());
        return Mono.fromFuture(() -> stsClient.assumeRole(request))
                .map(response -> toTemporaryCredentials(response.credentials()))
                .doOnNext(credentials -> logger.info("Obtained credentials {} valid until {}",
                        credentials.accessKeyId(), credentials.expiration()))
                .onErrorMap(error -> !(error instanceof SyncException),
                        error -> new AuthorizationException("Failed to assume role " + roleArn + ": " + error.getMessage(), error));
    }

    private static TemporaryCredentials toTemporaryCredentials(Credentials credentials) {
        return new TemporaryCredentials(
                credentials.accessKeyId(),
                credentials.secretAccessKey(),
                credentials.sessionToken(),
                credentials.expiration());
    }
}
