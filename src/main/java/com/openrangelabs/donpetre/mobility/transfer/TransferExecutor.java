package com.openrangelabs.donpetre.mobility.transfer;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.credentials.CredentialBroker;
import com.openrangelabs.donpetre.mobility.exception.AuthorizationException;
import com.openrangelabs.donpetre.mobility.exception.SyncException;
import com.openrangelabs.donpetre.mobility.exception.TransferException;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.JobOutput;
import com.openrangelabs.donpetre.mobility.model.TemporaryCredentials;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Copies a job's output from the vendor bucket into the destination bucket.
 *
 * <p>Objects are listed under the job's prefix, filtered by suffix, routed to their
 * canonical destination keys and copied server side. A destination object that
 * already exists with the source's size is left alone, so running the same chunk
 * again rewrites nothing. Every expected destination key is checked afterwards and
 * the transfer only succeeds if all of them are present with the right size.
 *
 * <p>All calls are signed with the assumed-role credentials. If the store rejects
 * them, fresh credentials are requested and the whole transfer is repeated once.
 */
@Component
public class TransferExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransferExecutor.class);

    private static final Set<String> AUTH_ERROR_CODES =
            Set.of("ExpiredToken", "InvalidToken", "AccessDenied", "InvalidAccessKeyId", "TokenRefreshRequired");
    private static final int LOGGED_KEYS = 5;

    private final S3AsyncClient s3Client;
    private final CredentialBroker credentialBroker;
    private final DestinationLayout layout;
    private final MobilitySyncProperties.Transfer settings;

    public TransferExecutor(S3AsyncClient s3Client,
                            CredentialBroker credentialBroker,
                            DestinationLayout layout,
                            MobilitySyncProperties properties) {
        this.s3Client = s3Client;
        this.credentialBroker = credentialBroker;
        this.layout = layout;
        this.settings = properties.getTransfer();
    }

    public Mono<TransferSummary> transfer(Chunk chunk, JobOutput output) {
        return credentialBroker.current()
                .flatMap(credentials -> copyAll(chunk, output, credentials)
                        .onErrorResume(TransferExecutor::isAuthorizationFailure, error -> {
                            logger.warn("{}: object store rejected credentials {} ({}), refreshing and retrying once",
                                    chunk.key(), credentials.accessKeyId(), rootCause(error).getMessage());
                            return credentialBroker.refreshAfterRejection(credentials)
                                    .flatMap(fresh -> copyAll(chunk, output, fresh))
                                    .onErrorMap(TransferExecutor::isAuthorizationFailure,
                                            retryError -> new AuthorizationException(
                                                    "Object store still rejects credentials for " + chunk.key(), rootCause(retryError)));
                        }))
                .onErrorMap(error -> !(error instanceof SyncException),
                        error -> new TransferException("Transfer of " + chunk.key() + " failed: "
                                + rootCause(error).getMessage(), rootCause(error)));
    }

    private Mono<TransferSummary> copyAll(Chunk chunk, JobOutput output, TemporaryCredentials credentials) {
        AwsRequestOverrideConfiguration override = overrideFor(credentials);
        String bucket = chunk.spec().destinationBucket();
        Tally tally = new Tally();

        return listObjects(output, override)
                .doOnNext(object -> tally.listed.incrementAndGet())
                .filter(object -> {
                    boolean included = object.key().endsWith(settings.getIncludeSuffix());
                    if (!included) {
                        tally.filteredOut.incrementAndGet();
                    }
                    return included;
                })
                .flatMapIterable(object -> planCopies(chunk, object, tally))
                .flatMap(copy -> copyOne(output.bucket(), bucket, copy, override, tally), settings.getCopyConcurrency())
                .collectList()
                .flatMap(copies -> {
                    if (!tally.unroutable.isEmpty()) {
                        return Mono.error(new TransferException(chunk.key() + ": " + tally.unroutable.size()
                                + " objects could not be mapped to a destination, e.g. " + sample(tally.unroutable), false));
                    }
                    return verify(chunk, bucket, copies, override);
                })
                .then(Mono.fromSupplier(() -> {
                    TransferSummary summary = tally.toSummary();
                    logger.info("{}: listed {}, filtered {}, copied {}, skipped {} ({} bytes) from {}",
                            chunk.key(), summary.listed(), summary.filteredOut(), summary.copied(),
                            summary.skipped(), summary.bytesCopied(), output.uri());
                    return summary;
                }));
    }

    private Flux<S3Object> listObjects(JobOutput output, AwsRequestOverrideConfiguration override) {
        return listPage(output, null, override)
                .expand(page -> Boolean.TRUE.equals(page.isTruncated()) && page.nextContinuationToken() != null
                        ? listPage(output, page.nextContinuationToken(), override)
                        : Mono.empty())
                .flatMapIterable(ListObjectsV2Response::contents);
    }

    private Mono<ListObjectsV2Response> listPage(JobOutput output, String token, AwsRequestOverrideConfiguration override) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(output.bucket())
                .prefix(output.prefix())
                .continuationToken(token)
                .overrideConfiguration(override)
                .build();
        return Mono.fromFuture(() -> s3Client.listObjectsV2(request));
    }

    private List<PlannedCopy> planCopies(Chunk chunk, S3Object object, Tally tally) {
        List<String> targets = layout.route(object.key(), chunk.aois());
        if (targets.isEmpty()) {
            tally.unroutable.add(object.key());
            return List.of();
        }
        List<PlannedCopy> copies = new ArrayList<>(targets.size());
        for (String target : targets) {
            copies.add(new PlannedCopy(object.key(), target, object.size()));
        }
        return copies;
    }

    private Mono<PlannedCopy> copyOne(String sourceBucket, String destinationBucket, PlannedCopy copy,
                                      AwsRequestOverrideConfiguration override, Tally tally) {
        return headSize(destinationBucket, copy.destinationKey(), override)
                .filter(existing -> existing.equals(copy.size()))
                .map(existing -> {
                    tally.skipped.incrementAndGet();
                    logger.debug("Skipping {}, already present with {} bytes", copy.destinationKey(), existing);
                    return copy;
                })
                .switchIfEmpty(Mono.defer(() -> {
                    CopyObjectRequest request = CopyObjectRequest.builder()
                            .sourceBucket(sourceBucket)
                            .sourceKey(copy.sourceKey())
                            .destinationBucket(destinationBucket)
                            .destinationKey(copy.destinationKey())
                            .overrideConfiguration(override)
                            .build();
                    return Mono.fromFuture(() -> s3Client.copyObject(request))
                            .map(response -> {
                                tally.copied.incrementAndGet();
                                tally.bytes.addAndGet(copy.size() != null ? copy.size() : 0L);
                                logger.debug("Copied {} -> {}", copy.sourceKey(), copy.destinationKey());
                                return copy;
                            });
                }));
    }

    private Mono<Void> verify(Chunk chunk, String bucket, List<PlannedCopy> copies, AwsRequestOverrideConfiguration override) {
        List<String> mismatched = Collections.synchronizedList(new ArrayList<>());
        return Flux.fromIterable(copies)
                .flatMap(copy -> headSize(bucket, copy.destinationKey(), override)
                        .defaultIfEmpty(-1L)
                        .doOnNext(actual -> {
                            if (!actual.equals(copy.size())) {
                                mismatched.add(copy.destinationKey() + " (expected " + copy.size() + ", found " + actual + ")");
                            }
                        }), settings.getCopyConcurrency())
                .then(Mono.defer(() -> mismatched.isEmpty()
                        ? Mono.<Void>empty()
                        : Mono.error(new TransferException(chunk.key() + ": " + mismatched.size()
                                + " destination objects failed verification, e.g. " + sample(mismatched)))));
    }

    /**
     * Size of an object, or empty if it does not exist
     */
    private Mono<Long> headSize(String bucket, String key, AwsRequestOverrideConfiguration override) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .overrideConfiguration(override)
                .build();
        return Mono.fromFuture(() -> s3Client.headObject(request))
                .mapNotNull(response -> response.contentLength())
                .onErrorResume(TransferExecutor::isNotFound, error -> Mono.empty());
    }

    private static AwsRequestOverrideConfiguration overrideFor(TemporaryCredentials credentials) {
        return AwsRequestOverrideConfiguration.builder()
                .credentialsProvider(StaticCredentialsProvider.create(AwsSessionCredentials.create(
                        credentials.accessKeyId(), credentials.secretAccessKey(), credentials.sessionToken())))
                .build();
    }

    static boolean isAuthorizationFailure(Throwable error) {
        Throwable cause = rootCause(error);
        if (cause instanceof AwsServiceException serviceError) {
            if (serviceError.statusCode() == 403) {
                return true;
            }
            return serviceError.awsErrorDetails() != null
                    && AUTH_ERROR_CODES.contains(serviceError.awsErrorDetails().errorCode());
        }
        return false;
    }

    private static boolean isNotFound(Throwable error) {
        Throwable cause = rootCause(error);
        return cause instanceof NoSuchKeyException
                || (cause instanceof AwsServiceException serviceError && serviceError.statusCode() == 404);
    }

    private static Throwable rootCause(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String sample(List<String> keys) {
        List<String> copy;
        synchronized (keys) {
            copy = new ArrayList<>(keys);
        }
        return copy.size() <= LOGGED_KEYS
                ? String.join(", ", copy)
                : String.join(", ", copy.subList(0, LOGGED_KEYS)) + ", ...";
    }

    private record PlannedCopy(String sourceKey, String destinationKey, Long size) {
    }

    private static final class Tally {
        final AtomicLong listed = new AtomicLong();
        final AtomicLong filteredOut = new AtomicLong();
        final AtomicLong copied = new AtomicLong();
        final AtomicLong skipped = new AtomicLong();
        final AtomicLong bytes = new AtomicLong();
        final List<String> unroutable = Collections.synchronizedList(new ArrayList<>());

        TransferSummary toSummary() {
            return new TransferSummary(listed.get(), filteredOut.get(), copied.get(), skipped.get(), bytes.get());
        }
    }
}
