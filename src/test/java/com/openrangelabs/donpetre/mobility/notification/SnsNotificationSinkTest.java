package com.openrangelabs.donpetre.mobility.notification;

import com.openrangelabs.donpetre.mobility.Fixtures;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.ChunkResult;
import com.openrangelabs.donpetre.mobility.model.RunStatus;
import com.openrangelabs.donpetre.mobility.model.RunSummary;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnsNotificationSinkTest {

    private static final String TOPIC = "arn:aws:sns:us-west-2:123456789012:mobility-sync";

    @Mock
    private SnsAsyncClient snsClient;

    @Test
    void publish_PartialFailure_ListsFailedChunks() {
        // Arrange
        ChunkKey ok = ChunkKey.of(0, 0, Fixtures.spec());
        ChunkKey broken = ChunkKey.of(1, 0, Fixtures.spec());
        RunSummary summary = RunSummary.builder("daily-2026-10-12", Fixtures.days("2026-10-12", "2026-10-12"))
                .totalChunks(2)
                .addResult(ChunkResult.succeeded(ok, 1, new TransferSummary(5, 1, 4, 0, 4096)))
                .addResult(ChunkResult.failed(broken, 3, "JobFailedException: out of quota"))
                .build();
        when(snsClient.publish(any(PublishRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(PublishResponse.builder().messageId("m-1").build()));

        // Act & Assert
        StepVerifier.create(new SnsNotificationSink(snsClient, TOPIC).publish(summary))
                .verifyComplete();

        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        verify(snsClient).publish(request.capture());
        assertThat(summary.getStatus()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(request.getValue().topicArn()).isEqualTo(TOPIC);
        assertThat(request.getValue().subject()).isEqualTo("Mobility sync daily-2026-10-12: PARTIAL_FAILURE");
        assertThat(request.getValue().message())
                .contains("Chunks: 2 (succeeded 1, already done 0, failed 1, not started 0)")
                .contains("Objects: copied 4, unchanged 0, bytes 4096")
                .contains(broken.asString() + ": JobFailedException: out of quota");
    }

    @Test
    void publish_AbortedRun_CarriesReason() {
        RunSummary summary = RunSummary.builder("manual-1", Fixtures.days("2026-10-12", "2026-10-12"))
                .abortReason("AOI registry not found: cities.json")
                .build();
        when(snsClient.publish(any(PublishRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(PublishResponse.builder().messageId("m-3").build()));

        new SnsNotificationSink(snsClient, TOPIC).publish(summary).block();

        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        verify(snsClient).publish(request.capture());
        assertThat(request.getValue().subject()).isEqualTo("Mobility sync manual-1: ABORTED");
        assertThat(request.getValue().message()).contains("Aborted: AOI registry not found: cities.json");
    }

    @Test
    void publish_LongRunId_SubjectTruncated() {
        RunSummary summary = RunSummary.builder("r".repeat(150), Fixtures.days("2026-10-12", "2026-10-12")).build();
        when(snsClient.publish(any(PublishRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(PublishResponse.builder().messageId("m-2").build()));

        new SnsNotificationSink(snsClient, TOPIC).publish(summary).block();

        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        verify(snsClient).publish(request.capture());
        assertThat(request.getValue().subject()).hasSize(100);
    }
}
