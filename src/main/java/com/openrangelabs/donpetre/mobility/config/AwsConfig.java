package com.openrangelabs.donpetre.mobility.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sts.StsAsyncClient;

/**
 * AWS SDK clients. All of them sign with the default credential chain; calls against
 * the vendor bucket override this per request with the assumed-role credentials.
 */
@Configuration
public class AwsConfig {

    @Bean(destroyMethod = "close")
    public S3AsyncClient s3AsyncClient(MobilitySyncProperties properties) {
        return S3AsyncClient.builder()
                .region(region(properties))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean(destroyMethod = "close")
    public StsAsyncClient stsAsyncClient(MobilitySyncProperties properties) {
        return StsAsyncClient.builder()
                .region(region(properties))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Only created when an SNS topic is configured
     */
    @Lazy
    @Bean(destroyMethod = "close")
    public SnsAsyncClient snsAsyncClient(MobilitySyncProperties properties) {
        return SnsAsyncClient.builder()
                .region(region(properties))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    private static Region region(MobilitySyncProperties properties) {
        return Region.of(properties.getCredentials().getRegion());
    }
}
