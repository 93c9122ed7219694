package com.openrangelabs.donpetre.mobility.config;

import com.openrangelabs.donpetre.mobility.model.SchemaType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service settings bound from {@code mobility-sync.*}.
 *
 * <p>Settings that depend on the deployment (API key, role ARN, bucket mappings) are
 * allowed to be empty at startup so the application can boot without them; a run checks
 * them when its plan is built.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mobility-sync")
public class MobilitySyncProperties {

    /** Vendor hard limits. Configured values above these are clamped. */
    public static final int VENDOR_MAX_AOIS_PER_REQUEST = 200;
    public static final int VENDOR_MAX_DAYS_PER_REQUEST = 31;

    @Valid
    private Vendor vendor = new Vendor();
    @Valid
    private Retry retry = new Retry();
    @Valid
    private Workers workers = new Workers();
    @Valid
    private Credentials credentials = new Credentials();
    @Valid
    private Transfer transfer = new Transfer();
    @Valid
    private List<Destination> destinations = new ArrayList<>();
    @Valid
    private Registry registry = new Registry();
    @Valid
    private Progress progress = new Progress();
    @Valid
    private Scheduling scheduling = new Scheduling();
    private Notifications notifications = new Notifications();

    public Optional<String> bucketFor(String endpoint, SchemaType schemaType) {
        return destinations.stream()
                .filter(d -> d.getEndpoint().equals(endpoint) && d.getSchema() == schemaType)
                .map(Destination::getBucket)
                .findFirst();
    }

    @Data
    public static class Vendor {
        @NotBlank
        private String baseUrl = "https://platform.prd.veraset.tech/v1";
        private String apiKey;
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(60);
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(60);
        @Min(1)
        private int maxPolls = 100;
        @Min(1)
        @Max(VENDOR_MAX_AOIS_PER_REQUEST)
        private int maxAoisPerRequest = VENDOR_MAX_AOIS_PER_REQUEST;
        @Min(1)
        @Max(VENDOR_MAX_DAYS_PER_REQUEST)
        private int maxDaysPerRequest = VENDOR_MAX_DAYS_PER_REQUEST;
        @NotBlank
        private String sourceBucket = "veraset-prd-platform-us-west-2";
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(30);
        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(10);
        /** Retries of a single poll call before the attempt is given up as transient. */
        @Min(0)
        private int pollCallRetries = 2;
    }

    public enum BackoffStrategy {
        LINEAR, EXPONENTIAL
    }

    @Data
    public static class Workers {
        @Min(1)
        private int concurrency = 4;
    }

    @Data
    public static class Credentials {
        private String roleArn;
        @NotBlank
        private String sessionName = "mobility-sync-session";
        @NotNull
        private Duration sessionDuration = Duration.ofHours(1);
        @NotNull
        private Duration refreshMargin = Duration.ofMinutes(5);
        @NotBlank
        private String region = "us-west-2";
    }

    @Data
    public static class Transfer {
        @NotBlank
        private String includeSuffix = ".parquet";
        @Min(1)
        private int copyConcurrency = 16;
        @NotBlank
        private String destinationRoot = "data";
    }

    @Data
    public static class Destination {
        @NotBlank
        private String endpoint;
        @NotNull
        private SchemaType schema;
        @NotBlank
        private String bucket;
    }

    @Data
    public static class Registry {
        @NotBlank
        private String citiesFile = "db/cities.json";
    }

    @Data
    public static class Progress {
        @NotNull
        private StoreType store = StoreType.R2DBC;
        @Min(1)
        private int retentionDays = 30;

        public enum StoreType {
            R2DBC, MEMORY
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        @NotBlank
        private String dailyCron = "0 0 6 * * *";
        @Min(0)
        private int lagDays = 7;
        @NotBlank
        private String cleanupCron = "0 0 2 * * *";
        private List<Selection> selections = new ArrayList<>();
    }

    @Data
    public static class Selection {
        @NotBlank
        private String endpoint;
        @NotNull
        private SchemaType schema;
    }

    @Data
    public static class Notifications {
        private String snsTopicArn;
    }
}
