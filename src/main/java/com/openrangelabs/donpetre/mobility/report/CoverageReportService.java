package com.openrangelabs.donpetre.mobility.report;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import com.openrangelabs.donpetre.mobility.registry.AoiRegistry;
import com.openrangelabs.donpetre.mobility.transfer.DestinationLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports dates with no {@code date=} partition in the destination bucket for each
 * location of the registry. Runs with the service's own credentials; the destination
 * bucket is ours.
 */
@Service
public class CoverageReportService {

    private static final Logger logger = LoggerFactory.getLogger(CoverageReportService.class);

    private static final int LIST_CONCURRENCY = 8;

    private final S3AsyncClient s3Client;
    private final AoiRegistry registry;
    private final DestinationLayout layout;
    private final MobilitySyncProperties properties;

    public CoverageReportService(S3AsyncClient s3Client, AoiRegistry registry,
                                 DestinationLayout layout, MobilitySyncProperties properties) {
        this.s3Client = s3Client;
        this.registry = registry;
        this.layout = layout;
        this.properties = properties;
    }

    public Mono<CoverageReport> report(SyncSelection selection, DateWindow range) {
        return Mono.defer(() -> {
            String bucket = properties.bucketFor(selection.endpoint(), selection.schemaType())
                    .orElseThrow(() -> new ConfigurationException("No destination bucket configured for " + selection));

            return registry.snapshot()
                    .distinct(layout::aoiPrefix)
                    .flatMap(aoi -> coverageOf(bucket, aoi, range), LIST_CONCURRENCY)
                    .sort(Comparator.comparing(CoverageReport.LocationCoverage::prefix))
                    .collectList()
                    .map(locations -> new CoverageReport(bucket, selection.endpoint(),
                            selection.schemaType().name(), range, locations))
                    .doOnNext(report -> logger.info("Coverage of {} in {} for {}: {} of {} locations incomplete",
                            selection, bucket, range, report.incompleteLocations(), report.locations().size()));
        });
    }

    private Mono<CoverageReport.LocationCoverage> coverageOf(String bucket, Aoi aoi, DateWindow range) {
        String prefix = layout.aoiPrefix(aoi);
        return presentDates(bucket, prefix)
                .map(present -> {
                    List<LocalDate> missing = new ArrayList<>();
                    int presentDays = 0;
                    for (LocalDate date : range.dates()) {
                        if (present.contains(date)) {
                            presentDays++;
                        } else {
                            missing.add(date);
                        }
                    }
                    return new CoverageReport.LocationCoverage(aoi.label(), prefix, presentDays,
                            missing, groupIntoRanges(missing));
                });
    }

    private Mono<Set<LocalDate>> presentDates(String bucket, String prefix) {
        return listPage(bucket, prefix, null)
                .expand(page -> Boolean.TRUE.equals(page.isTruncated()) && page.nextContinuationToken() != null
                        ? listPage(bucket, prefix, page.nextContinuationToken())
                        : Mono.empty())
                .flatMapIterable(ListObjectsV2Response::commonPrefixes)
                .map(CommonPrefix::prefix)
                .flatMap(partition -> Mono.justOrEmpty(DestinationLayout.dateOf(partition)))
                .collect(Collectors.toSet());
    }

    private Mono<ListObjectsV2Response> listPage(String bucket, String prefix, String token) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .delimiter("/")
                .continuationToken(token)
                .build();
        return Mono.fromFuture(() -> s3Client.listObjectsV2(request));
    }

    /**
     * Collapses sorted dates into contiguous ranges
     */
    static List<DateWindow> groupIntoRanges(List<LocalDate> sortedDates) {
        List<DateWindow> ranges = new ArrayList<>();
        if (sortedDates.isEmpty()) {
            return ranges;
        }
        LocalDate start = sortedDates.get(0);
        LocalDate previous = start;
        for (LocalDate date : sortedDates.subList(1, sortedDates.size())) {
            if (!date.equals(previous.plusDays(1))) {
                ranges.add(DateWindow.of(start, previous));
                start = date;
            }
            previous = date;
        }
        ranges.add(DateWindow.of(start, previous));
        return ranges;
    }
}
