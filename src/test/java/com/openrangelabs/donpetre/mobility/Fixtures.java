package com.openrangelabs.donpetre.mobility;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.Coordinate;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.GeometryKind;
import com.openrangelabs.donpetre.mobility.model.PollPolicy;
import com.openrangelabs.donpetre.mobility.model.RetryPolicy;
import com.openrangelabs.donpetre.mobility.model.RunPlan;
import com.openrangelabs.donpetre.mobility.model.SchemaType;
import com.openrangelabs.donpetre.mobility.model.SyncSpec;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data
 */
public final class Fixtures {

    public static final String ENDPOINT = "movement/job/pings";
    public static final String DESTINATION_BUCKET = "dest-bucket";
    public static final String ROLE_ARN = "arn:aws:iam::123456789012:role/vendor-read";

    private Fixtures() {
    }

    public static Aoi radius(String poiId) {
        return Aoi.builder()
                .poiId(poiId)
                .country("Canada")
                .stateProvince("Ontario")
                .city("City " + poiId)
                .latitude(43.7)
                .longitude(-79.4)
                .kind(GeometryKind.RADIUS)
                .radiusMeters(1000.0)
                .build();
    }

    public static Aoi toronto() {
        return Aoi.builder()
                .poiId("toronto")
                .country("Canada")
                .stateProvince("Ontario")
                .city("Toronto")
                .latitude(43.7)
                .longitude(-79.4)
                .kind(GeometryKind.RADIUS)
                .radiusMeters(50000.0)
                .build();
    }

    public static Aoi polygon(String poiId) {
        return Aoi.builder()
                .poiId(poiId)
                .country("Australia")
                .city("Logan")
                .kind(GeometryKind.POLYGON)
                .polygon(List.of(
                        Coordinate.of(153.0, -27.6),
                        Coordinate.of(153.2, -27.6),
                        Coordinate.of(153.2, -27.8),
                        Coordinate.of(153.0, -27.8)))
                .build();
    }

    public static List<Aoi> radii(int count) {
        List<Aoi> aois = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            aois.add(radius(String.format("aoi-%04d", i)));
        }
        return aois;
    }

    public static SyncSpec spec() {
        return new SyncSpec(ENDPOINT, SchemaType.BASIC, DESTINATION_BUCKET);
    }

    public static DateWindow days(String from, String to) {
        return DateWindow.of(LocalDate.parse(from), LocalDate.parse(to));
    }

    public static Chunk chunk(int batch, List<Aoi> aois) {
        return new Chunk(ChunkKey.of(batch, 0, spec()), aois, days("2026-10-01", "2026-10-01"), spec());
    }

    public static RunPlan plan(String runId, int maxAttempts, int workers) {
        return new RunPlan(runId, days("2026-10-01", "2026-10-01"), List.of(spec()),
                RetryPolicy.noBackoff(maxAttempts),
                new PollPolicy(Duration.ofSeconds(60), 100, 2),
                workers);
    }

    public static MobilitySyncProperties properties() {
        MobilitySyncProperties properties = new MobilitySyncProperties();
        properties.getVendor().setApiKey("test-api-key");
        properties.getCredentials().setRoleArn(ROLE_ARN);

        MobilitySyncProperties.Destination destination = new MobilitySyncProperties.Destination();
        destination.setEndpoint(ENDPOINT);
        destination.setSchema(SchemaType.BASIC);
        destination.setBucket(DESTINATION_BUCKET);
        properties.getDestinations().add(destination);
        return properties;
    }
}
