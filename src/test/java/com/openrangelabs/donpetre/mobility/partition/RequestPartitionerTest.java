package com.openrangelabs.donpetre.mobility.partition;

import com.openrangelabs.donpetre.mobility.Fixtures;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.Coordinate;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SchemaType;
import com.openrangelabs.donpetre.mobility.model.SyncSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestPartitionerTest {

    private RequestPartitioner partitioner;

    @BeforeEach
    void setUp() {
        partitioner = new RequestPartitioner(200, 31);
    }

    @Test
    void partition_450AoisTenDays_ThreeBatchesOneWindow() {
        List<Chunk> chunks = partitioner.partition(Fixtures.radii(450),
                Fixtures.days("2026-01-01", "2026-01-10"), List.of(Fixtures.spec()));

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(Chunk::size).containsExactly(200, 200, 50);
        assertThat(chunks).extracting(chunk -> chunk.window().days()).containsOnly(10);
    }

    @Test
    void partition_50Aois65Days_OneBatchThreeWindows() {
        List<Chunk> chunks = partitioner.partition(Fixtures.radii(50),
                Fixtures.days("2026-01-01", "2026-03-06"), List.of(Fixtures.spec()));

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(chunk -> chunk.window().days()).containsExactly(31, 31, 3);
        assertThat(chunks).extracting(Chunk::size).containsOnly(50);
    }

    @ParameterizedTest
    @CsvSource({
            "1, 2026-01-01, 2026-01-01",
            "199, 2026-01-01, 2026-01-31",
            "200, 2026-01-01, 2026-02-01",
            "201, 2026-02-01, 2026-04-30",
            "1000, 2025-01-01, 2025-12-31"
    })
    void partition_BatchesCoverEveryAoiExactlyOnce(int count, LocalDate from, LocalDate to) {
        List<Aoi> aois = Fixtures.radii(count);
        DateWindow range = DateWindow.of(from, to);

        List<List<Aoi>> batches = partitioner.batches(aois);

        assertThat(batches).hasSize((count + 199) / 200);
        assertThat(batches).allSatisfy(batch -> assertThat(batch).hasSizeLessThanOrEqualTo(200));
        List<Aoi> union = new ArrayList<>();
        batches.forEach(union::addAll);
        assertThat(union).containsExactlyInAnyOrderElementsOf(aois);

        List<DateWindow> windows = partitioner.windows(range);
        assertThat(windows).hasSize((range.days() + 30) / 31);
        assertThat(windows.get(0).from()).isEqualTo(from);
        assertThat(windows.get(windows.size() - 1).to()).isEqualTo(to);
        for (int i = 1; i < windows.size(); i++) {
            assertThat(windows.get(i).from()).isEqualTo(windows.get(i - 1).to().plusDays(1));
        }
        assertThat(windows).allSatisfy(window -> assertThat(window.days()).isBetween(1, 31));
        assertThat(windows.stream().mapToInt(DateWindow::days).sum()).isEqualTo(range.days());
    }

    @Test
    void partition_MultipleSelections_MultipliesChunks() {
        SyncSpec trips = new SyncSpec("movement/job/trips", SchemaType.TRIPS, "trips-bucket");

        List<Chunk> chunks = partitioner.partition(Fixtures.radii(250),
                Fixtures.days("2026-01-01", "2026-02-15"), List.of(Fixtures.spec(), trips));

        assertThat(chunks).hasSize(2 * 2 * 2);
        Set<String> keys = new HashSet<>();
        chunks.forEach(chunk -> keys.add(chunk.key().asString()));
        assertThat(keys).hasSize(8);
        assertThat(keys).contains("movement-job-pings:BASIC:b000:w000", "movement-job-trips:TRIPS:b001:w001");
    }

    @Test
    void partition_ShuffledInput_SameKeysAndBatches() {
        List<Aoi> aois = Fixtures.radii(420);
        List<Aoi> shuffled = new ArrayList<>(aois);
        Collections.shuffle(shuffled);

        List<Chunk> first = partitioner.partition(aois, Fixtures.days("2026-01-01", "2026-01-05"), List.of(Fixtures.spec()));
        List<Chunk> second = partitioner.partition(shuffled, Fixtures.days("2026-01-01", "2026-01-05"), List.of(Fixtures.spec()));

        assertThat(second).extracting(Chunk::key).containsExactlyElementsOf(first.stream().map(Chunk::key).toList());
        for (int i = 0; i < first.size(); i++) {
            assertThat(second.get(i).aois()).containsExactlyElementsOf(first.get(i).aois());
        }
    }

    @Test
    void partition_ConfiguredLimitsAboveVendorCap_AreClamped() {
        RequestPartitioner generous = new RequestPartitioner(500, 90);

        List<Chunk> chunks = generous.partition(Fixtures.radii(201),
                Fixtures.days("2026-01-01", "2026-02-01"), List.of(Fixtures.spec()));

        assertThat(chunks).hasSize(4);
    }

    @Test
    void partition_EmptyAoiList_ThrowsConfigurationException() {
        assertThatThrownBy(() -> partitioner.partition(List.of(),
                Fixtures.days("2026-01-01", "2026-01-02"), List.of(Fixtures.spec())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No AOIs");
    }

    @Test
    void partition_MissingCoordinates_ThrowsConfigurationException() {
        Aoi broken = Fixtures.radius("broken").toBuilder().latitude(null).build();

        assertThatThrownBy(() -> partitioner.partition(List.of(broken),
                Fixtures.days("2026-01-01", "2026-01-02"), List.of(Fixtures.spec())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void partition_NonPositiveRadius_ThrowsConfigurationException() {
        Aoi broken = Fixtures.radius("zero").toBuilder().radiusMeters(0.0).build();

        assertThatThrownBy(() -> partitioner.partition(List.of(broken),
                Fixtures.days("2026-01-01", "2026-01-02"), List.of(Fixtures.spec())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("positive radius");
    }

    @Test
    void partition_EmptyPolygonRing_ThrowsConfigurationException() {
        Aoi broken = Fixtures.polygon("empty").toBuilder().polygon(List.of()).build();

        assertThatThrownBy(() -> partitioner.partition(List.of(broken),
                Fixtures.days("2026-01-01", "2026-01-02"), List.of(Fixtures.spec())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("empty polygon");
    }

    @Test
    void partition_DegeneratePolygon_ThrowsConfigurationException() {
        Aoi broken = Fixtures.polygon("line").toBuilder()
                .polygon(List.of(Coordinate.of(1, 1), Coordinate.of(2, 2), Coordinate.of(1, 1)))
                .build();

        assertThatThrownBy(() -> partitioner.partition(List.of(broken),
                Fixtures.days("2026-01-01", "2026-01-02"), List.of(Fixtures.spec())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("3 distinct vertices");
    }

    @Test
    void partition_DuplicatePoiId_ThrowsConfigurationException() {
        assertThatThrownBy(() -> partitioner.partition(List.of(Fixtures.radius("same"), Fixtures.radius("same")),
                Fixtures.days("2026-01-01", "2026-01-02"), List.of(Fixtures.spec())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate poi_id");
    }

    @Test
    void dateWindow_EndBeforeStart_Rejected() {
        assertThatThrownBy(() -> Fixtures.days("2026-01-02", "2026-01-01"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
