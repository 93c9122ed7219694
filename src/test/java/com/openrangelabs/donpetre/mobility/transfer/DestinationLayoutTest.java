package com.openrangelabs.donpetre.mobility.transfer;

import com.openrangelabs.donpetre.mobility.Fixtures;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DestinationLayoutTest {

    private final DestinationLayout layout = new DestinationLayout("/data/");

    @Test
    void aoiPrefix_WithState_NormalisesEverySegment() {
        Aoi aoi = Fixtures.toronto().toBuilder().country(" Canada ").city("North York").build();

        assertThat(layout.aoiPrefix(aoi)).isEqualTo("data/canada/ontario/north_york/");
    }

    @Test
    void aoiPrefix_WithoutState_SkipsStateSegment() {
        assertThat(layout.aoiPrefix(Fixtures.polygon("logan"))).isEqualTo("data/australia/logan/");
    }

    @Test
    void route_TaggedObject_GoesToItsAoiOnly() {
        List<Aoi> aois = List.of(Fixtures.toronto(), Fixtures.polygon("logan"));

        List<String> keys = layout.route("exports/job-1/date=2026-10-01/poi_id=logan/part-0001.parquet", aois);

        assertThat(keys).containsExactly("data/australia/logan/date=2026-10-01/part-0001.parquet");
    }

    @Test
    void route_UntaggedObjectInSingleAoiChunk_GoesToThatAoi() {
        List<String> keys = layout.route("exports/job-1/date=2026-10-02/part-0001.parquet", List.of(Fixtures.toronto()));

        assertThat(keys).containsExactly("data/canada/ontario/toronto/date=2026-10-02/part-0001.parquet");
    }

    @Test
    void route_UntaggedObjectInMultiAoiChunk_ReturnsNothing() {
        List<String> keys = layout.route("exports/job-1/date=2026-10-01/part-00000.parquet", Fixtures.radii(200));

        assertThat(keys).isEmpty();
    }

    @Test
    void route_NoDateSegment_ReturnsNothing() {
        assertThat(layout.route("exports/job-1/part-0001.parquet", List.of(Fixtures.toronto()))).isEmpty();
        assertThat(layout.route("exports/date=garbage/part-0001.parquet", List.of(Fixtures.toronto()))).isEmpty();
    }

    @Test
    void route_UnknownPoiId_ReturnsNothing() {
        assertThat(layout.route("exports/date=2026-10-01/poi_id=elsewhere/a.parquet", List.of(Fixtures.toronto())))
                .isEmpty();
    }

    @Test
    void dateOf_TimestampedSegment_UsesDatePart() {
        assertThat(DestinationLayout.dateOf("x/date=2026-10-01T00:00:00/y")).contains(LocalDate.of(2026, 10, 1));
    }

    @Test
    void restAfterDate_DropsPoiAndEmptySegments() {
        assertThat(DestinationLayout.restAfterDate("a/date=2026-10-01//poi_id=p/hour=3/f.parquet"))
                .isEqualTo("hour=3/f.parquet");
    }
}
