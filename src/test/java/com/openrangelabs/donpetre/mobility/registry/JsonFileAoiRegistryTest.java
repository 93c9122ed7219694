package com.openrangelabs.donpetre.mobility.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.Coordinate;
import com.openrangelabs.donpetre.mobility.model.GeometryKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileAoiRegistryTest {

    private ObjectMapper objectMapper;
    private JsonFileAoiRegistry registry;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        registry = new JsonFileAoiRegistry(objectMapper, new DefaultResourceLoader(), "db/cities.json");
    }

    @Test
    void snapshot_BundledRegistry_LoadsRadiusAois() {
        StepVerifier.create(registry.snapshot())
                .assertNext(aoi -> {
                    assertThat(aoi.getPoiId()).isEqualTo("toronto");
                    assertThat(aoi.getKind()).isEqualTo(GeometryKind.RADIUS);
                    assertThat(aoi.getRadiusMeters()).isEqualTo(50000.0);
                    assertThat(aoi.label()).isEqualTo("Canada / Ontario / Toronto");
                })
                .assertNext(aoi -> assertThat(aoi.getCity()).isEqualTo("Logan"))
                .verifyComplete();
    }

    @Test
    void snapshot_MissingFile_RaisesConfigurationException() {
        JsonFileAoiRegistry missing = new JsonFileAoiRegistry(objectMapper, new DefaultResourceLoader(), "db/nowhere.json");

        StepVerifier.create(missing.snapshot())
                .expectError(ConfigurationException.class)
                .verify();
    }

    @Test
    void toAoi_SpreadsheetHeadersAndFeaturePolygon() throws Exception {
        Aoi aoi = registry.toAoi(objectMapper.readTree("""
                {
                  "Country": "Australia",
                  "State/Province": "",
                  "City": "Gold Coast",
                  "polygon_geojson": {
                    "type": "Feature",
                    "geometry": {
                      "type": "Polygon",
                      "coordinates": [[[153.3, -27.9], [153.5, -27.9], [153.5, -28.1], [153.3, -27.9]]]
                    }
                  }
                }
                """));

        assertThat(aoi.getPoiId()).isEqualTo("gold_coast_polygon");
        assertThat(aoi.hasStateProvince()).isFalse();
        assertThat(aoi.getKind()).isEqualTo(GeometryKind.POLYGON);
        assertThat(aoi.getPolygon()).hasSize(4).startsWith(Coordinate.of(153.3, -27.9));
    }

    @Test
    void toAoi_RadiusWithoutId_DerivesCentreId() throws Exception {
        Aoi aoi = registry.toAoi(objectMapper.readTree("""
                {"country": "Canada", "city": "North York", "latitude": "43.76", "longitude": "-79.41", "radius_meters": 8000}
                """));

        assertThat(aoi.getPoiId()).isEqualTo("north_york_center");
        assertThat(aoi.getLatitude()).isEqualTo(43.76);
    }

    @Test
    void toAoi_MultiPolygon_Rejected() throws Exception {
        assertThatThrownBy(() -> registry.toAoi(objectMapper.readTree("""
                {"country": "X", "city": "Y", "polygon_geojson": {"type": "MultiPolygon", "coordinates": []}}
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MultiPolygon");
    }

    @Test
    void toAoi_NonNumericCoordinate_Rejected() throws Exception {
        assertThatThrownBy(() -> registry.toAoi(objectMapper.readTree("""
                {"country": "X", "city": "Y", "latitude": "north", "longitude": 1, "radius_meters": 10}
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("latitude");
    }

    @Test
    void toAoi_ShortPolygonVertex_Rejected() throws Exception {
        assertThatThrownBy(() -> registry.toAoi(objectMapper.readTree("""
                {"country": "X", "city": "Y", "polygon_geojson": {"type": "Polygon",
                  "coordinates": [[[153.0, -27.6], [153.2], [153.2, -27.8], [153.0, -27.6]]]}}
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("vertex 1 of Y");
    }

    @Test
    void toAoi_NonNumericPolygonVertex_Rejected() throws Exception {
        assertThatThrownBy(() -> registry.toAoi(objectMapper.readTree("""
                {"country": "X", "city": "Y", "polygon_geojson": {"type": "Polygon",
                  "coordinates": [[["153.0", -27.6], [153.2, -27.6], [153.2, -27.8]]]}}
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("vertex 0 of Y");
    }
}
