package com.openrangelabs.donpetre.mobility.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.Coordinate;
import com.openrangelabs.donpetre.mobility.model.GeometryKind;
import com.openrangelabs.donpetre.mobility.transfer.DestinationLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Registry backed by a {@code cities.json} file.
 *
 * <p>Each entry carries {@code country}, optional {@code state_province}, {@code city},
 * {@code latitude}, {@code longitude} and either {@code radius_meters} or
 * {@code polygon_geojson} (a GeoJSON Feature or a bare Polygon geometry). Entries
 * without an explicit {@code poi_id} fall back to {@code city_id}, then to
 * {@code {city}_center} or {@code {city}_polygon}.
 *
 * <p>The path is looked up on the file system first and on the classpath second.
 */
@Component
public class JsonFileAoiRegistry implements AoiRegistry {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileAoiRegistry.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String location;

    @Autowired
    public JsonFileAoiRegistry(ObjectMapper objectMapper, MobilitySyncProperties properties) {
        this(objectMapper, new DefaultResourceLoader(), properties.getRegistry().getCitiesFile());
    }

    JsonFileAoiRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader, String location) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    @Override
    public Flux<Aoi> snapshot() {
        return Mono.fromCallable(this::load)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(aois -> aois);
    }

    List<Aoi> load() throws IOException {
        Resource resource = resolve();
        if (!resource.exists()) {
            throw new ConfigurationException("AOI registry file not found: " + location);
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        }
        if (root == null || !root.isArray()) {
            throw new ConfigurationException("AOI registry " + location + " must contain a JSON array");
        }

        List<Aoi> aois = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            aois.add(toAoi(entry));
        }
        logger.info("Loaded {} AOIs from {}", aois.size(), location);
        return aois;
    }

    private Resource resolve() {
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        FileSystemResource file = new FileSystemResource(location);
        return file.exists() ? file : resourceLoader.getResource("classpath:" + location);
    }

    Aoi toAoi(JsonNode entry) {
        String country = firstText(entry, "country", "Country");
        String state = firstText(entry, "state_province", "State/Province", "state");
        String city = firstText(entry, "city", "City");

        Aoi.AoiBuilder builder = Aoi.builder()
                .country(country)
                .stateProvince(state)
                .city(city)
                .latitude(number(entry, "latitude"))
                .longitude(number(entry, "longitude"));

        String poiId = firstText(entry, "poi_id", "city_id");
        if (entry.hasNonNull("radius_meters")) {
            builder.kind(GeometryKind.RADIUS).radiusMeters(entry.get("radius_meters").asDouble());
            if (poiId == null) {
                poiId = DestinationLayout.normalise(city) + "_center";
            }
        } else if (entry.hasNonNull("polygon_geojson")) {
            builder.kind(GeometryKind.POLYGON).polygon(outerRing(entry.get("polygon_geojson"), city));
            if (poiId == null) {
                poiId = DestinationLayout.normalise(city) + "_polygon";
            }
        }
        return builder.poiId(poiId).build();
    }

    private List<Coordinate> outerRing(JsonNode geoJson, String city) {
        JsonNode geometry = geoJson.has("geometry") ? geoJson.get("geometry") : geoJson;
        String type = geometry.path("type").asText();
        if (!"Polygon".equals(type)) {
            throw new ConfigurationException("Unsupported geometry type '" + type + "' for " + city);
        }
        List<Coordinate> ring = new ArrayList<>();
        for (JsonNode vertex : geometry.path("coordinates").path(0)) {
            if (!vertex.isArray() || vertex.size() < 2 || !vertex.get(0).isNumber() || !vertex.get(1).isNumber()) {
                throw new ConfigurationException("Polygon vertex " + ring.size() + " of " + city
                        + " is not a [longitude, latitude] pair: " + vertex);
            }
            ring.add(Coordinate.of(vertex.get(0).asDouble(), vertex.get(1).asDouble()));
        }
        return ring;
    }

    private static String firstText(JsonNode entry, String... fields) {
        for (String field : fields) {
            JsonNode node = entry.get(field);
            if (node != null && !node.isNull() && !node.asText().isBlank()) {
                return node.asText().trim();
            }
        }
        return null;
    }

    private static Double number(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.valueOf(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Field '" + field + "' is not a number: " + node.asText(), e);
        }
    }
}
