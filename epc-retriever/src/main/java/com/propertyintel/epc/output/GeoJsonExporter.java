package com.propertyintel.epc.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.propertyintel.epc.config.EpcProperties;
import com.propertyintel.epc.model.CertificateRecord;
import com.propertyintel.epc.service.PostcodeLookupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes certificates as a GeoJSON FeatureCollection of points for mapping
 * tools.
 *
 * Coordinates come from latitude/longitude fields when the record has them,
 * otherwise from the postcode centroid. Records that end up without
 * coordinates are left out.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GeoJsonExporter {

    public static final List<String> LANDAPP_PROPERTIES = List.of(
            "lmk-key", "address1", "address2", "postcode", "local-authority",
            "current-energy-rating", "potential-energy-rating",
            "current-energy-efficiency", "potential-energy-efficiency",
            "co2-emissions-current", "co2-emissions-potential",
            "total-floor-area", "property-type", "built-form",
            "inspection-date", "lodgement-date", "uprn"
    );

    private static final String LATITUDE = "latitude";
    private static final String LONGITUDE = "longitude";
    private static final List<String> ADDRESS_FIELDS = List.of("address1", "address2", "address3");

    private final EpcProperties properties;
    private final PostcodeLookupService postcodeLookup;
    private final ObjectMapper objectMapper;

    record Point(double latitude, double longitude) {}

    public Optional<Path> export(List<CertificateRecord> records, String filename) {
        return export(records, filename, List.of());
    }

    /**
     * @param includeProperties properties to carry on each feature; empty means all fields
     * @return the written file, or empty when there was nothing to write
     */
    public Optional<Path> export(List<CertificateRecord> records, String filename, List<String> includeProperties) {
        if (records.isEmpty()) {
            log.warn("No data to export");
            return Optional.empty();
        }

        Path outputPath = ExportPaths.resolve(properties.getExport().getOutputDir(), filename, ".geojson");
        ObjectNode collection = toFeatureCollection(records, includeProperties);

        try {
            Files.createDirectories(outputPath.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), collection);
        } catch (IOException e) {
            log.error("Failed to write GeoJSON file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("GeoJSON write failed", e);
        }

        log.info("Exported {} features to {}", collection.path("features").size(), outputPath);
        return Optional.of(outputPath);
    }

    public Optional<Path> exportForLandApp(List<CertificateRecord> records, String filename) {
        return export(records, filename, LANDAPP_PROPERTIES);
    }

    ObjectNode toFeatureCollection(List<CertificateRecord> records, List<String> includeProperties) {
        Map<String, Optional<Point>> postcodeCache = new HashMap<>();
        List<ObjectNode> features = new ArrayList<>();
        int missing = 0;

        for (CertificateRecord record : records) {
            Optional<Point> point = coordinatesOf(record, postcodeCache);
            if (point.isEmpty()) {
                missing++;
                continue;
            }
            features.add(toFeature(record, point.get(), includeProperties));
        }

        if (missing > 0) {
            log.warn("{} records missing coordinates, excluding from GeoJSON", missing);
        }

        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ObjectNode crs = collection.putObject("crs");
        crs.put("type", "name");
        crs.putObject("properties").put("name", properties.getExport().getGeojsonCrs());
        ArrayNode array = collection.putArray("features");
        features.forEach(array::add);
        return collection;
    }

    private ObjectNode toFeature(CertificateRecord record, Point point, List<String> includeProperties) {
        ObjectNode feature = objectMapper.createObjectNode();
        feature.put("type", "Feature");

        ObjectNode geometry = feature.putObject("geometry");
        geometry.put("type", "Point");
        geometry.putArray("coordinates").add(point.longitude()).add(point.latitude());

        ObjectNode props = feature.putObject("properties");
        if (includeProperties == null || includeProperties.isEmpty()) {
            record.getFields().forEach((key, value) -> {
                if (!LATITUDE.equals(key) && !LONGITUDE.equals(key) && value != null) {
                    props.set(key, objectMapper.valueToTree(value));
                }
            });
        } else {
            for (String key : includeProperties) {
                Object value = record.get(key);
                if (value != null) {
                    props.set(key, objectMapper.valueToTree(value));
                }
            }
        }
        props.put("full_address", fullAddress(record));
        return feature;
    }

    private Optional<Point> coordinatesOf(CertificateRecord record, Map<String, Optional<Point>> postcodeCache) {
        Double lat = parseDouble(record.get(LATITUDE));
        Double lng = parseDouble(record.get(LONGITUDE));
        if (lat != null && lng != null) {
            return Optional.of(new Point(lat, lng));
        }

        String postcode = record.getString("postcode");
        if (postcode == null || postcode.isBlank()) {
            return Optional.empty();
        }
        return postcodeCache.computeIfAbsent(postcode.trim().toUpperCase(), this::geocode);
    }

    private Optional<Point> geocode(String postcode) {
        try {
            PostcodeLookupService.PostcodeResult result = postcodeLookup.lookup(postcode);
            return Optional.of(new Point(result.latitude(), result.longitude()));
        } catch (RuntimeException e) {
            log.warn("Could not geocode postcode {}: {}", postcode, e.getMessage());
            return Optional.empty();
        }
    }

    private String fullAddress(CertificateRecord record) {
        List<String> parts = new ArrayList<>();
        for (String field : ADDRESS_FIELDS) {
            String value = record.getString(field);
            if (value != null && !value.isBlank()) {
                parts.add(value.trim());
            }
        }
        String postcode = record.getString("postcode");
        if (postcode != null && !postcode.isBlank()) {
            parts.add(postcode.trim());
        }
        return String.join(", ", parts);
    }

    private Double parseDouble(Object val) {
        if (val == null) return null;
        if (val instanceof Number n) return n.doubleValue();
        String s = val.toString();
        if (s.isBlank()) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
