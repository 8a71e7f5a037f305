package com.propertyintel.epc.config;

import com.propertyintel.epc.cache.CertificateCache;
import com.propertyintel.epc.model.CacheStats;
import com.propertyintel.epc.model.CleanupResult;
import com.propertyintel.epc.model.PropertyType;
import com.propertyintel.epc.model.SearchResult;
import com.propertyintel.epc.output.CsvExporter;
import com.propertyintel.epc.output.GeoJsonExporter;
import com.propertyintel.epc.service.EpcSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@RestController
@Slf4j
@RequiredArgsConstructor
public class EpcController {

    private static final Set<String> CONTROL_PARAMS = Set.of("refresh", "format", "filename", "preset");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final EpcSearchService searchService;
    private final CertificateCache cache;
    private final CsvExporter csvExporter;
    private final GeoJsonExporter geoJsonExporter;
    private final EpcProperties properties;

    // ── Search ────────────────────────────────────────────────────────────────

    /**
     * Search a register. Every query parameter other than refresh is passed
     * to the EPC API as a filter.
     *
     * GET /search/domestic?postcode=SW1A+1AA
     */
    @GetMapping("/search/{propertyType}")
    public ResponseEntity<?> search(
            @PathVariable String propertyType,
            @RequestParam(defaultValue = "false") boolean refresh,
            @RequestParam Map<String, String> allParams) {
        try {
            PropertyType type = PropertyType.fromValue(propertyType);
            SearchResult result = searchService.search(type, filtersFrom(allParams), !refresh);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("propertyType", type.value());
            body.put("filters", result.getFilters());
            body.put("recordCount", result.getRecordCount());
            body.put("pages", result.getPages());
            body.put("terminationReason", result.getTerminationReason());
            body.put("complete", result.isComplete());
            body.put("fromCache", result.isFromCache());
            body.put("records", result.getRecords());
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Search failed for {} {}: {}", propertyType, allParams, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/certificates/{propertyType}/{certificateId}")
    public ResponseEntity<?> certificate(@PathVariable String propertyType, @PathVariable String certificateId) {
        try {
            PropertyType type = PropertyType.fromValue(propertyType);
            return searchService.getCertificate(type, certificateId)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Certificate lookup failed for {}: {}", certificateId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Cache ─────────────────────────────────────────────────────────────────

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(cache.stats());
    }

    @PostMapping("/cache/cleanup")
    public ResponseEntity<CleanupResult> cleanup(@RequestParam(required = false) Integer maxAgeDays) {
        int days = maxAgeDays != null ? maxAgeDays : properties.getCache().getCleanupMaxAgeDays();
        return ResponseEntity.ok(cache.cleanup(days));
    }

    // ── Export ────────────────────────────────────────────────────────────────

    /**
     * Run a search and write the results to the export directory.
     *
     * CSV presets: agricultural-summary, supply-chain (named after the filename
     * parameter, else the first filter value). GeoJSON presets: landapp (default), all.
     *
     * POST /export/domestic?format=geojson&postcode=SW1A+1AA
     * POST /export/non-domestic?preset=agricultural-summary&local-authority=E07000044
     */
    @PostMapping("/export/{propertyType}")
    public ResponseEntity<?> export(
            @PathVariable String propertyType,
            @RequestParam(defaultValue = "csv") String format,
            @RequestParam(required = false) String filename,
            @RequestParam(required = false) String preset,
            @RequestParam(defaultValue = "false") boolean refresh,
            @RequestParam Map<String, String> allParams) {
        try {
            PropertyType type = PropertyType.fromValue(propertyType);
            Map<String, String> filters = filtersFrom(allParams);
            SearchResult result = searchService.search(type, filters, !refresh);

            boolean named = filename != null && !filename.isBlank();
            String name = named
                    ? filename
                    : "epc_" + type.value() + "_" + LocalDateTime.now().format(FILE_STAMP);
            String label = named ? filename : filters.values().stream().findFirst().orElse(null);
            String presetName = preset == null ? "" : preset.toLowerCase();

            Optional<Path> written = switch (format.toLowerCase()) {
                case "csv" -> switch (presetName) {
                    case "", "all" -> csvExporter.export(result.getRecords(), name);
                    case "agricultural-summary" -> csvExporter.exportAgriculturalSummary(result.getRecords(), label);
                    case "supply-chain" -> csvExporter.exportSupplyChainReport(result.getRecords(), label);
                    default -> throw new IllegalArgumentException(
                            "csv preset must be all, agricultural-summary or supply-chain");
                };
                case "geojson" -> switch (presetName) {
                    case "", "landapp" -> geoJsonExporter.exportForLandApp(result.getRecords(), name);
                    case "all" -> geoJsonExporter.export(result.getRecords(), name);
                    default -> throw new IllegalArgumentException("geojson preset must be landapp or all");
                };
                default -> throw new IllegalArgumentException("format must be csv or geojson");
            };

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("recordCount", result.getRecordCount());
            body.put("complete", result.isComplete());
            body.put("path", written.map(Path::toString).orElse(null));
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Export failed for {} {}: {}", propertyType, allParams, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "property-intel-epc-retriever",
                "version", "1.0.0",
                "dataSource", properties.getApi().getBaseUrl(),
                "apiReachable", searchService.testConnection()
        ));
    }

    private Map<String, String> filtersFrom(Map<String, String> allParams) {
        Map<String, String> filters = new LinkedHashMap<>(allParams);
        filters.keySet().removeAll(CONTROL_PARAMS);
        return filters;
    }
}
