package com.propertyintel.epc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.epc.cache.CertificateCache;
import com.propertyintel.epc.config.EpcProperties;
import com.propertyintel.epc.model.CertificateRecord;
import com.propertyintel.epc.model.Page;
import com.propertyintel.epc.model.PropertyType;
import com.propertyintel.epc.model.SearchResult;
import com.propertyintel.epc.model.TerminationReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs certificate searches against the cache and the EPC API.
 *
 * A search is answered from the cache only when every filter is one the
 * cache can match on and the same search previously ran to completion within
 * the freshness window. Otherwise all pages are fetched, stored, and, if the
 * session was not cut short, the search itself is recorded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EpcSearchService {

    private final SearchAfterPaginator paginator;
    private final EpcApiClient apiClient;
    private final CertificateCache cache;
    private final EpcProperties properties;

    public SearchResult search(PropertyType propertyType, Map<String, String> filters) {
        return search(propertyType, filters, true);
    }

    public SearchResult search(PropertyType propertyType, Map<String, String> filters, boolean useCache) {
        Map<String, String> params = new LinkedHashMap<>(filters);
        log.info("Starting search: {} with params: {}", propertyType.searchEndpoint(), params);

        if (useCache) {
            Optional<SearchResult> cached = fromCache(propertyType, params);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        PaginationSession session = paginator.paginate(propertyType.searchEndpoint(), params);
        List<CertificateRecord> records = new ArrayList<>();
        int pages = 0;
        while (session.hasNext()) {
            Page page = session.next();
            records.addAll(page.records());
            pages = page.pageNumber();
        }

        TerminationReason reason = session.getTerminationReason().orElse(TerminationReason.EXHAUSTED);

        if (!records.isEmpty()) {
            cache.store(records, propertyType);
        }

        if (reason == TerminationReason.EXHAUSTED) {
            cache.recordSearch(propertyType, params, records.size());
            if (records.isEmpty()) {
                log.info("No records found matching search criteria");
            } else {
                log.info("Search complete: {} records retrieved", records.size());
            }
        } else {
            log.warn("Search {} ended early ({}) after {} pages, {} records are partial",
                    params, reason, pages, records.size());
        }

        return SearchResult.builder()
                .propertyType(propertyType)
                .filters(params)
                .records(records)
                .pages(pages)
                .terminationReason(reason)
                .fromCache(false)
                .build();
    }

    public SearchResult searchByPostcode(String postcode, PropertyType propertyType) {
        return search(propertyType, Map.of("postcode", postcode));
    }

    public SearchResult searchByLocalAuthority(String localAuthority, PropertyType propertyType,
                                               Map<String, String> additionalFilters) {
        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("local-authority", localAuthority);
        if (additionalFilters != null) {
            filters.putAll(additionalFilters);
        }
        return search(propertyType, filters);
    }

    public SearchResult searchByUprn(String uprn, PropertyType propertyType) {
        return search(propertyType, Map.of("uprn", uprn));
    }

    /**
     * Non-domestic detached buildings of type "Other", the closest the
     * register gets to agricultural buildings.
     */
    public SearchResult searchAgriculturalBuildings(String localAuthority, String postcode) {
        Map<String, String> filters = new LinkedHashMap<>();
        if (localAuthority != null && !localAuthority.isBlank()) {
            filters.put("local-authority", localAuthority);
        }
        if (postcode != null && !postcode.isBlank()) {
            filters.put("postcode", postcode);
        }
        filters.put("property-type", "Other");
        filters.put("built-form", "Detached");
        return search(PropertyType.NON_DOMESTIC, filters);
    }

    /**
     * Cache first, then the certificate endpoint. A certificate fetched from
     * the API is cached before it is returned.
     */
    public Optional<CertificateRecord> getCertificate(PropertyType propertyType, String certificateId) {
        Optional<CertificateRecord> cached = cache.getById(certificateId, propertyType, properties.getCache().getMaxAgeHours());
        if (cached.isPresent()) {
            log.debug("Certificate {} served from cache", certificateId);
            return cached;
        }

        Optional<JsonNode> response = apiClient.fetch(propertyType.certificateEndpoint(certificateId), Map.of());
        if (response.isEmpty()) {
            log.error("Failed to get certificate {}", certificateId);
            return Optional.empty();
        }

        List<CertificateRecord> records = ResponseNormalizer.normalize(response.get());
        if (records.isEmpty()) {
            log.warn("Certificate {} not found", certificateId);
            return Optional.empty();
        }

        CertificateRecord record = records.get(0);
        cache.store(List.of(record), propertyType);
        return Optional.of(record);
    }

    public boolean testConnection() {
        return apiClient.testConnection();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<SearchResult> fromCache(PropertyType propertyType, Map<String, String> params) {
        if (params.isEmpty() || !CertificateCache.FILTER_FIELDS.containsAll(params.keySet())) {
            return Optional.empty();
        }

        int maxAgeHours = properties.getCache().getMaxAgeHours();
        Optional<Integer> recordedCount = cache.findSearch(propertyType, params, maxAgeHours);
        if (recordedCount.isEmpty()) {
            return Optional.empty();
        }

        List<CertificateRecord> records = cache.get(params, propertyType, maxAgeHours);
        if (records.size() < recordedCount.get()) {
            log.info("Cached search {} has {} of {} records left, refetching",
                    params, records.size(), recordedCount.get());
            return Optional.empty();
        }

        log.info("Search {} served from cache: {} records", params, records.size());
        return Optional.of(SearchResult.builder()
                .propertyType(propertyType)
                .filters(params)
                .records(records)
                .pages(0)
                .terminationReason(TerminationReason.EXHAUSTED)
                .fromCache(true)
                .build());
    }
}
