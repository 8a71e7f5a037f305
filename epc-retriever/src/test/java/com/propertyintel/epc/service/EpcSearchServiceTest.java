package com.propertyintel.epc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.epc.cache.CertificateCache;
import com.propertyintel.epc.config.EpcProperties;
import com.propertyintel.epc.model.CertificateRecord;
import com.propertyintel.epc.model.PropertyType;
import com.propertyintel.epc.model.SearchResult;
import com.propertyintel.epc.model.TerminationReason;
import com.propertyintel.epc.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EpcSearchServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private EpcApiClient apiClient;
    private CertificateCache cache;
    private EpcSearchService service;

    @BeforeEach
    void setUp() {
        EpcProperties properties = new EpcProperties();
        properties.getApi().setPageDelay(Duration.ZERO);
        properties.getCache().setDatabasePath(tempDir.resolve("cache.db").toString());

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + properties.getCache().getDatabasePath());

        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        cache = new CertificateCache(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
                objectMapper, clock, properties);
        cache.ensureSchema();

        apiClient = mock(EpcApiClient.class);
        service = new EpcSearchService(new SearchAfterPaginator(apiClient, properties), apiClient, cache, properties);
    }

    private Optional<JsonNode> json(String s) throws Exception {
        return Optional.of(objectMapper.readTree(s));
    }

    @Test
    void searchAggregatesPagesAndCachesThem() throws Exception {
        when(apiClient.fetch(eq("domestic/search"), anyMap())).thenReturn(
                json("{\"data\": [{\"lmk-key\": \"K1\", \"postcode\": \"SW1A1AA\"}], \"next-search-after\": \"c\"}"),
                json("{\"data\": [{\"lmk-key\": \"K2\", \"postcode\": \"SW1A1AA\"}]}"));

        SearchResult result = service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);

        assertEquals(2, result.getRecordCount());
        assertEquals(2, result.getPages());
        assertEquals(TerminationReason.EXHAUSTED, result.getTerminationReason());
        assertTrue(result.isComplete());
        assertFalse(result.isFromCache());
        assertTrue(cache.getById("K2", 1).isPresent());
    }

    @Test
    void repeatSearchIsServedFromCache() throws Exception {
        when(apiClient.fetch(eq("domestic/search"), anyMap())).thenReturn(
                json("{\"data\": [{\"lmk-key\": \"K1\", \"postcode\": \"SW1A1AA\"}]}"));

        service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);
        SearchResult second = service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);

        assertTrue(second.isFromCache());
        assertEquals(1, second.getRecordCount());
        verify(apiClient, times(1)).fetch(anyString(), anyMap());
    }

    @Test
    void staleCachedSearchGoesBackToTheApi() throws Exception {
        when(apiClient.fetch(eq("domestic/search"), anyMap())).thenReturn(
                json("{\"data\": [{\"lmk-key\": \"K1\", \"postcode\": \"SW1A1AA\"}]}"));

        service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);
        clock.advance(Duration.ofHours(25));
        SearchResult second = service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);

        assertFalse(second.isFromCache());
        verify(apiClient, times(2)).fetch(anyString(), anyMap());
    }

    @Test
    void refreshBypassesTheCache() throws Exception {
        when(apiClient.fetch(eq("domestic/search"), anyMap())).thenReturn(
                json("{\"data\": [{\"lmk-key\": \"K1\", \"postcode\": \"SW1A1AA\"}]}"));

        service.search(PropertyType.DOMESTIC, Map.of("postcode", "SW1A1AA"), true);
        SearchResult refreshed = service.search(PropertyType.DOMESTIC, Map.of("postcode", "SW1A1AA"), false);

        assertFalse(refreshed.isFromCache());
        verify(apiClient, times(2)).fetch(anyString(), anyMap());
    }

    @Test
    void partialSearchIsReportedAndNotRecorded() throws Exception {
        when(apiClient.fetch(eq("domestic/search"), anyMap())).thenReturn(
                json("{\"data\": [{\"lmk-key\": \"K1\", \"postcode\": \"SW1A1AA\"}], \"next-search-after\": \"c\"}"),
                Optional.empty(),
                json("{\"data\": [{\"lmk-key\": \"K1\", \"postcode\": \"SW1A1AA\"}]}"));

        SearchResult partial = service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);

        assertEquals(TerminationReason.UPSTREAM_ERROR, partial.getTerminationReason());
        assertFalse(partial.isComplete());
        assertEquals(1, partial.getRecordCount());
        assertEquals(0L, cache.stats().getCachedSearches());

        SearchResult retry = service.searchByPostcode("SW1A1AA", PropertyType.DOMESTIC);
        assertFalse(retry.isFromCache());
        assertTrue(retry.isComplete());
    }

    @Test
    void unreachableApiIsDistinguishableFromNoResults() throws Exception {
        when(apiClient.fetch(eq("domestic/search"), anyMap())).thenReturn(Optional.empty());
        SearchResult failed = service.searchByPostcode("ZZ1 1ZZ", PropertyType.DOMESTIC);

        when(apiClient.fetch(eq("non-domestic/search"), anyMap())).thenReturn(json("{\"data\": []}"));
        SearchResult empty = service.searchByPostcode("ZZ1 1ZZ", PropertyType.NON_DOMESTIC);

        assertEquals(0, failed.getRecordCount());
        assertEquals(0, empty.getRecordCount());
        assertEquals(TerminationReason.UPSTREAM_ERROR, failed.getTerminationReason());
        assertEquals(TerminationReason.EXHAUSTED, empty.getTerminationReason());
    }

    @Test
    void searchesWithNonCacheableFiltersAlwaysHitTheApi() throws Exception {
        when(apiClient.fetch(eq("non-domestic/search"), anyMap())).thenReturn(
                json("{\"data\": [{\"building-reference-number\": \"B1\", \"postcode\": \"SW1A1AA\"}]}"));

        service.searchAgriculturalBuildings(null, "SW1A1AA");
        SearchResult second = service.searchAgriculturalBuildings(null, "SW1A1AA");

        assertFalse(second.isFromCache());
        assertEquals(Map.of("postcode", "SW1A1AA", "property-type", "Other", "built-form", "Detached"),
                second.getFilters());
        verify(apiClient, times(2)).fetch(anyString(), anyMap());
    }

    @Test
    void certificateIsServedFromCacheWhenFresh() {
        CertificateRecord record = CertificateRecord.of(Map.of("lmk-key", "K9", "postcode", "SW1A1AA"));
        cache.store(List.of(record), PropertyType.DOMESTIC);

        assertEquals(Optional.of(record), service.getCertificate(PropertyType.DOMESTIC, "K9"));
        verifyNoInteractions(apiClient);
    }

    @Test
    void certificateCachedUnderOtherRegisterIsFetched() throws Exception {
        cache.store(List.of(CertificateRecord.of(Map.of("lmk-key", "K9", "postcode", "SW1A1AA"))),
                PropertyType.DOMESTIC);
        when(apiClient.fetch(eq("non-domestic/certificate/K9"), anyMap())).thenReturn(
                json("{\"data\": [{\"lmk-key\": \"K9\", \"postcode\": \"EX1 1AA\"}]}"));

        Optional<CertificateRecord> fetched = service.getCertificate(PropertyType.NON_DOMESTIC, "K9");

        assertEquals("EX1 1AA", fetched.orElseThrow().get("postcode"));
        verify(apiClient).fetch(eq("non-domestic/certificate/K9"), anyMap());
    }

    @Test
    void certificateIsFetchedAndCachedOnMiss() throws Exception {
        when(apiClient.fetch(eq("domestic/certificate/K9"), anyMap())).thenReturn(
                json("{\"column-names\": [\"lmk-key\", \"postcode\"], \"rows\": [[\"K9\", \"SW1A1AA\"]]}"));

        Optional<CertificateRecord> fetched = service.getCertificate(PropertyType.DOMESTIC, "K9");

        assertTrue(fetched.isPresent());
        assertEquals("SW1A1AA", fetched.get().get("postcode"));
        assertEquals(fetched, cache.getById("K9", 1));
    }

    @Test
    void certificateFetchFailureIsEmpty() {
        when(apiClient.fetch(eq("domestic/certificate/K9"), anyMap())).thenReturn(Optional.empty());

        assertTrue(service.getCertificate(PropertyType.DOMESTIC, "K9").isEmpty());
    }
}
