package com.propertyintel.epc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.epc.config.EpcProperties;
import com.propertyintel.epc.model.Page;
import com.propertyintel.epc.model.TerminationReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SearchAfterPaginatorTest {

    private static final String ENDPOINT = "domestic/search";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EpcApiClient apiClient;
    private EpcProperties properties;
    private SearchAfterPaginator paginator;

    @BeforeEach
    void setUp() {
        apiClient = mock(EpcApiClient.class);
        properties = new EpcProperties();
        properties.getApi().setPageDelay(Duration.ZERO);
        properties.getApi().setPageSize(2);
        paginator = new SearchAfterPaginator(apiClient, properties);
    }

    private Optional<JsonNode> page(String json) throws Exception {
        return Optional.of(objectMapper.readTree(json));
    }

    @Test
    void followsCursorUntilItIsAbsent() throws Exception {
        when(apiClient.fetch(eq(ENDPOINT), anyMap())).thenReturn(
                page("{\"data\": [{\"lmk-key\": \"K1\"}, {\"lmk-key\": \"K2\"}], \"next-search-after\": \"c1\"}"),
                page("{\"data\": [{\"lmk-key\": \"K3\"}, {\"lmk-key\": \"K4\"}], \"next-search-after\": \"c2\"}"),
                page("{\"column-names\": [\"lmk-key\"], \"rows\": [[\"K5\"]]}"));

        PaginationSession session = paginator.paginate(ENDPOINT, Map.of("postcode", "SW1A1AA"));
        List<Page> pages = session.stream().collect(Collectors.toList());

        assertEquals(3, pages.size());
        assertEquals(List.of(1, 2, 3), pages.stream().map(Page::pageNumber).collect(Collectors.toList()));
        assertEquals(List.of(2, 2, 1), pages.stream().map(Page::pageSize).collect(Collectors.toList()));
        assertEquals(List.of(2L, 4L, 5L), pages.stream().map(Page::totalRetrieved).collect(Collectors.toList()));
        assertEquals("K5", pages.get(2).records().get(0).get("lmk-key"));
        assertEquals(Optional.of(TerminationReason.EXHAUSTED), session.getTerminationReason());
        verify(apiClient, times(3)).fetch(eq(ENDPOINT), anyMap());
    }

    @Test
    @SuppressWarnings("unchecked")
    void sendsBaseParamsPageSizeAndCursor() throws Exception {
        when(apiClient.fetch(eq(ENDPOINT), anyMap())).thenReturn(
                page("{\"data\": [{\"lmk-key\": \"K1\"}], \"next-search-after\": \"cursor-1\"}"),
                page("{\"data\": [{\"lmk-key\": \"K2\"}]}"));

        paginator.paginate(ENDPOINT, Map.of("postcode", "SW1A1AA"), "after").stream().count();

        ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
        verify(apiClient, times(2)).fetch(eq(ENDPOINT), params.capture());

        Map<String, String> first = params.getAllValues().get(0);
        Map<String, String> second = params.getAllValues().get(1);
        assertEquals(Map.of("postcode", "SW1A1AA", "size", "2"), first);
        assertEquals(Map.of("postcode", "SW1A1AA", "size", "2", "after", "cursor-1"), second);
    }

    @Test
    void emptyFirstPageYieldsNothing() throws Exception {
        when(apiClient.fetch(eq(ENDPOINT), anyMap()))
                .thenReturn(page("{\"data\": [], \"next-search-after\": \"c1\"}"));

        PaginationSession session = paginator.paginate(ENDPOINT, Map.of());

        assertFalse(session.hasNext());
        assertEquals(Optional.of(TerminationReason.EXHAUSTED), session.getTerminationReason());
        assertThrows(NoSuchElementException.class, session::next);
        verify(apiClient, times(1)).fetch(eq(ENDPOINT), anyMap());
    }

    @Test
    void lastPageWithDataIsYieldedWhenCursorMissing() throws Exception {
        when(apiClient.fetch(eq(ENDPOINT), anyMap()))
                .thenReturn(page("{\"data\": [{\"lmk-key\": \"K1\"}]}"));

        PaginationSession session = paginator.paginate(ENDPOINT, Map.of());

        assertTrue(session.hasNext());
        assertEquals(1, session.next().pageSize());
        assertFalse(session.hasNext());
        verify(apiClient, times(1)).fetch(eq(ENDPOINT), anyMap());
    }

    @Test
    void upstreamFailureEndsSessionKeepingEarlierPages() throws Exception {
        when(apiClient.fetch(eq(ENDPOINT), anyMap())).thenReturn(
                page("{\"data\": [{\"lmk-key\": \"K1\"}], \"next-search-after\": \"c1\"}"),
                Optional.empty());

        PaginationSession session = paginator.paginate(ENDPOINT, Map.of());
        List<Page> pages = session.stream().collect(Collectors.toList());

        assertEquals(1, pages.size());
        assertEquals(Optional.of(TerminationReason.UPSTREAM_ERROR), session.getTerminationReason());
    }

    @Test
    void failureOnFirstPageIsDistinctFromNoResults() {
        when(apiClient.fetch(eq(ENDPOINT), anyMap())).thenReturn(Optional.empty());

        PaginationSession session = paginator.paginate(ENDPOINT, Map.of());

        assertFalse(session.hasNext());
        assertEquals(Optional.of(TerminationReason.UPSTREAM_ERROR), session.getTerminationReason());
    }

    @Test
    void sessionIsLazyAndCancellable() throws Exception {
        when(apiClient.fetch(eq(ENDPOINT), anyMap()))
                .thenReturn(page("{\"data\": [{\"lmk-key\": \"K1\"}], \"next-search-after\": \"c1\"}"));

        PaginationSession session = paginator.paginate(ENDPOINT, Map.of());
        verifyNoInteractions(apiClient);
        assertTrue(session.getTerminationReason().isEmpty());

        session.next();
        session.cancel();

        assertFalse(session.hasNext());
        assertEquals(Optional.of(TerminationReason.CANCELLED), session.getTerminationReason());
        verify(apiClient, times(1)).fetch(eq(ENDPOINT), anyMap());
    }

    @Test
    void waitsBetweenPagesButNotAfterTheLast() throws Exception {
        properties.getApi().setPageDelay(Duration.ofMillis(100));
        when(apiClient.fetch(eq(ENDPOINT), anyMap())).thenReturn(
                page("{\"data\": [{\"lmk-key\": \"K1\"}], \"next-search-after\": \"c1\"}"),
                page("{\"data\": [{\"lmk-key\": \"K2\"}]}"));

        long start = System.nanoTime();
        long count = paginator.paginate(ENDPOINT, Map.of()).stream().count();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals(2, count);
        assertTrue(elapsedMs >= 100, "took " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1000, "took " + elapsedMs + "ms");
    }
}
