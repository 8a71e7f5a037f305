package com.propertyintel.epc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.epc.model.CertificateRecord;
import com.propertyintel.epc.model.Page;
import com.propertyintel.epc.model.TerminationReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A single, lazy pass over a paginated search. Pages are fetched on demand
 * from {@link #hasNext()}; the session cannot be restarted.
 *
 * Each cycle stops on, in order:
 *  1. a failed fetch (UPSTREAM_ERROR, pages already yielded stand),
 *  2. an empty page (EXHAUSTED),
 *  3. a response without next-search-after (EXHAUSTED after yielding it).
 *
 * Once finished, {@link #getTerminationReason()} tells the caller whether the
 * results are complete.
 */
@Slf4j
public class PaginationSession implements Iterator<Page> {

    private final EpcApiClient apiClient;
    private final String endpoint;
    private final Map<String, String> baseParams;
    private final String searchAfterKey;
    private final int pageSize;
    private final Duration pageDelay;

    private String cursor;
    private int pageCount;
    private long totalRecords;
    private Page pending;
    private TerminationReason terminationReason;
    private volatile boolean cancelled;

    PaginationSession(EpcApiClient apiClient, String endpoint, Map<String, String> baseParams,
                      String searchAfterKey, int pageSize, Duration pageDelay) {
        this.apiClient = apiClient;
        this.endpoint = endpoint;
        this.baseParams = Collections.unmodifiableMap(new LinkedHashMap<>(baseParams));
        this.searchAfterKey = searchAfterKey;
        this.pageSize = pageSize;
        this.pageDelay = pageDelay;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (terminationReason != null) return false;
        pending = fetchNextPage();
        return pending != null;
    }

    @Override
    public Page next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Pagination finished: " + terminationReason);
        }
        Page page = pending;
        pending = null;
        return page;
    }

    /**
     * Stops the session before its next request. A request already in flight
     * runs to completion.
     */
    public void cancel() {
        cancelled = true;
    }

    /** Empty while the session is still running. */
    public Optional<TerminationReason> getTerminationReason() {
        return Optional.ofNullable(terminationReason);
    }

    public int getPageCount() {
        return pageCount;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public Stream<Page> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Page fetchNextPage() {
        if (cancelled) {
            return finish(TerminationReason.CANCELLED);
        }
        if (pageCount > 0) {
            sleep(pageDelay);
            if (cancelled) {
                return finish(TerminationReason.CANCELLED);
            }
        }

        Optional<JsonNode> response = apiClient.fetch(endpoint, pageParams());
        if (response.isEmpty()) {
            log.warn("No response received for page {}", pageCount + 1);
            return finish(TerminationReason.UPSTREAM_ERROR);
        }

        List<CertificateRecord> records = ResponseNormalizer.normalize(response.get());
        if (records.isEmpty()) {
            log.info("No more data available after {} pages", pageCount);
            return finish(TerminationReason.EXHAUSTED);
        }

        pageCount++;
        totalRecords += records.size();
        log.info("Page {}: Retrieved {} records (total: {})", pageCount, records.size(), totalRecords);

        Page page = new Page(records, pageCount, records.size(), totalRecords);

        Optional<String> next = ResponseNormalizer.nextCursor(response.get());
        if (next.isEmpty()) {
            log.info("Pagination complete: {} total records", totalRecords);
            terminationReason = TerminationReason.EXHAUSTED;
        } else {
            cursor = next.get();
        }
        return page;
    }

    private Map<String, String> pageParams() {
        Map<String, String> params = new LinkedHashMap<>(baseParams);
        if (cursor != null) {
            params.put(searchAfterKey, cursor);
        }
        params.put("size", String.valueOf(pageSize));
        return params;
    }

    private Page finish(TerminationReason reason) {
        terminationReason = reason;
        return null;
    }

    private void sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancelled = true;
        }
    }
}
