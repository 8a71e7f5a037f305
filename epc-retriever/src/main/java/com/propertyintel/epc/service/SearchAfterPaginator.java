package com.propertyintel.epc.service;

import com.propertyintel.epc.config.EpcProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Walks a search endpoint page by page using the API's search-after cursor.
 *
 * Cursor pagination is used rather than offsets because the register is
 * large and changes between requests; offsets would skip or repeat records.
 */
@Service
@RequiredArgsConstructor
public class SearchAfterPaginator {

    private final EpcApiClient apiClient;
    private final EpcProperties properties;

    public PaginationSession paginate(String endpoint, Map<String, String> params) {
        return paginate(endpoint, params, properties.getApi().getSearchAfterKey());
    }

    /**
     * Starts a new session from page 1. Nothing is fetched until the session
     * is iterated.
     *
     * @param searchAfterKey query parameter name the cursor is sent under
     */
    public PaginationSession paginate(String endpoint, Map<String, String> params, String searchAfterKey) {
        EpcProperties.Api api = properties.getApi();
        return new PaginationSession(apiClient, endpoint, params, searchAfterKey,
                api.getPageSize(), api.getPageDelay());
    }
}
