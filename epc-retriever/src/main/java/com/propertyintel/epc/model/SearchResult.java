package com.propertyintel.epc.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one search. A terminationReason of UPSTREAM_ERROR
 * means the record list is partial, even when it is empty.
 */
@Data
@Builder
public class SearchResult {

    private PropertyType propertyType;
    private Map<String, String> filters;
    private List<CertificateRecord> records;
    private int pages;
    private TerminationReason terminationReason;
    private boolean fromCache;

    public int getRecordCount() {
        return records == null ? 0 : records.size();
    }

    public boolean isComplete() {
        return terminationReason == TerminationReason.EXHAUSTED;
    }
}
