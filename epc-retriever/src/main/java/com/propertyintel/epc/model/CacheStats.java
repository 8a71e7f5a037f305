package com.propertyintel.epc.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Snapshot of the certificate cache. recentCertificates always uses a
 * fixed 24 hour window, regardless of the configured freshness window.
 */
@Data
@Builder
public class CacheStats {

    private long totalCertificates;
    private Map<String, Long> byPropertyType;
    private long recentCertificates;
    private long cachedSearches;
    private String databasePath;
}
