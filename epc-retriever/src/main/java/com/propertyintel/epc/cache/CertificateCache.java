package com.propertyintel.epc.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.epc.config.EpcProperties;
import com.propertyintel.epc.model.CacheStats;
import com.propertyintel.epc.model.CertificateRecord;
import com.propertyintel.epc.model.CleanupResult;
import com.propertyintel.epc.model.PropertyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * SQLite-backed cache of EPC certificates, keyed by lmk-key (or
 * building-reference-number for non-domestic records).
 *
 * Two timestamps per entry, deliberately used for different things:
 *  - cached_at     set on every store; bounds what reads consider fresh
 *  - last_accessed set on store and on every getById hit; drives cleanup
 *
 * Timestamps are epoch milliseconds taken from the injected Clock.
 * Storage errors propagate as DataAccessException.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CertificateCache {

    /** Record fields that {@link #get} can filter on. Others are ignored. */
    public static final List<String> FILTER_FIELDS = List.of("postcode", "local-authority", "uprn");

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final EpcProperties properties;

    public void ensureSchema() {
        log.info("Ensuring cache schema exists at {}", properties.getCache().getDatabasePath());

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS epc_certificates
            (
                certificate_id  TEXT PRIMARY KEY,
                property_type   TEXT NOT NULL,
                data            TEXT NOT NULL,
                cached_at       INTEGER NOT NULL,
                last_accessed   INTEGER NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_cache
            (
                search_hash     TEXT PRIMARY KEY,
                property_type   TEXT NOT NULL,
                search_params   TEXT NOT NULL,
                result_count    INTEGER NOT NULL,
                cached_at       INTEGER NOT NULL,
                last_accessed   INTEGER NOT NULL
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_cached_at ON epc_certificates(cached_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_property_type ON epc_certificates(property_type)");

        log.info("Cache schema ready.");
    }

    /**
     * Upserts each record, replacing any earlier entry with the same id.
     * Records without an id, or that fail to serialise, are skipped.
     *
     * @return number of records written
     */
    public int store(List<CertificateRecord> records, PropertyType propertyType) {
        if (records.isEmpty()) {
            log.warn("No data to store");
            return 0;
        }

        Integer stored = transactionTemplate.execute(status -> {
            long now = clock.millis();
            int written = 0;
            int missingId = 0;

            for (CertificateRecord record : records) {
                Optional<String> certificateId = record.certificateId();
                if (certificateId.isEmpty()) {
                    missingId++;
                    continue;
                }

                String json;
                try {
                    json = objectMapper.writeValueAsString(record.getFields());
                } catch (JsonProcessingException e) {
                    log.error("Error storing certificate {}: {}", certificateId.get(), e.getOriginalMessage());
                    continue;
                }

                jdbcTemplate.update("""
                    INSERT OR REPLACE INTO epc_certificates
                    (certificate_id, property_type, data, cached_at, last_accessed)
                    VALUES (?, ?, ?, ?, ?)
                    """, certificateId.get(), propertyType.value(), json, now, now);
                written++;
            }

            if (missingId > 0) {
                log.debug("Skipped {} records with no lmk-key or building-reference-number", missingId);
            }
            return written;
        });

        int count = stored == null ? 0 : stored;
        log.info("Stored {} certificates in cache", count);
        return count;
    }

    public List<CertificateRecord> get(Map<String, String> filters, PropertyType propertyType) {
        return get(filters, propertyType, properties.getCache().getMaxAgeHours());
    }

    /**
     * Fresh entries of the given type whose postcode, local-authority and
     * uprn match the supplied filters exactly. Filter keys outside
     * {@link #FILTER_FIELDS} are ignored.
     */
    public List<CertificateRecord> get(Map<String, String> filters, PropertyType propertyType, int maxAgeHours) {
        StringBuilder sql = new StringBuilder("""
            SELECT data FROM epc_certificates
            WHERE property_type = ? AND cached_at > ?
            """);
        List<Object> args = new ArrayList<>();
        args.add(propertyType.value());
        args.add(freshnessCutoff(maxAgeHours));

        for (String field : FILTER_FIELDS) {
            String value = filters.get(field);
            if (value != null) {
                sql.append(" AND CAST(json_extract(data, ?) AS TEXT) = ?");
                args.add(jsonPath(field));
                args.add(value);
            }
        }

        List<String> rows = jdbcTemplate.queryForList(sql.toString(), String.class, args.toArray());
        List<CertificateRecord> records = new ArrayList<>(rows.size());
        for (String row : rows) {
            decode(row).ifPresent(records::add);
        }

        if (!records.isEmpty()) {
            log.info("Retrieved {} certificates from cache", records.size());
        }
        return records;
    }

    public Optional<CertificateRecord> getById(String certificateId) {
        return getById(certificateId, properties.getCache().getMaxAgeHours());
    }

    /**
     * Point lookup within the freshness window. A hit refreshes
     * last_accessed. A stale entry is reported as absent.
     */
    public Optional<CertificateRecord> getById(String certificateId, int maxAgeHours) {
        List<String> rows = jdbcTemplate.queryForList("""
            SELECT data FROM epc_certificates
            WHERE certificate_id = ? AND cached_at > ?
            """, String.class, certificateId, freshnessCutoff(maxAgeHours));

        return touchFirst(certificateId, rows);
    }

    /**
     * As {@link #getById(String, int)}, but only a certificate cached under
     * the given register counts as a hit.
     */
    public Optional<CertificateRecord> getById(String certificateId, PropertyType propertyType, int maxAgeHours) {
        List<String> rows = jdbcTemplate.queryForList("""
            SELECT data FROM epc_certificates
            WHERE certificate_id = ? AND property_type = ? AND cached_at > ?
            """, String.class, certificateId, propertyType.value(), freshnessCutoff(maxAgeHours));

        return touchFirst(certificateId, rows);
    }

    private Optional<CertificateRecord> touchFirst(String certificateId, List<String> rows) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        jdbcTemplate.update("UPDATE epc_certificates SET last_accessed = ? WHERE certificate_id = ?",
                clock.millis(), certificateId);

        return decode(rows.get(0));
    }

    /**
     * Deletes certificates and searches not accessed within maxAgeDays.
     * Independent of cached_at.
     */
    public CleanupResult cleanup(int maxAgeDays) {
        long cutoff = clock.millis() - Duration.ofDays(maxAgeDays).toMillis();

        int certificates = jdbcTemplate.update("DELETE FROM epc_certificates WHERE last_accessed < ?", cutoff);
        int searches = jdbcTemplate.update("DELETE FROM search_cache WHERE last_accessed < ?", cutoff);

        log.info("Cleaned up {} certificates and {} searches", certificates, searches);
        return new CleanupResult(certificates, searches);
    }

    public CacheStats stats() {
        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM epc_certificates", Long.class);

        Map<String, Long> byType = new LinkedHashMap<>();
        jdbcTemplate.query("""
            SELECT property_type, COUNT(*) AS n
            FROM epc_certificates
            GROUP BY property_type
            ORDER BY property_type
            """, rs -> {
            byType.put(rs.getString("property_type"), rs.getLong("n"));
        });

        Long recent = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM epc_certificates WHERE cached_at > ?",
                Long.class, clock.millis() - RECENT_WINDOW.toMillis());

        Long searches = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM search_cache", Long.class);

        return CacheStats.builder()
                .totalCertificates(total == null ? 0 : total)
                .byPropertyType(byType)
                .recentCertificates(recent == null ? 0 : recent)
                .cachedSearches(searches == null ? 0 : searches)
                .databasePath(properties.getCache().getDatabasePath())
                .build();
    }

    // ── Search-level cache ────────────────────────────────────────────────────

    /**
     * Remembers that a search completed with the given number of results, so
     * a repeat within the freshness window can be answered from the cache.
     */
    public void recordSearch(PropertyType propertyType, Map<String, String> params, int resultCount) {
        long now = clock.millis();
        String canonical = canonicalParams(params);

        jdbcTemplate.update("""
            INSERT OR REPLACE INTO search_cache
            (search_hash, property_type, search_params, result_count, cached_at, last_accessed)
            VALUES (?, ?, ?, ?, ?, ?)
            """, searchHash(propertyType, canonical), propertyType.value(), canonical, resultCount, now, now);
    }

    /**
     * @return the recorded result count of a fresh matching search
     */
    public Optional<Integer> findSearch(PropertyType propertyType, Map<String, String> params, int maxAgeHours) {
        String hash = searchHash(propertyType, canonicalParams(params));

        List<Integer> counts = jdbcTemplate.queryForList("""
            SELECT result_count FROM search_cache
            WHERE search_hash = ? AND cached_at > ?
            """, Integer.class, hash, freshnessCutoff(maxAgeHours));

        if (counts.isEmpty()) {
            return Optional.empty();
        }
        jdbcTemplate.update("UPDATE search_cache SET last_accessed = ? WHERE search_hash = ?",
                clock.millis(), hash);
        return Optional.of(counts.get(0));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private long freshnessCutoff(int maxAgeHours) {
        return clock.millis() - Duration.ofHours(maxAgeHours).toMillis();
    }

    private Optional<CertificateRecord> decode(String json) {
        try {
            return Optional.of(CertificateRecord.fromJson(objectMapper.readTree(json)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping undecodable cached certificate: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String canonicalParams(Map<String, String> params) {
        try {
            return objectMapper.writeValueAsString(new TreeMap<>(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Search parameters are not serialisable", e);
        }
    }

    private static String searchHash(PropertyType propertyType, String canonicalParams) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((propertyType.value() + "|" + canonicalParams)
                    .getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String jsonPath(String field) {
        return "$.\"" + field + "\"";
    }
}
