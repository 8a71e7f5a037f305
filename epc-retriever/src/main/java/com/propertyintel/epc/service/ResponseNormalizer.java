package com.propertyintel.epc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.epc.model.CertificateRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts the two search response shapes into a flat list of records.
 *
 *  - {"data": [{...}, ...]}
 *  - {"column-names": ["a", "b"], "rows": [[1, 2], ...]}
 *
 * Anything else is treated as an empty page.
 */
@Slf4j
public final class ResponseNormalizer {

    public static final String DATA = "data";
    public static final String COLUMN_NAMES = "column-names";
    public static final String ROWS = "rows";
    public static final String NEXT_SEARCH_AFTER = "next-search-after";

    private ResponseNormalizer() {
    }

    public static List<CertificateRecord> normalize(JsonNode response) {
        if (response == null || !response.isObject()) {
            return Collections.emptyList();
        }
        if (response.has(DATA)) {
            return fromDataArray(response.get(DATA));
        }
        if (response.has(ROWS) && response.has(COLUMN_NAMES)) {
            return fromColumnsAndRows(response.get(COLUMN_NAMES), response.get(ROWS));
        }
        return Collections.emptyList();
    }

    /**
     * The continuation token, or empty when this was the last page.
     */
    public static Optional<String> nextCursor(JsonNode response) {
        if (response == null) return Optional.empty();
        JsonNode token = response.get(NEXT_SEARCH_AFTER);
        if (token == null || token.isNull() || token.isMissingNode()) return Optional.empty();
        String text = token.isValueNode() ? token.asText() : token.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private static List<CertificateRecord> fromDataArray(JsonNode data) {
        if (data == null || !data.isArray()) {
            return Collections.emptyList();
        }
        List<CertificateRecord> records = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            if (item.isObject()) {
                records.add(CertificateRecord.fromJson(item));
            } else {
                log.debug("Skipping non-object entry in data array: {}", item);
            }
        }
        return records;
    }

    private static List<CertificateRecord> fromColumnsAndRows(JsonNode columns, JsonNode rows) {
        if (!columns.isArray() || !rows.isArray()) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>(columns.size());
        columns.forEach(c -> names.add(c.asText()));

        List<CertificateRecord> records = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (!row.isArray()) continue;
            int width = Math.min(names.size(), row.size());
            Map<String, Object> fields = new LinkedHashMap<>();
            for (int i = 0; i < width; i++) {
                fields.put(names.get(i), row.get(i));
            }
            records.add(CertificateRecord.of(fields));
        }
        return records;
    }
}
