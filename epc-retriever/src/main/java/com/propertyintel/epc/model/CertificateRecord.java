package com.propertyintel.epc.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One EPC certificate as returned by the API: an ordered field map whose
 * values are limited to String, Long, Double, Boolean or null.
 *
 * Integral numbers are always held as Long and other numbers as Double, so a
 * record read back from the cache equals the record that was stored.
 */
public final class CertificateRecord {

    public static final String LMK_KEY = "lmk-key";
    public static final String BUILDING_REFERENCE_NUMBER = "building-reference-number";

    private final Map<String, Object> fields;

    private CertificateRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * @throws IllegalArgumentException if a value is not a scalar
     */
    public static CertificateRecord of(Map<String, ?> source) {
        Map<String, Object> fields = new LinkedHashMap<>();
        source.forEach((key, value) -> fields.put(key, normaliseValue(key, value)));
        return new CertificateRecord(fields);
    }

    /**
     * Builds a record from a JSON object. Nested arrays and objects are kept
     * as their compact JSON text.
     */
    public static CertificateRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Certificate must be a JSON object");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), fromJsonValue(entry.getValue()));
        }
        return new CertificateRecord(fields);
    }

    static Object fromJsonValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        if (value.isTextual()) return value.textValue();
        if (value.isBoolean()) return value.booleanValue();
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : (Object) value.doubleValue();
        }
        if (value.isNumber()) return value.doubleValue();
        return value.toString();
    }

    private static Object normaliseValue(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof JsonNode node) {
            return fromJsonValue(node);
        }
        throw new IllegalArgumentException("Unsupported value type for field '" + key + "': "
                + value.getClass().getName());
    }

    /**
     * lmk-key when present and non-blank, otherwise building-reference-number.
     */
    public Optional<String> certificateId() {
        return identityField(LMK_KEY).or(() -> identityField(BUILDING_REFERENCE_NUMBER));
    }

    private Optional<String> identityField(String name) {
        Object value = fields.get(name);
        if (value == null) return Optional.empty();
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /** The value rendered as text, or null when missing or null. */
    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    @JsonValue
    public Map<String, Object> getFields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CertificateRecord that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "CertificateRecord" + fields;
    }
}
