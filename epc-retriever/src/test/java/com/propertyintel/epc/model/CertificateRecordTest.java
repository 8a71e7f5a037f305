package com.propertyintel.epc.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CertificateRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void certificateIdPrefersLmkKey() {
        CertificateRecord record = CertificateRecord.of(Map.of(
                "lmk-key", "LMK-1",
                "building-reference-number", "BRN-1"));

        assertEquals("LMK-1", record.certificateId().orElseThrow());
    }

    @Test
    void certificateIdFallsBackToBuildingReference() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("lmk-key", "  ");
        fields.put("building-reference-number", 12345);

        assertEquals("12345", CertificateRecord.of(fields).certificateId().orElseThrow());
    }

    @Test
    void certificateIdEmptyWithoutIdentityFields() {
        assertTrue(CertificateRecord.of(Map.of("postcode", "SW1A 1AA")).certificateId().isEmpty());
    }

    @Test
    void numbersAreNormalisedToLongOrDouble() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("int", 7);
        fields.put("float", 1.5f);
        fields.put("decimal", new BigDecimal("82.25"));

        CertificateRecord record = CertificateRecord.of(fields);

        assertEquals(7L, record.get("int"));
        assertEquals(1.5d, record.get("float"));
        assertEquals(82.25d, record.get("decimal"));
    }

    @Test
    void fromJsonMatchesEquivalentMap() throws Exception {
        JsonNode node = objectMapper.readTree("""
                {"lmk-key": "A1", "uprn": 100023336956, "area": 82.5, "flag": true, "note": null}
                """);

        Map<String, Object> fields = new HashMap<>();
        fields.put("lmk-key", "A1");
        fields.put("uprn", 100023336956L);
        fields.put("area", 82.5);
        fields.put("flag", true);
        fields.put("note", null);

        assertEquals(CertificateRecord.of(fields), CertificateRecord.fromJson(node));
    }

    @Test
    void fromJsonKeepsFieldOrderAndStringifiesNestedValues() throws Exception {
        JsonNode node = objectMapper.readTree("""
                {"z": 1, "a": [1, 2], "m": {"k": "v"}}
                """);

        CertificateRecord record = CertificateRecord.fromJson(node);

        assertEquals(List.of("z", "a", "m"), new ArrayList<>(record.getFields().keySet()));
        assertEquals("[1,2]", record.get("a"));
        assertEquals("{\"k\":\"v\"}", record.get("m"));
    }

    @Test
    void rejectsNonScalarValues() {
        assertThrows(IllegalArgumentException.class,
                () -> CertificateRecord.of(Map.of("bad", List.of(1, 2))));
    }
}
