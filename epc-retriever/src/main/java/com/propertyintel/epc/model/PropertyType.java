package com.propertyintel.epc.model;

import java.util.Arrays;

/**
 * The two EPC registers exposed by the API. The value doubles as the URL
 * path segment and as the property_type column in the cache.
 */
public enum PropertyType {

    DOMESTIC("domestic"),
    NON_DOMESTIC("non-domestic");

    private final String value;

    PropertyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public String searchEndpoint() {
        return value + "/search";
    }

    public String certificateEndpoint(String certificateId) {
        return value + "/certificate/" + certificateId;
    }

    /**
     * Accepts "domestic", "non-domestic" or the enum name, case-insensitive.
     */
    public static PropertyType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Property type is required");
        }
        String normalised = raw.trim().toLowerCase().replace('_', '-');
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalised))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown property type: " + raw + " (expected domestic or non-domestic)"));
    }

    @Override
    public String toString() {
        return value;
    }
}
