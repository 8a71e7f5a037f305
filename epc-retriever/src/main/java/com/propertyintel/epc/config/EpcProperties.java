package com.propertyintel.epc.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "epc")
@Data
public class EpcProperties {

    private Api api = new Api();
    private Cache cache = new Cache();
    private Export export = new Export();

    @Data
    public static class Api {
        private String baseUrl = "https://epc.opendatacommunities.org/api/v1";
        private String email;
        private String apiKey;

        // Legacy names, only read when email / apiKey are blank
        private String username;
        private String password;

        private int pageSize = 5000;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int retryAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration pageDelay = Duration.ofMillis(100);
        private String searchAfterKey = "search-after";

        public String resolveEmail() {
            return isBlank(email) ? username : email;
        }

        public String resolveApiKey() {
            return isBlank(apiKey) ? password : apiKey;
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }

    @Data
    public static class Cache {
        private String databasePath = "data/epc_cache.db";
        private int maxAgeHours = 24;
        private int cleanupMaxAgeDays = 30;
        private String cleanupCron = "0 0 3 * * ?";
    }

    @Data
    public static class Export {
        private String outputDir = "exports";
        private boolean includeHeader = true;
        private String geojsonCrs = "EPSG:4326";
    }
}
