package com.propertyintel.epc.scheduler;

import com.propertyintel.epc.cache.CertificateCache;
import com.propertyintel.epc.config.EpcProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Creates the cache schema on start-up and sweeps entries that have not
 * been read for epc.cache.cleanup-max-age-days.
 *
 * Default schedule: daily at 03:00 UTC.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheMaintenanceScheduler {

    private final CertificateCache cache;
    private final EpcProperties properties;

    @PostConstruct
    public void onStartup() {
        cache.ensureSchema();
        log.info("Cache ready. Next cleanup: {}", properties.getCache().getCleanupCron());
    }

    @Scheduled(cron = "${epc.cache.cleanup-cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledCleanup() {
        int days = properties.getCache().getCleanupMaxAgeDays();
        log.info("Scheduled cache cleanup triggered (max age {} days)", days);
        try {
            cache.cleanup(days);
        } catch (Exception e) {
            log.error("Scheduled cleanup failed: {}", e.getMessage(), e);
        }
    }
}
