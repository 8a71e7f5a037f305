package com.propertyintel.epc.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestTemplate;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the EPC API client and the SQLite cache.
 *
 * The RestTemplate is built once per credential set and carries the Basic
 * auth header, so nothing downstream handles credentials.
 */
@Configuration
@Slf4j
public class EpcClientConfiguration {

    @Bean
    public RestTemplate epcRestTemplate(RestTemplateBuilder builder, EpcProperties properties) {
        EpcProperties.Api api = properties.getApi();
        String email = api.resolveEmail();
        String apiKey = api.resolveApiKey();

        if (email == null || email.isBlank() || apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("epc.api.email and epc.api.api-key must be set "
                    + "(EPC_API_EMAIL / EPC_API_KEY)");
        }

        log.info("EPC API client configured for {} as {}", api.getBaseUrl(), email);

        return builder
                .basicAuthentication(email, apiKey)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .setConnectTimeout(api.getRequestTimeout())
                .setReadTimeout(api.getRequestTimeout())
                .build();
    }

    /**
     * SQLiteDataSource hands out a fresh connection per call, so the cache
     * file is only held open for the duration of one operation.
     */
    @Bean
    public DataSource epcCacheDataSource(EpcProperties properties) {
        Path dbPath = Paths.get(properties.getCache().getDatabasePath());
        Path parent = dbPath.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create cache directory: " + parent, e);
        }

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource epcCacheDataSource) {
        return new JdbcTemplate(epcCacheDataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(DataSource epcCacheDataSource) {
        return new TransactionTemplate(new DataSourceTransactionManager(epcCacheDataSource));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
