package com.tracegate.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that provides the {@link EntityGraphStore} bean.
 * <p>
 * With {@code tracegate.store.type=jdbc} a {@link JdbcEntityGraphStore} is created over a
 * HikariCP pool and its tables are created on startup. Otherwise an
 * {@link InMemoryEntityGraphStore} is used, optionally seeded from
 * {@code tracegate.store.seed-file}. The in-memory store does not survive a restart.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "tracegate.store", name = "type", havingValue = "jdbc")
    public HikariDataSource tracegateDataSource(StoreProperties properties) {
        var jdbc = properties.getJdbc();
        if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
            throw new IllegalStateException("tracegate.store.type=jdbc requires tracegate.store.jdbc.url");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        config.setPoolName("tracegate-store");
        return new HikariDataSource(config);
    }

    /**
     * JDBC-backed store, activated by {@code tracegate.store.type=jdbc}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "tracegate.store", name = "type", havingValue = "jdbc")
    public EntityGraphStore jdbcEntityGraphStore(HikariDataSource tracegateDataSource,
                                                 ObjectMapper objectMapper) throws SQLException {
        log.info("Configuring JDBC entity graph store ({})", tracegateDataSource.getJdbcUrl());
        var store = new JdbcEntityGraphStore(tracegateDataSource, objectMapper);
        store.createTables();
        return store;
    }

    /**
     * In-memory fallback store, used when no JDBC store is configured.
     */
    @Bean
    @ConditionalOnMissingBean(EntityGraphStore.class)
    public EntityGraphStore memoryEntityGraphStore(StoreProperties properties,
                                                   ObjectMapper objectMapper) throws IOException {
        var store = new InMemoryEntityGraphStore();
        if (properties.hasSeedFile()) {
            Resource resource = new DefaultResourceLoader().getResource(properties.getSeedFile());
            try (InputStream in = resource.getInputStream()) {
                objectMapper.readValue(in, GraphSnapshot.class).loadInto(store);
            }
            log.info("In-memory entity graph store seeded from {}", properties.getSeedFile());
        } else {
            log.info("Using empty in-memory entity graph store (data will not persist across restarts)");
        }
        return store;
    }
}
