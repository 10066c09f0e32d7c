package com.appforge.core.store;

import com.appforge.core.breaker.CircuitBreakerStore;
import com.appforge.core.breaker.InMemoryCircuitBreakerStore;
import com.appforge.core.queue.InMemoryJobStore;
import com.appforge.core.queue.JobStore;
import com.appforge.core.ratelimit.InMemoryRateLimitStore;
import com.appforge.core.ratelimit.RateLimitStore;
import com.appforge.sandbox.InMemorySandboxSessionStore;
import com.appforge.sandbox.SandboxSessionStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Wires the coordination stores.
 * <p>
 * When {@code appforge.store.url} is set, every store is JDBC-backed and shared by
 * all processes using that database. Otherwise in-memory stores are used, which
 * only coordinate callers inside this JVM.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnExpression("!'${appforge.store.url:}'.isBlank()")
    public DataSource appforgeDataSource(StoreProperties properties) {
        log.info("Configuring shared store at {}", properties.getUrl());
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.getUrl())
                .username(properties.getUsername())
                .password(properties.getPassword())
                .build();
        dataSource.setMaximumPoolSize(properties.getMaxPoolSize());
        dataSource.setPoolName("appforge-store");
        return dataSource;
    }

    @Bean
    public RateLimitStore rateLimitStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.warn("No store URL configured; rate limits only hold within this process");
            return new InMemoryRateLimitStore();
        }
        var store = new JdbcRateLimitStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public CircuitBreakerStore circuitBreakerStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new InMemoryCircuitBreakerStore();
        }
        var store = new JdbcCircuitBreakerStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public JobStore jobStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new InMemoryJobStore();
        }
        var store = new JdbcJobStore(ds, documentMapper());
        store.createTables();
        return store;
    }

    @Bean
    public SandboxSessionStore sandboxSessionStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new InMemorySandboxSessionStore();
        }
        var store = new JdbcSandboxSessionStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public AgentRunStore agentRunStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("Using in-memory run store (runs will not survive a restart)");
            return new InMemoryAgentRunStore();
        }
        var store = new JdbcAgentRunStore(ds, documentMapper());
        store.createTables();
        return store;
    }

    /** Mapper for JSON columns: ISO timestamps, tolerant of fields added later. */
    public static ObjectMapper documentMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
