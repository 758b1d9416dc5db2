package com.acme.analytics.collector.export.relational;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Objects;

/**
 * Builds the pooled {@link javax.sql.DataSource} behind the relational sink.
 */
public final class RelationalDataSources {
    private RelationalDataSources() {
    }

    public static HikariDataSource pooled(DatabaseUrl url, int maxPoolSize) {
        Objects.requireNonNull(url, "url");
        HikariConfig config = new HikariConfig();
        config.setPoolName("analytics-collector-db");
        config.setJdbcUrl(url.jdbcUrl());
        if (url.username() != null) {
            config.setUsername(url.username());
        }
        if (url.password() != null) {
            config.setPassword(url.password());
        }
        config.setMaximumPoolSize(Math.max(1, maxPoolSize));
        config.setMinimumIdle(1);
        config.setAutoCommit(true);
        // Do not block startup when the database is briefly unreachable; the first flush reports it.
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }
}
