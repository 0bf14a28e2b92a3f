package com.tio.report.store;

import com.tio.config.TioConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Provides JDBC connections to the report database (PostgreSQL, UTC).
 */
public final class ReportConnectionProvider implements ConnectionProvider {

    private final TioConfig config;

    public ReportConnectionProvider(TioConfig config) {
        this.config = Objects.requireNonNull(config, "TioConfig");
    }

    String url() {
        return "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    @Override
    public Connection getConnection() throws SQLException {
        TimeZone prev = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            return DriverManager.getConnection(url(), config.getDbUser(),
                    config.getDbPassword() != null ? config.getDbPassword() : "");
        } finally {
            TimeZone.setDefault(prev);
        }
    }
}
