package com.tio.report.schema;

import com.tio.report.store.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Loads and executes the report schema script (tio_plugin_report). Idempotent; safe to call at bootstrap.
 */
public final class ReportSchemaBootstrapper {

    static final String SCHEMA_RESOURCE = "schema/tio-report.sql";
    private static final Logger log = LoggerFactory.getLogger(ReportSchemaBootstrapper.class);

    private final ConnectionProvider connections;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public ReportSchemaBootstrapper(ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /**
     * Creates the report table and indexes if they do not exist.
     *
     * @throws IllegalStateException if a statement fails
     */
    public void ensureSchema() {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Report schema already initialized; skipping");
            return;
        }
        List<String> statements = statements(loadSchemaScript());
        log.info("Report schema: executing {} statement(s) from {}", statements.size(), SCHEMA_RESOURCE);
        try (Connection c = connections.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Report schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}", index,
                            statements.size(), preview, e.getMessage(), e.getSQLState(), e);
                    throw new IllegalStateException("Report schema execution failed at statement " + index + ": "
                            + e.getMessage(), e);
                }
            }
            log.info("Report schema: all {} statement(s) executed; table tio_plugin_report is ready", statements.size());
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Report schema: connection failed. error={} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new IllegalStateException("Report schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on {@code ;}, dropping comment lines and empty statements. */
    static List<String> statements(String script) {
        List<String> out = new ArrayList<>();
        for (String raw : script.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) out.add(stmt);
        }
        return out;
    }

    static String loadSchemaScript() {
        try (InputStream in = ReportSchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Report schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines()
                    .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException("Report schema load failed: " + SCHEMA_RESOURCE, e);
        }
    }
}
