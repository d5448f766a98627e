package com.sluice.runlog.schema;

import com.sluice.runlog.RunLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Loads and executes the run log schema script. Idempotent; the script only creates what is missing.
 */
public final class RunLogSchemaBootstrapper {

    public static final String SCHEMA_RESOURCE = "schema/sluice-run-log.sql";
    private static final Logger log = LoggerFactory.getLogger(RunLogSchemaBootstrapper.class);

    private final String resource;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public RunLogSchemaBootstrapper() {
        this(SCHEMA_RESOURCE);
    }

    RunLogSchemaBootstrapper(String resource) {
        this.resource = resource;
    }

    public void ensureSchema(ConnectionProvider connectionProvider) {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Run log schema already initialized; skipping");
            return;
        }
        try {
            execute(statements(loadSchemaScript()), connectionProvider);
        } catch (RuntimeException e) {
            schemaInitialized.set(false);
            throw e;
        }
    }

    private void execute(List<String> statements, ConnectionProvider connectionProvider) {
        log.info("Run log schema: executing {} statement(s) from {}", statements.size(), resource);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                log.debug("Run log schema: statement {}/{}: {}", index, statements.size(), preview);
                st.execute(stmt);
            }
            log.info("Run log schema ready | statements={}", statements.size());
        } catch (SQLException e) {
            log.error("Run log schema failed | error={} | SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new RunLogException("Run log schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on ';' and drops {@code --} comment lines and empty statements. */
    static List<String> statements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) {
                out.add(stmt);
            }
        }
        return out;
    }

    String loadSchemaScript() {
        try (InputStream in = RunLogSchemaBootstrapper.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RunLogException("Run log schema resource not found: " + resource);
            }
            String sql = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines()
                    .collect(Collectors.joining("\n"));
            log.debug("Run log schema: loaded {} characters from {}", sql.length(), resource);
            return sql;
        } catch (IOException e) {
            throw new RunLogException("Run log schema load failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }
}
