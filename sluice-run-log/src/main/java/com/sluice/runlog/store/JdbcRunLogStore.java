package com.sluice.runlog.store;

import com.sluice.runlog.AbstractRunLogStore;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.RunLogException;
import com.sluice.runlog.RunLogJson;
import com.sluice.runlog.schema.RunLogSchemaBootstrapper;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;

/**
 * Run log store backed by the PostgreSQL table {@value #TABLE}: one row per run with the whole run log as jsonb.
 * The table is created on first use from the classpath schema script.
 */
public final class JdbcRunLogStore extends AbstractRunLogStore {

    public static final String TYPE = "jdbc";
    static final String TABLE = "sluice_run_log";

    static final String SELECT_SQL = "SELECT body FROM " + TABLE + " WHERE run_id=?";
    static final String UPSERT_SQL = "INSERT INTO " + TABLE + " (run_id, status, body, updated_at) VALUES (?,?,?,?) "
            + "ON CONFLICT (run_id) DO UPDATE SET status=EXCLUDED.status, body=EXCLUDED.body, updated_at=EXCLUDED.updated_at";

    private static final Logger log = LoggerFactory.getLogger(JdbcRunLogStore.class);

    private final JdbcConnectionProvider connections;
    private final RunLogSchemaBootstrapper schema;

    public JdbcRunLogStore(JdbcConnectionProvider connections, RunLogSchemaBootstrapper schema) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected RunLog read(String runId) {
        ensureSchema();
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(SELECT_SQL)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? RunLogJson.fromJson(rs.getString(1)) : null;
            }
        } catch (SQLException e) {
            log.error("Run log read failed | runId={} | error={} | SQLState={}", runId, e.getMessage(), e.getSQLState(), e);
            throw new RunLogException("Cannot read run log " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected void write(RunLog runLog) {
        ensureSchema();
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, runLog.getRunId());
            ps.setString(2, runLog.getStatus().toValue());
            ps.setObject(3, toJsonb(RunLogJson.toJson(runLog)));
            ps.setTimestamp(4, new Timestamp(System.currentTimeMillis()));
            ps.executeUpdate();
            log.debug("Run log upserted | {} | runId={} | status={}", TABLE, runLog.getRunId(), runLog.getStatus());
        } catch (SQLException e) {
            log.error("Run log write failed | runId={} | error={} | SQLState={}", runLog.getRunId(), e.getMessage(), e.getSQLState(), e);
            throw new RunLogException("Cannot write run log " + runLog.getRunId() + ": " + e.getMessage(), e);
        }
    }

    private void ensureSchema() {
        schema.ensureSchema(connections::getConnection);
    }

    /** Wraps JSON text as a PostgreSQL jsonb parameter. */
    static PGobject toJsonb(String json) throws SQLException {
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(json != null ? json : "{}");
        return o;
    }
}
