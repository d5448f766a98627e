package com.sluice.runlog.store;

import com.sluice.config.SluiceConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.TimeZone;

/**
 * Provides JDBC connections to the run log database (PostgreSQL, UTC).
 */
public final class JdbcConnectionProvider {

    private final SluiceConfig config;

    public JdbcConnectionProvider(SluiceConfig config) {
        this.config = config != null ? config : throwNPE();
    }

    private static SluiceConfig throwNPE() {
        throw new NullPointerException("SluiceConfig");
    }

    public String url() {
        return "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    public Connection getConnection() throws SQLException {
        // The driver sends the JVM default zone; some servers reject zones such as Asia/Calcutta.
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
