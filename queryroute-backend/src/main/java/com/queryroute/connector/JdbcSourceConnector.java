package com.queryroute.connector;

import com.queryroute.model.SourceDefinition;
import com.queryroute.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * SQL source backed by a lazily created HikariCP pool.
 */
@Slf4j
public class JdbcSourceConnector implements SourceConnector {
    private final SourceDefinition source;
    private final JdbcConnectionInfo connectionInfo;
    private final JdbcPoolSettings poolSettings;
    private volatile HikariDataSource dataSource;

    public JdbcSourceConnector(SourceDefinition source, JdbcConnectionInfo connectionInfo, JdbcPoolSettings poolSettings) {
        this.source = source;
        this.connectionInfo = connectionInfo;
        this.poolSettings = poolSettings;
    }

    @Override
    public String getSourceId() {
        return source.getId();
    }

    @Override
    public String getDbType() {
        return connectionInfo.getDbType();
    }

    @Override
    public boolean supportsSql() {
        return true;
    }

    @Override
    public SourceSession connect() {
        try {
            Connection conn = getDataSource().getConnection();
            conn.setReadOnly(true);
            return new JdbcSourceSession(conn, source.getSchema());
        } catch (SQLException e) {
            log.error("Connection failed: source_id={}, url={}, sql_state={}, error_code={}",
                    source.getId(), connectionInfo.maskedUrl(), e.getSQLState(), e.getErrorCode());
            throw new SourceAccessException("Failed to connect to source " + source.getId() + ": " + e.getMessage(), e);
        }
    }

    private HikariDataSource getDataSource() {
        HikariDataSource ds = dataSource;
        if (ds == null) {
            synchronized (this) {
                ds = dataSource;
                if (ds == null) {
                    ds = new HikariDataSource(buildHikariConfig());
                    dataSource = ds;
                    log.info("Created pool: source_id={}, db_type={}, url={}",
                            source.getId(), connectionInfo.getDbType(), connectionInfo.maskedUrl());
                }
            }
        }
        return ds;
    }

    private HikariConfig buildHikariConfig() {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(connectionInfo.getUrl());
        config.setUsername(connectionInfo.getUsername());
        config.setPassword(connectionInfo.getPassword());
        connectionInfo.driverClassName().ifPresent(config::setDriverClassName);
        if ("postgres".equals(connectionInfo.getDbType())) {
            config.addDataSourceProperty("ApplicationName", "queryroute");
        }
        config.setConnectionTimeout(poolSettings.getConnectionTimeoutMs());
        config.setIdleTimeout(poolSettings.getIdleTimeoutMs());
        config.setMaximumPoolSize(poolSettings.getMaximumPoolSize());
        config.setMinimumIdle(poolSettings.getMinimumIdle());
        config.setPoolName("Pool-" + source.getId());
        // do not fail construction when the source is down; the first borrow reports it
        config.setInitializationFailTimeout(-1);
        return config;
    }

    @Override
    public synchronized void close() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
        }
    }
}
