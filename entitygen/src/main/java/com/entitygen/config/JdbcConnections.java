package com.entitygen.config;

import com.entitygen.catalog.CatalogQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens read-only JDBC connections for a {@link ConnectionDescriptor}.
 */
public final class JdbcConnections {
    private static final Logger logger = LoggerFactory.getLogger(JdbcConnections.class);

    private JdbcConnections() {}

    public static Connection open(ConnectionDescriptor descriptor) {
        String url = descriptor.jdbcUrl();
        logger.info("Connecting to {}", url);
        try {
            Connection conn = descriptor.hasCredentials()
                    ? DriverManager.getConnection(url, descriptor.username(), descriptor.password())
                    : DriverManager.getConnection(url);
            try {
                conn.setReadOnly(true);
            } catch (SQLException e) {
                try {
                    conn.close();
                } catch (SQLException closing) {
                    e.addSuppressed(closing);
                }
                throw e;
            }
            return conn;
        } catch (SQLException e) {
            throw new CatalogQueryException("connect " + url, e);
        }
    }
}
