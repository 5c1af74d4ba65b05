package com.entitygen.config;

import java.util.Locale;

/**
 * Where to find the database: either a ready JDBC URL or a driver/server/database
 * tuple from which one is derived. Credentials are optional in both forms.
 *
 * @param connectionString full JDBC URL, used as-is when present
 * @param driver           JDBC sub-protocol, e.g. {@code sqlserver} or {@code postgresql}
 * @param server           host, optionally with {@code :port}
 * @param database         database name
 */
public record ConnectionDescriptor(
        String connectionString,
        String driver,
        String server,
        String database,
        String username,
        String password
) {
    public static ConnectionDescriptor ofUrl(String jdbcUrl) {
        return new ConnectionDescriptor(jdbcUrl, null, null, null, null, null);
    }

    public static ConnectionDescriptor ofUrl(String jdbcUrl, String username, String password) {
        return new ConnectionDescriptor(jdbcUrl, null, null, null, username, password);
    }

    public ConnectionDescriptor validate() {
        if (isSet(connectionString)) {
            return this;
        }
        if (isSet(driver) && isSet(server) && isSet(database)) {
            return this;
        }
        throw new ConfigurationException(
                "Provide database connection information with either --connection-string "
                        + "or all of --driver, --server and --database");
    }

    public String jdbcUrl() {
        if (isSet(connectionString)) {
            return connectionString;
        }
        String protocol = driver.trim().toLowerCase(Locale.ROOT);
        if (protocol.startsWith("jdbc:")) {
            protocol = protocol.substring("jdbc:".length());
        }
        return switch (protocol) {
            case "sqlserver" -> "jdbc:sqlserver://" + server + ";databaseName=" + database;
            case "h2" -> "jdbc:h2:" + server + "/" + database;
            default -> "jdbc:" + protocol + "://" + server + "/" + database;
        };
    }

    public boolean hasCredentials() {
        return isSet(username);
    }

    @Override
    public String toString() {
        String target = isSet(connectionString)
                ? connectionString
                : "driver=" + driver + ", server=" + server + ", database=" + database;
        return "ConnectionDescriptor[" + target + (hasCredentials() ? ", user=" + username : "") + "]";
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
