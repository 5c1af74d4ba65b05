package com.entitygen.cli;

import com.entitygen.config.ConnectionDescriptor;
import picocli.CommandLine.Option;

/**
 * Database connection options shared by every command.
 */
public class ConnectionOptions {

    @Option(names = {"--connection-string", "-c"},
            description = "JDBC URL of the database. Use instead of --driver, --server and --database")
    String connectionString;

    @Option(names = {"--driver", "-d"},
            description = "JDBC sub-protocol, e.g. sqlserver, postgresql, mysql. Use instead of --connection-string")
    String driver;

    @Option(names = {"--server", "-s"}, description = "Server to connect to, optionally host:port")
    String server;

    @Option(names = {"--database", "-n"}, description = "Database to connect to")
    String database;

    @Option(names = {"--username", "-u"}, description = "Database username")
    String username;

    @Option(names = {"--password", "-p"}, description = "Database password")
    String password;

    @Option(names = {"--schema"}, description = "Only read tables from this schema")
    String schema;

    public ConnectionDescriptor descriptor() {
        return new ConnectionDescriptor(connectionString, driver, server, database, username, password);
    }
}
