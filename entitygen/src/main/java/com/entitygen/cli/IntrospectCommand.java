package com.entitygen.cli;

import com.entitygen.EntitygenCli;
import com.entitygen.catalog.CatalogQueryException;
import com.entitygen.catalog.CatalogReader;
import com.entitygen.catalog.TableDescriptor;
import com.entitygen.catalog.TableName;
import com.entitygen.config.ConfigurationException;
import com.entitygen.config.ConnectionDescriptor;
import com.entitygen.config.JdbcConnections;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "introspect",
        description = "Print the tables and columns that generate would read, as JSON",
        mixinStandardHelpOptions = true
)
public class IntrospectCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConnectionOptions connection;

    @Option(names = {"--table", "-t"}, description = "Only describe this table")
    private String table;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ConnectionDescriptor descriptor;
        try {
            descriptor = connection.descriptor().validate();
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            return EntitygenCli.EXIT_CONFIGURATION;
        }

        try (Connection conn = JdbcConnections.open(descriptor)) {
            CatalogReader reader = new CatalogReader(conn, connection.schema);
            List<TableDescriptor> tables = new ArrayList<>();
            for (TableName name : reader.listTables(table)) {
                tables.add(reader.readTable(name));
            }

            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);

            if (output != null) {
                mapper.writeValue(output, tables);
                out.println("Introspection written to " + output.getAbsolutePath());
            } else {
                out.println(mapper.writeValueAsString(tables));
            }
            return EntitygenCli.EXIT_OK;
        } catch (CatalogQueryException | SQLException e) {
            err.println("Error: " + e.getMessage());
            return EntitygenCli.EXIT_CATALOG;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EntitygenCli.EXIT_TABLE_FAILURES;
        }
    }
}
