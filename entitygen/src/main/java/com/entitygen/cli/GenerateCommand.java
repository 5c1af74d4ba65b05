package com.entitygen.cli;

import com.entitygen.EntitygenCli;
import com.entitygen.EntitygenException;
import com.entitygen.catalog.CatalogQueryException;
import com.entitygen.config.ConfigurationException;
import com.entitygen.config.JdbcConnections;
import com.entitygen.config.RunConfiguration;
import com.entitygen.generate.GenerationDriver;
import com.entitygen.generate.GenerationReport;
import com.entitygen.generate.ModelEmitter;
import com.entitygen.types.TypeMappingTable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

@Command(
        name = "generate",
        description = "Write one entity class per table to the output directory",
        mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConnectionOptions connection;

    @Option(names = {"--package", "-j"}, required = true, description = "Package name for the generated classes")
    private String packageName;

    @Option(names = {"--indentation", "-i"},
            description = "Indentation for class members; \\t for a tab (default: four spaces)")
    private String indentation;

    @Option(names = {"--output", "-o"}, defaultValue = "models",
            description = "Directory for the generated .java files (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @Option(names = {"--table", "-t"}, description = "Only generate the class for this table")
    private String table;

    @Option(names = {"--type-mappings"}, description = "JSON file replacing the built-in SQL to Java type table")
    private Path typeMappings;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        RunConfiguration config;
        TypeMappingTable types;
        try {
            config = new RunConfiguration(
                    connection.descriptor(),
                    packageName,
                    RunConfiguration.parseIndent(indentation),
                    outputDir,
                    table,
                    connection.schema
            ).validate();
            types = typeMappings != null ? TypeMappingTable.fromFile(typeMappings) : TypeMappingTable.defaults();
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            return EntitygenCli.EXIT_CONFIGURATION;
        }

        GenerationDriver driver = new GenerationDriver(new ModelEmitter(types));
        try (Connection conn = JdbcConnections.open(config.connection())) {
            GenerationReport report = driver.run(conn, config);

            for (GenerationReport.Failure failure : report.failures()) {
                err.println("Failed: " + failure.table() + ": " + failure.reason());
            }
            out.println("Generated " + report.generated().size() + " class(es) in "
                    + config.outputDir().toAbsolutePath());
            return report.hasFailures() ? EntitygenCli.EXIT_TABLE_FAILURES : EntitygenCli.EXIT_OK;
        } catch (CatalogQueryException e) {
            err.println("Error: " + e.getMessage());
            return EntitygenCli.EXIT_CATALOG;
        } catch (SQLException e) {
            err.println("Error closing connection: " + e.getMessage());
            return EntitygenCli.EXIT_CATALOG;
        } catch (EntitygenException e) {
            err.println("Error: " + e.getMessage());
            return EntitygenCli.EXIT_TABLE_FAILURES;
        }
    }
}
