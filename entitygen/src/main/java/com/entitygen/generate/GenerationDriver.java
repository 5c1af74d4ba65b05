package com.entitygen.generate;

import com.entitygen.catalog.AmbiguousTableException;
import com.entitygen.catalog.CatalogReader;
import com.entitygen.catalog.TableDescriptor;
import com.entitygen.catalog.TableName;
import com.entitygen.config.RunConfiguration;
import com.entitygen.types.UnknownTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generates one entity source file per catalog table.
 * <p>
 * Tables are processed one at a time. A table whose types cannot be mapped, whose
 * columns collide after normalization, or whose file cannot be written is reported
 * and skipped; the remaining tables are still generated. Catalog failures end the run.
 * A name found in several schemas is never generated, since the columns to use
 * would depend on which schema happened to be listed first.
 * Tables without columns are skipped with a warning and do not count as failures.
 */
public class GenerationDriver {
    private static final Logger logger = LoggerFactory.getLogger(GenerationDriver.class);

    private final ModelEmitter emitter;

    public GenerationDriver(ModelEmitter emitter) {
        this.emitter = emitter;
    }

    public GenerationReport run(Connection connection, RunConfiguration config) {
        return run(new CatalogReader(connection, config.schema()), config);
    }

    public GenerationReport run(CatalogReader reader, RunConfiguration config) {
        Path outputDir = config.outputDir();
        createOutputDirectory(outputDir);

        List<TableName> tables = reader.listTables(config.table());
        if (tables.isEmpty()) {
            if (config.hasTableFilter()) {
                logger.warn("Table '{}' not found, nothing to generate", config.table());
            } else {
                logger.warn("Catalog lists no tables, nothing to generate");
            }
        }

        GenerationReport report = new GenerationReport();
        Map<String, String> tablesByFile = new HashMap<>();
        Map<String, List<String>> schemasByName = tables.stream()
                .collect(Collectors.groupingBy(TableName::name,
                        Collectors.mapping(TableName::schema, Collectors.toList())));

        for (TableName table : tables) {
            List<String> schemas = schemasByName.get(table.name());
            if (schemas.size() > 1) {
                AmbiguousTableException e = new AmbiguousTableException(table.name(), schemas);
                logger.error("Failed to generate table {}: {}", table, e.getMessage());
                report.failed(table.toString(), e);
                continue;
            }

            TableDescriptor descriptor = reader.readTable(table);
            if (!descriptor.hasColumns()) {
                logger.warn("Table {} has no visible columns, skipping", table);
                report.skipped(table.toString());
                continue;
            }

            try {
                String fileName = emitter.fileName(descriptor);
                String content = emitter.emit(descriptor, config.packageName(), config.indent());
                Path target = outputDir.resolve(fileName);

                String owner = tablesByFile.get(fileName);
                if (owner != null) {
                    throw new FileWriteException(target, "already generated for table '" + owner + "'");
                }

                write(target, content);
                tablesByFile.put(fileName, table.toString());
                report.generated(target);
                logger.info("  Generated {} from table {}", fileName, table);
            } catch (UnknownTypeException | DuplicateFieldNameException
                     | InvalidIdentifierException | FileWriteException e) {
                logger.error("Failed to generate table {}: {}", table, e.getMessage());
                report.failed(table.toString(), e);
            }
        }

        logger.info("Generation complete: {}", report);
        return report;
    }

    private static void createOutputDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new FileWriteException(outputDir, e);
        }
    }

    /**
     * Writes through a sibling temp file so a failed write never leaves a truncated target.
     */
    static void write(Path target, String content) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new FileWriteException(target, e);
        }
    }
}
