package com.entitygen.config;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Resolved settings for one generation run.
 *
 * @param connection  where to read the catalog from
 * @param packageName package declared by every generated class
 * @param indent      indentation used for class members
 * @param outputDir   directory receiving the generated files
 * @param table       single table to generate, or {@code null} for all tables
 * @param schema      schema to restrict the catalog to, or {@code null} for every non-system schema
 */
public record RunConfiguration(
        ConnectionDescriptor connection,
        String packageName,
        String indent,
        Path outputDir,
        String table,
        String schema
) {
    public static final String DEFAULT_INDENT = "    ";
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("models");

    private static final Pattern PACKAGE_NAME =
            Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

    public RunConfiguration {
        if (indent == null) {
            indent = DEFAULT_INDENT;
        }
        if (outputDir == null) {
            outputDir = DEFAULT_OUTPUT_DIR;
        }
        if (table != null && table.isBlank()) {
            table = null;
        }
        if (schema != null && schema.isBlank()) {
            schema = null;
        }
    }

    public RunConfiguration validate() {
        if (packageName == null || packageName.isBlank()) {
            throw new ConfigurationException("A package name is required (--package)");
        }
        if (!PACKAGE_NAME.matcher(packageName).matches()) {
            throw new ConfigurationException("'" + packageName + "' is not a valid Java package name");
        }
        if (!indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new ConfigurationException("Indentation must consist of spaces or tabs only");
        }
        if (connection == null) {
            throw new ConfigurationException("No database connection configured");
        }
        connection.validate();
        return this;
    }

    public boolean hasTableFilter() {
        return table != null;
    }

    /**
     * Reads indentation as typed on a command line, where a tab is usually entered as {@code \t}.
     */
    public static String parseIndent(String raw) {
        if (raw == null) {
            return DEFAULT_INDENT;
        }
        return raw.replace("\\t", "\t");
    }
}
