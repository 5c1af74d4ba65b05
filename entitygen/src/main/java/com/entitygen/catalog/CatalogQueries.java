package com.entitygen.catalog;

/**
 * SQL against the standard {@code INFORMATION_SCHEMA} views.
 * <p>
 * Identifiers supplied by the user are never spliced into the text: every filter
 * is a {@code ?} placeholder bound by {@link CatalogReader}.
 */
public final class CatalogQueries {
    private CatalogQueries() {}

    static final String SYSTEM_SCHEMAS =
            "UPPER(TABLE_SCHEMA) NOT IN ('INFORMATION_SCHEMA', 'PG_CATALOG', 'SYS', 'MYSQL', 'PERFORMANCE_SCHEMA')";

    /**
     * Base tables and views; views map to read-only entities just as well.
     */
    public static final String TABLES = """
            SELECT TABLE_SCHEMA,
                   TABLE_NAME
            FROM INFORMATION_SCHEMA.TABLES
            WHERE TABLE_TYPE IN ('BASE TABLE', 'VIEW')
              AND %s
            """.formatted(SYSTEM_SCHEMAS);

    public static final String COLUMNS = """
            SELECT COLUMN_NAME,
                   DATA_TYPE
            FROM INFORMATION_SCHEMA.COLUMNS
            WHERE TABLE_SCHEMA = ?
              AND TABLE_NAME = ?
            ORDER BY ORDINAL_POSITION
            """;

    static final String SCHEMA_FILTER = "  AND TABLE_SCHEMA = ?\n";
    static final String TABLE_FILTER = "  AND TABLE_NAME = ?\n";

    /**
     * Table listing in catalog order, optionally narrowed by schema and table name.
     * Placeholders appear schema first, then table.
     */
    public static String tables(boolean bySchema, boolean byTable) {
        return TABLES
                + (bySchema ? SCHEMA_FILTER : "")
                + (byTable ? TABLE_FILTER : "");
    }
}
