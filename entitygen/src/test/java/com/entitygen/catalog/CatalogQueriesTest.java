package com.entitygen.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogQueriesTest {

    @Test
    void queriesReadInformationSchema() {
        assertTrue(CatalogQueries.TABLES.contains("INFORMATION_SCHEMA.TABLES"));
        assertTrue(CatalogQueries.COLUMNS.contains("INFORMATION_SCHEMA.COLUMNS"));
    }

    @Test
    void queriesFilterSystemSchemas() {
        assertTrue(CatalogQueries.TABLES.contains("'INFORMATION_SCHEMA'"));
        assertTrue(CatalogQueries.TABLES.contains("'PG_CATALOG'"));
        assertTrue(CatalogQueries.COLUMNS.contains("'INFORMATION_SCHEMA'"));
    }

    @Test
    void filtersArePlaceholders() {
        assertEquals(0, countPlaceholders(CatalogQueries.tables(false, false)));
        assertEquals(1, countPlaceholders(CatalogQueries.tables(false, true)));
        assertEquals(2, countPlaceholders(CatalogQueries.tables(true, true)));
        assertEquals(2, countPlaceholders(CatalogQueries.COLUMNS));
    }

    @Test
    void columnsAreScopedToSchemaAndOrderedByPosition() {
        assertTrue(CatalogQueries.COLUMNS.contains("TABLE_SCHEMA = ?"));
        assertTrue(CatalogQueries.COLUMNS.trim().endsWith("ORDER BY ORDINAL_POSITION"));
    }

    @Test
    void tablesComeWithTheirSchema() {
        assertTrue(CatalogQueries.TABLES.contains("TABLE_SCHEMA,"));
        assertTrue(CatalogQueries.TABLES.contains("'VIEW'"));
    }

    @Test
    void tableListingKeepsCatalogOrder() {
        assertFalse(CatalogQueries.tables(true, true).contains("ORDER BY"));
    }

    private static long countPlaceholders(String sql) {
        return sql.chars().filter(c -> c == '?').count();
    }
}
