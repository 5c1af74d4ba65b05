package com.entitygen.catalog;

import com.entitygen.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CatalogReaderTest {

    private static final TableName ORDER_ITEMS = new TableName("PUBLIC", "order_items");

    private Connection conn;
    private CatalogReader reader;

    @BeforeEach
    void setUp() throws Exception {
        conn = TestDatabases.h2("catalog_reader", "/shop-schema.sql");
        reader = new CatalogReader(conn);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestDatabases.drop(conn);
        conn.close();
    }

    @Test
    void listsEveryUserTable() {
        List<TableName> tables = reader.listTables(null);

        assertEquals(Set.of("order_items", "customer-account", "audit_log", "contacts"),
                tables.stream().map(TableName::name).collect(Collectors.toSet()));
        assertEquals(4, tables.size());
        assertTrue(tables.stream().allMatch(t -> t.schema().equals("PUBLIC")));
    }

    @Test
    void filterMatchesOneTable() {
        assertEquals(List.of(ORDER_ITEMS), reader.listTables("order_items"));
    }

    @Test
    void filterWithoutMatchIsEmpty() {
        assertEquals(List.of(), reader.listTables("no_such_table"));
    }

    @Test
    void filterIsBoundNotInterpolated() {
        assertEquals(List.of(), reader.listTables("x' OR '1'='1"));
        assertEquals(List.of(), reader.listTables("order_items'; DROP TABLE \"order_items\"; --"));
        assertEquals(List.of(ORDER_ITEMS), reader.listTables("order_items"));
    }

    @Test
    void viewsAreListed() throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE VIEW \"priced_items\" AS SELECT \"id\", \"unit_price\" FROM \"order_items\"");
        }

        assertEquals(List.of(new TableName("PUBLIC", "priced_items")), reader.listTables("priced_items"));
        assertEquals(2, reader.listColumns(new TableName("PUBLIC", "priced_items")).size());
    }

    @Test
    void columnsComeInOrdinalOrder() {
        List<ColumnDescriptor> columns = reader.listColumns(new TableName("PUBLIC", "customer-account"));

        assertEquals(List.of("account_id", "display_name", "is_active", "balance", "credit_limit", "avatar"),
                columns.stream().map(ColumnDescriptor::name).toList());
        assertEquals("BIGINT", columns.get(0).sqlType());
        assertEquals("CHARACTER VARYING", columns.get(1).sqlType());
        assertEquals("BOOLEAN", columns.get(2).sqlType());
    }

    @Test
    void readTableBundlesColumns() {
        TableDescriptor table = reader.readTable(ORDER_ITEMS);

        assertEquals("order_items", table.name());
        assertEquals("PUBLIC", table.schema());
        assertEquals(3, table.columns().size());
        assertEquals("INTEGER", table.columns().get(0).sqlType());
        assertTrue(Set.of("NUMERIC", "DECIMAL").contains(table.columns().get(1).sqlType()));
        assertTrue(table.hasColumns());
    }

    @Test
    void unknownTableHasNoColumns() {
        assertFalse(reader.readTable(new TableName("PUBLIC", "missing")).hasColumns());
    }

    @Test
    void schemaRestrictsTables() throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE SCHEMA \"archive\"");
            stmt.execute("CREATE TABLE \"archive\".\"old_orders\" (\"order_id\" INT, \"closed_on\" DATE)");
        }

        CatalogReader archive = new CatalogReader(conn, "archive");

        assertEquals(List.of(new TableName("archive", "old_orders")), archive.listTables(null));
        assertEquals(List.of(), archive.listTables("order_items"));
        assertEquals(2, archive.listColumns(new TableName("archive", "old_orders")).size());
    }

    @Test
    void sameNameInTwoSchemasKeepsColumnsApart() throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE SCHEMA \"archive\"");
            stmt.execute("CREATE TABLE \"archive\".\"order_items\" (\"legacy_code\" INT, \"closed_on\" DATE)");
        }

        List<TableName> matches = reader.listTables("order_items");

        assertEquals(Set.of(ORDER_ITEMS, new TableName("archive", "order_items")), Set.copyOf(matches));
        assertEquals(List.of("id", "unit_price", "created_at"),
                reader.listColumns(ORDER_ITEMS).stream().map(ColumnDescriptor::name).toList());
        assertEquals(List.of("legacy_code", "closed_on"),
                reader.listColumns(new TableName("archive", "order_items")).stream()
                        .map(ColumnDescriptor::name).toList());
        assertEquals(List.of(ORDER_ITEMS), new CatalogReader(conn, "PUBLIC").listTables("order_items"));
    }

    @Test
    void queryFailureCarriesQueryText() throws Exception {
        Connection closed = TestDatabases.h2("catalog_reader_closed");
        closed.close();

        CatalogQueryException e = assertThrows(CatalogQueryException.class,
                () -> new CatalogReader(closed).listTables(null));
        assertTrue(e.query().contains("INFORMATION_SCHEMA.TABLES"));
        assertNotNull(e.getCause());
    }
}
