package com.entitygen.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads table and column metadata from {@code INFORMATION_SCHEMA} over an open connection.
 * Results are fully materialized; the connection is only queried, never modified or closed.
 */
public class CatalogReader {
    private static final Logger logger = LoggerFactory.getLogger(CatalogReader.class);

    private final Connection connection;
    private final String schema;

    public CatalogReader(Connection connection, String schema) {
        this.connection = connection;
        this.schema = schema;
    }

    public CatalogReader(Connection connection) {
        this(connection, null);
    }

    /**
     * Lists tables in the order the catalog returns them.
     * <p>
     * Without a schema restriction the same name can come back once per schema
     * that has such a table; callers decide how to treat that.
     *
     * @param filter exact table name to look for, or {@code null} for every table
     * @return matching tables; empty when the filter matches nothing
     */
    public List<TableName> listTables(String filter) {
        boolean bySchema = schema != null;
        boolean byTable = filter != null;
        String sql = CatalogQueries.tables(bySchema, byTable);

        List<TableName> result = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            int index = 1;
            if (bySchema) {
                stmt.setString(index++, schema);
            }
            if (byTable) {
                stmt.setString(index, filter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new TableName(rs.getString(1), rs.getString(2)));
                }
            }
        } catch (SQLException e) {
            throw new CatalogQueryException(sql, e);
        }
        logger.debug("Catalog lists {} table(s){}", result.size(), byTable ? " matching '" + filter + "'" : "");
        return result;
    }

    /**
     * Lists the columns of one table, scoped to its schema, by ordinal position.
     */
    public List<ColumnDescriptor> listColumns(TableName table) {
        String sql = CatalogQueries.COLUMNS;

        List<ColumnDescriptor> result = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, table.schema());
            stmt.setString(2, table.name());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new ColumnDescriptor(rs.getString(1), rs.getString(2)));
                }
            }
        } catch (SQLException e) {
            throw new CatalogQueryException(sql, e);
        }
        logger.debug("Table {} has {} column(s)", table, result.size());
        return result;
    }

    public TableDescriptor readTable(TableName table) {
        return new TableDescriptor(table.schema(), table.name(), listColumns(table));
    }
}
