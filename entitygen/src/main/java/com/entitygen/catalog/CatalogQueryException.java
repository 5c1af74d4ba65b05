package com.entitygen.catalog;

import com.entitygen.EntitygenException;

import java.sql.SQLException;

/**
 * A catalog query or the connection behind it failed. Not recoverable within a run.
 */
public class CatalogQueryException extends EntitygenException {
    private final String query;

    public CatalogQueryException(String query, SQLException cause) {
        super("Catalog query failed: " + cause.getMessage() + " [" + query.strip() + "]", cause);
        this.query = query;
    }

    public String query() {
        return query;
    }
}
