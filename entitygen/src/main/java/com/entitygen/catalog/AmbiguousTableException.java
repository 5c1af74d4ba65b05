package com.entitygen.catalog;

import com.entitygen.EntitygenException;

import java.util.List;

/**
 * A table name exists in more than one schema and no schema was chosen.
 */
public class AmbiguousTableException extends EntitygenException {
    public AmbiguousTableException(String table, List<String> schemas) {
        super("Table '" + table + "' exists in schemas " + schemas + "; choose one with --schema");
    }
}
