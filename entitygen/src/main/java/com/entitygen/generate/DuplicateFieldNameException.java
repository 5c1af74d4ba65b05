package com.entitygen.generate;

import com.entitygen.EntitygenException;

public class DuplicateFieldNameException extends EntitygenException {
    public DuplicateFieldNameException(String table, String fieldName, String firstColumn, String secondColumn) {
        super("Columns '" + firstColumn + "' and '" + secondColumn + "' of table '" + table
                + "' both map to field '" + fieldName + "'");
    }
}
