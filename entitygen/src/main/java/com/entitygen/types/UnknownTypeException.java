package com.entitygen.types;

import com.entitygen.EntitygenException;

public class UnknownTypeException extends EntitygenException {
    private final String sqlType;

    public UnknownTypeException(String sqlType) {
        super("No Java type mapping for SQL type '" + sqlType + "'");
        this.sqlType = sqlType;
    }

    public String sqlType() {
        return sqlType;
    }
}
