package com.entitygen.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TableDescriptor(
        @JsonProperty("schema") String schema,
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<ColumnDescriptor> columns
) {
    public TableDescriptor {
        columns = List.copyOf(columns);
    }

    public TableDescriptor(String name, List<ColumnDescriptor> columns) {
        this(null, name, columns);
    }

    public boolean hasColumns() {
        return !columns.isEmpty();
    }
}
