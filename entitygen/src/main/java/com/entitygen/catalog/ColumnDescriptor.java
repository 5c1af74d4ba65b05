package com.entitygen.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ColumnDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("sqlType") String sqlType
) {}
