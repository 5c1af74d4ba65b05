package com.entitygen.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A table as the catalog identifies it: schema plus name.
 */
public record TableName(
        @JsonProperty("schema") String schema,
        @JsonProperty("name") String name
) {
    @Override
    public String toString() {
        return schema == null ? name : schema + "." + name;
    }
}
