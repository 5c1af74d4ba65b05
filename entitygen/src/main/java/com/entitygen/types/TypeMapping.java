package com.entitygen.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the type mapping table.
 *
 * @param sourceTypeName SQL type name as reported by {@code INFORMATION_SCHEMA.COLUMNS.DATA_TYPE}
 * @param fieldType      Java type used for the generated field
 * @param requiredImport fully-qualified class to import, or {@code null} for types in {@code java.lang}
 */
public record TypeMapping(
        @JsonProperty("sourceTypeName") String sourceTypeName,
        @JsonProperty("fieldType") String fieldType,
        @JsonProperty("requiredImport") String requiredImport
) {
    public boolean needsImport() {
        return requiredImport != null && !requiredImport.isBlank();
    }
}
