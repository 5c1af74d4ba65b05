package com.entitygen.generate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Everything the entity template needs for one table, computed before any text is produced.
 *
 * @param className    Pascal-cased table name
 * @param tableName    catalog table name, unchanged
 * @param valueImports imports needed by column types, sorted and without duplicates
 * @param fields       one entry per column, in column order
 */
public record GeneratedClassSpec(
        String className,
        String tableName,
        String packageName,
        String indent,
        List<String> frameworkImports,
        SortedSet<String> valueImports,
        List<String> classAnnotations,
        List<GeneratedField> fields
) {
    Map<String, Object> toContext() {
        Map<String, Object> context = new HashMap<>();
        context.put("className", className);
        context.put("tableName", tableName);
        context.put("packageName", packageName);
        context.put("indent", indent);
        context.put("frameworkImports", frameworkImports);
        context.put("valueImports", List.copyOf(valueImports));
        context.put("classAnnotations", classAnnotations);
        context.put("fields", fields.stream()
                .map(field -> field.toContext(indent))
                .collect(Collectors.toList()));
        return context;
    }
}
