package com.entitygen.generate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One column rendered as a field.
 *
 * @param annotationArgs arguments of the {@code @Column} annotation, already escaped
 * @param columnName     catalog column name, unchanged
 * @param identity       whether the field carries {@code @Id}
 */
public record GeneratedField(
        String annotationArgs,
        String fieldType,
        String fieldName,
        String columnName,
        boolean identity
) {
    Map<String, Object> toContext(String indent) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("indent", indent);
        context.put("annotationArgs", annotationArgs);
        context.put("fieldType", fieldType);
        context.put("fieldName", fieldName);
        context.put("columnName", columnName);
        context.put("identity", identity);
        return context;
    }
}
