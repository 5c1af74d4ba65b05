package com.entitygen.generate;

import com.entitygen.EntitygenException;
import com.entitygen.catalog.ColumnDescriptor;
import com.entitygen.catalog.TableDescriptor;
import com.entitygen.types.TypeMapping;
import com.entitygen.types.TypeMappingTable;

import javax.lang.model.SourceVersion;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static com.entitygen.naming.IdentifierNormalizer.camelCase;
import static com.entitygen.naming.IdentifierNormalizer.pascalCase;

/**
 * Produces the source of one JPA entity class per table.
 * <p>
 * The class is described first as a {@link GeneratedClassSpec}, then rendered
 * through the {@code entity.java} template. Fields follow column order; the first
 * column is the entity identifier.
 */
public class ModelEmitter {
    public static final String EXTENSION = ".java";

    static final String TEMPLATE = "entity.java";

    static final List<String> FRAMEWORK_IMPORTS = List.of(
            "jakarta.persistence.Column",
            "jakarta.persistence.Entity",
            "jakarta.persistence.Id",
            "jakarta.persistence.Table",
            "java.io.Serial",
            "java.io.Serializable",
            "lombok.AllArgsConstructor",
            "lombok.Data",
            "lombok.NoArgsConstructor"
    );

    static final List<String> CLASS_ANNOTATIONS = List.of(
            "Data",
            "NoArgsConstructor",
            "AllArgsConstructor",
            "Entity"
    );

    private final TypeMappingTable types;
    private final HandlebarsEngine engine;

    public ModelEmitter(TypeMappingTable types, HandlebarsEngine engine) {
        this.types = types;
        this.engine = engine;
    }

    public ModelEmitter(TypeMappingTable types) {
        this(types, new HandlebarsEngine());
    }

    public String className(TableDescriptor table) {
        String className = pascalCase(table.name());
        if (!isJavaIdentifier(className)) {
            throw new InvalidIdentifierException(table.name(), className);
        }
        return className;
    }

    public String fileName(TableDescriptor table) {
        return className(table) + EXTENSION;
    }

    /**
     * Resolves names, types and imports for a table.
     *
     * @throws com.entitygen.types.UnknownTypeException if a column type has no mapping
     * @throws DuplicateFieldNameException               if two columns normalize to the same field name
     * @throws InvalidIdentifierException                if a name cannot become a Java identifier
     */
    public GeneratedClassSpec describe(TableDescriptor table, String packageName, String indent) {
        SortedSet<String> valueImports = new TreeSet<>();
        List<GeneratedField> fields = new ArrayList<>(table.columns().size());
        Map<String, String> columnsByField = new HashMap<>();

        for (ColumnDescriptor column : table.columns()) {
            TypeMapping mapping = types.resolve(column.sqlType());
            if (mapping.needsImport()) {
                valueImports.add(mapping.requiredImport());
            }

            String fieldName = camelCase(column.name());
            if (!isJavaIdentifier(fieldName)) {
                throw new InvalidIdentifierException(column.name(), fieldName);
            }
            String clash = columnsByField.putIfAbsent(fieldName, column.name());
            if (clash != null) {
                throw new DuplicateFieldNameException(table.name(), fieldName, clash, column.name());
            }

            fields.add(new GeneratedField(
                    "name = \"" + HandlebarsEngine.escapeJava(column.name()) + "\"",
                    mapping.fieldType(),
                    fieldName,
                    column.name(),
                    fields.isEmpty()
            ));
        }

        return new GeneratedClassSpec(
                className(table),
                table.name(),
                packageName,
                indent,
                FRAMEWORK_IMPORTS,
                valueImports,
                CLASS_ANNOTATIONS,
                List.copyOf(fields)
        );
    }

    /**
     * A single simple name; {@link SourceVersion#isName} would also accept dotted names.
     */
    static boolean isJavaIdentifier(String name) {
        return SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
    }

    public String emit(TableDescriptor table, String packageName, String indent) {
        return render(describe(table, packageName, indent));
    }

    public String render(GeneratedClassSpec spec) {
        try {
            return engine.render(TEMPLATE, spec.toContext());
        } catch (IOException e) {
            throw new EntitygenException("Failed to render template " + TEMPLATE + ": " + e.getMessage(), e);
        }
    }
}
