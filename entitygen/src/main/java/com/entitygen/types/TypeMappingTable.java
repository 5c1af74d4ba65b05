package com.entitygen.types;

import com.entitygen.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable lookup from SQL column types to Java field types.
 * <p>
 * Keys are matched case-insensitively. The default table is read from the
 * {@code type-mappings.json} classpath resource; alternate tables can be loaded
 * from a file or built directly.
 */
public final class TypeMappingTable {
    private static final Logger logger = LoggerFactory.getLogger(TypeMappingTable.class);

    static final String DEFAULT_RESOURCE = "/type-mappings.json";

    private final Map<String, TypeMapping> mappings;

    private TypeMappingTable(Map<String, TypeMapping> mappings) {
        this.mappings = Collections.unmodifiableMap(mappings);
    }

    public static TypeMappingTable of(Collection<TypeMapping> entries) {
        Map<String, TypeMapping> byType = new LinkedHashMap<>();
        for (TypeMapping entry : entries) {
            if (entry.sourceTypeName() == null || entry.fieldType() == null) {
                throw new ConfigurationException("Type mapping entries need both sourceTypeName and fieldType: " + entry);
            }
            String key = canonical(entry.sourceTypeName());
            if (byType.putIfAbsent(key, entry) != null) {
                throw new ConfigurationException("Duplicate type mapping for '" + key + "'");
            }
        }
        return new TypeMappingTable(byType);
    }

    public static TypeMappingTable defaults() {
        try (InputStream is = TypeMappingTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new ConfigurationException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return read(is);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public static TypeMappingTable fromFile(Path file) {
        logger.info("Loading type mappings from {}", file);
        try (InputStream is = Files.newInputStream(file)) {
            return read(is);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read type mappings from " + file + ": " + e.getMessage(), e);
        }
    }

    private static TypeMappingTable read(InputStream is) throws IOException {
        MappingFile file = new ObjectMapper().readValue(is, MappingFile.class);
        if (file.mappings() == null) {
            throw new ConfigurationException("Type mapping file has no 'mappings' array");
        }
        return of(file.mappings());
    }

    /**
     * Looks up the Java type for a SQL type.
     *
     * @throws UnknownTypeException when the type has no entry; callers never get a guessed default
     */
    public TypeMapping resolve(String sqlType) {
        if (sqlType == null) {
            throw new UnknownTypeException("null");
        }
        TypeMapping mapping = mappings.get(canonical(sqlType));
        if (mapping == null) {
            throw new UnknownTypeException(sqlType);
        }
        return mapping;
    }

    public boolean supports(String sqlType) {
        return sqlType != null && mappings.containsKey(canonical(sqlType));
    }

    public int size() {
        return mappings.size();
    }

    private static String canonical(String sqlType) {
        return sqlType.trim().toUpperCase(Locale.ROOT);
    }

    record MappingFile(@JsonProperty("mappings") List<TypeMapping> mappings) {}
}
