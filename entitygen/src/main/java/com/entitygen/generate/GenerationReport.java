package com.entitygen.generate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one generation run, table by table.
 */
public class GenerationReport {

    public record Failure(String table, String reason) {}

    private final List<Path> generated = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();

    void generated(Path file) {
        generated.add(file);
    }

    void skipped(String table) {
        skipped.add(table);
    }

    void failed(String table, Exception cause) {
        failures.add(new Failure(table, cause.getMessage()));
    }

    public List<Path> generated() {
        return Collections.unmodifiableList(generated);
    }

    public List<String> skipped() {
        return Collections.unmodifiableList(skipped);
    }

    public List<Failure> failures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return generated.size() + " generated, " + skipped.size() + " skipped, " + failures.size() + " failed";
    }
}
