package com.entitygen.cli;

import com.entitygen.EntitygenCli;
import com.entitygen.TestDatabases;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class IntrospectCommandTest {

    private static final String DB = "cli_introspect";

    private Connection conn;

    @BeforeEach
    void setUp() throws Exception {
        conn = TestDatabases.h2(DB, "/shop-schema.sql");
    }

    @AfterEach
    void tearDown() throws Exception {
        TestDatabases.drop(conn);
        conn.close();
    }

    @Test
    void printsTablesAsJson() throws Exception {
        StringWriter out = new StringWriter();
        CommandLine cmd = EntitygenCli.commandLine();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("introspect", "-c", TestDatabases.h2Url(DB), "-u", "sa", "-p", "",
                "-t", "order_items");

        assertEquals(EntitygenCli.EXIT_OK, exitCode);
        JsonNode tables = new ObjectMapper().readTree(out.toString());
        assertEquals(1, tables.size());
        assertEquals("order_items", tables.get(0).get("name").asText());
        assertEquals("PUBLIC", tables.get(0).get("schema").asText());
        assertEquals("unit_price", tables.get(0).get("columns").get(1).get("name").asText());
        assertEquals("INTEGER", tables.get(0).get("columns").get(0).get("sqlType").asText());
    }

    @Test
    void requiresConnection() {
        CommandLine cmd = EntitygenCli.commandLine();
        cmd.setErr(new PrintWriter(new StringWriter()));

        assertEquals(EntitygenCli.EXIT_CONFIGURATION, cmd.execute("introspect"));
    }
}
