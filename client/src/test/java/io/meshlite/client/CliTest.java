package io.meshlite.client;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Argument handling only; nothing here needs a running node.
 */
class CliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Cli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void missing_command_prints_usage() {
        assertEquals(1, run());
        assertTrue(err().contains("missing command"));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void unknown_command_is_rejected() {
        assertEquals(1, run("frobnicate"));
        assertTrue(err().contains("unknown command: frobnicate"));
    }

    @Test
    void wrong_arity_is_rejected() {
        assertEquals(1, run("get"));
        assertTrue(err().contains("get requires <hash>"));
        assertEquals(1, run("ping", "extra"));
    }

    @Test
    void base_url_needs_a_value() {
        assertEquals(1, run("--base-url"));
        assertTrue(err().contains("--base-url requires a value"));
    }

    @Test
    void add_rejects_missing_file_and_bad_duration() {
        assertEquals(1, run("add", "/definitely/not/here.mp3", "T", "A"));
        assertTrue(err().contains("not a file"));
        assertEquals(1, run("add", "x.mp3", "T", "A", "three"));
        assertTrue(err().contains("duration must be an integer"));
    }

    @Test
    void unreachable_node_is_reported() {
        assertEquals(1, run("--base-url", "http://127.0.0.1:19149", "ping"));
        assertTrue(err().contains("cannot reach node"));
    }

    @Test
    void help_prints_usage_to_stdout() {
        assertEquals(0, run("help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("meshlite-cli"));
    }
}
