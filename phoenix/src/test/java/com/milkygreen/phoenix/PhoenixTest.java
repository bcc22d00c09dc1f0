package com.milkygreen.phoenix;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PhoenixTest {

    @TempDir
    Path temporaryFolder;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private int run(InputStream in, String... args) throws Exception {
        Phoenix phoenix = new Phoenix(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return phoenix.run(args, in);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws Exception {
        Path file = temporaryFolder.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void buildPrintsTokensAndExpression() throws Exception {
        Path file = write("main.ph", "( 10 * 4 )\n");

        assertEquals(Phoenix.EXIT_OK, run("build", file.toString()));

        String output = stdout();
        assertTrue(output.startsWith("Building " + file));
        assertTrue(output.contains("NUMBER '10' 10 @2"), output);
        assertTrue(output.contains("Expression: (10 * 4)"), output);
        assertEquals("", stderr());
    }

    @Test
    public void buildAlias() throws Exception {
        Path file = write("alias.ph", "(1+2)");

        assertEquals(Phoenix.EXIT_OK, run("b", file.toString()));
        assertTrue(stdout().contains("Expression: (1 + 2)"));
    }

    @Test
    public void syntaxErrorIsReportedNotThrown() throws Exception {
        Path file = write("bad.ph", "(9 % 3)");

        assertEquals(Phoenix.EXIT_SYNTAX, run("build", file.toString()));

        String errors = stderr();
        assertTrue(errors.contains(file + ":5: Error at '3': Invalid operator"), errors);
        assertTrue(errors.contains("expected: ( number operator number )"), errors);
        assertTrue(errors.contains("unrecognized character '%' at offset 3"), errors);
    }

    @Test
    public void errorAtEndOfInput() throws Exception {
        Path file = write("open.ph", "1+2");

        assertEquals(Phoenix.EXIT_SYNTAX, run("build", file.toString()));
        assertTrue(stderr().contains(file + ":3: Error at end: Expect '('."), stderr());
    }

    @Test
    public void missingFile() throws Exception {
        Path file = temporaryFolder.resolve("nope.ph");

        assertEquals(Phoenix.EXIT_NO_INPUT, run("build", file.toString()));
        assertTrue(stderr().startsWith(file + ": Error: failed to read file"), stderr());
    }

    @Test
    public void malformedUtf8IsRejected() throws Exception {
        Path file = temporaryFolder.resolve("corrupt.ph");
        Files.write(file, new byte[]{'(', '1', ' ', (byte) 0xFF, '+', ' ', '2', ')'});

        assertEquals(Phoenix.EXIT_NO_INPUT, run("build", file.toString()));
        assertTrue(stderr().startsWith(file + ": Error: failed to read file"), stderr());
        assertFalse(stdout().contains("Expression:"), stdout());
    }

    @Test
    public void usage() throws Exception {
        assertEquals(Phoenix.EXIT_USAGE, run());
        assertEquals(Phoenix.EXIT_USAGE, run("build"));
        assertEquals(Phoenix.EXIT_USAGE, run("compile", "x.ph"));
        assertTrue(stdout().contains("Usage: ph <command>"));
    }

    @Test
    public void replKeepsGoingAfterErrors() throws Exception {
        InputStream in = new ByteArrayInputStream("(1+2)\n1+2\n\n(8 / 4)\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(Phoenix.EXIT_OK, run(in, "repl"));

        String output = stdout();
        assertTrue(output.contains("(1 + 2)"), output);
        assertTrue(output.contains("(8 / 4)"), output);
        assertTrue(stderr().contains("<stdin>:3: Error at end"), stderr());
    }

    @Test
    public void logLevelFallsBackToWarning() {
        assertEquals(java.util.logging.Level.FINE, LogConfig.parseLevel(" fine "));
        assertEquals(java.util.logging.Level.WARNING, LogConfig.parseLevel(null));
        assertEquals(java.util.logging.Level.WARNING, LogConfig.parseLevel("loud"));
    }
}
