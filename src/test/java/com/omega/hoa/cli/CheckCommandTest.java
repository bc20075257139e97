package com.omega.hoa.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CheckCommand.
 */
class CheckCommandTest {

    private static final String VALID = """
        HOA: v1
        States: 1
        Start: 0
        AP: 1 "a"
        Alias: @a 0
        Acceptance: 1 Inf(0)
        --BODY--
        State: 0 {0}
        [@a] 0
        [!@a] 0
        --END--
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        commandLine = new CommandLine(new CheckCommand()).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
    }

    @Test
    void testValidFileExitsWithZero() throws IOException {
        Path file = write("ok.hoa", VALID);

        int exitCode = commandLine.execute(file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testNormalizePrintsCanonicalForm() throws IOException {
        Path file = write("ok.hoa", VALID);

        int exitCode = commandLine.execute("--normalize", "--alias-policy", "extract", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .startsWith("HOA: v1\n")
                .contains("Alias: @a 0\n")
                .contains("[@a] 0\n")
                .contains("State: 0 {0}\n")
                .endsWith("--END--\n");
    }

    @Test
    void testRejectedAutomatonExitsWithOne() throws IOException {
        Path file = write("bad.hoa", VALID.replace("[@a] 0", "[5] 0"));

        assertThat(commandLine.execute("-n", file.toString())).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testAbortIsNotARejection() throws IOException {
        Path file = write("aborted.hoa", VALID + "HOA: v1\nStates: 3\n--ABORT--\n");

        assertThat(commandLine.execute(file.toString())).isZero();
    }

    @Test
    void testMissingFileIsRejected() {
        assertThat(commandLine.execute(tempDir.resolve("missing.hoa").toString())).isEqualTo(1);
    }

    @Test
    void testStrictLabelsRejectsUndeclaredImplicitLabels() throws IOException {
        Path file = write("implicit.hoa", """
            HOA: v1
            States: 1
            Start: 0
            AP: 0
            Acceptance: 0 t
            --BODY--
            State: 0
            0
            --END--
            """);

        assertThat(commandLine.execute(file.toString())).isZero();
        setUp();
        assertThat(commandLine.execute("--strict-labels", file.toString())).isEqualTo(1);
    }

    @Test
    void testImplicitLabelsOption() throws IOException {
        Path file = write("rows.hoa", """
            HOA: v1
            States: 1
            Start: 0
            AP: 1 "a"
            Acceptance: 0 t
            --BODY--
            State: 0
            [!0] 0
            [0] 0
            --END--
            """);

        assertThat(commandLine.execute("-n", "--implicit-labels", file.toString())).isZero();
        assertThat(out.toString()).contains("properties: implicit-labels\n").doesNotContain("[");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
