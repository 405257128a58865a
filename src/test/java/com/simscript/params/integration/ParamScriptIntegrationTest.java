package com.simscript.params.integration;

import com.simscript.params.cli.ParamScriptCommand;
import com.simscript.params.param.ParameterSet;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.record.RecordTextCodec;
import com.simscript.params.value.ErrorMarker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the command line, from definition files to written results.
 */
class ParamScriptIntegrationTest {

    @TempDir
    Path tempDir;

    private Path definitions;

    @BeforeEach
    void writeDefinitions() throws IOException {
        definitions = tempDir.resolve("params.txt");
        Files.writeString(definitions, """
                # mesh parameters
                a = 1
                b = "${a}+1"
                folder = path("runs/case1/")
                """);
    }

    private static int run(String... args) {
        return new CommandLine(new ParamScriptCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Test
    void testEvaluateWritesSnapshot() throws IOException {
        Path output = tempDir.resolve("values.txt");

        int exitCode = run("eval", definitions.toString(), "--output", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        OrderedRecord snapshot = new RecordTextCodec().read(output);
        assertThat(snapshot.keys()).containsExactly("a", "b", "folder");
        assertThat(snapshot.get("a")).isEqualTo(1);
        assertThat(snapshot.get("b")).isEqualTo(2.0);
        assertThat(snapshot.get("folder").toString()).isEqualTo("runs/case1/");
    }

    @Test
    void testEvaluatePrintsTable() {
        assertThat(run("eval", definitions.toString())).isEqualTo(CommandLine.ExitCode.OK);
    }

    @Test
    void testFailOnErrorReportsUnresolvedDefinitions() throws IOException {
        Path forward = tempDir.resolve("forward.txt");
        Files.writeString(forward, """
                area = "${w}*2"
                w = 3
                """);
        Path output = tempDir.resolve("values.txt");

        assertThat(run("eval", forward.toString())).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(run("eval", forward.toString(), "--fail-on-error", "-o", output.toString()))
                .isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(new RecordTextCodec().read(output).get("area").toString())
                .isEqualTo(ErrorMarker.unresolved("w", "${w}*2").toString());

        // Sorting fixes the forward reference
        assertThat(run("eval", forward.toString(), "--sort", "--fail-on-error"))
                .isEqualTo(CommandLine.ExitCode.OK);
    }

    @Test
    void testStrictOrderFailsOnUndefinedReference() throws IOException {
        Path undefined = tempDir.resolve("undefined.txt");
        Files.writeString(undefined, "b = \"${a}\"\n");

        assertThat(run("eval", undefined.toString(), "--sort", "--strict-order"))
                .isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(run("eval", undefined.toString(), "--sort"))
                .isEqualTo(CommandLine.ExitCode.OK);
    }

    @Test
    void testInvalidOptionsAreUsageErrors() {
        assertThat(run("eval", tempDir.resolve("missing.txt").toString()))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("eval", definitions.toString(), "--strict-order"))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("eval", definitions.toString(), "-o", definitions.toString()))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("eval", definitions.toString(), "--unknown"))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run()).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testMalformedDefinitionFile() throws IOException {
        Path broken = tempDir.resolve("broken.txt");
        Files.writeString(broken, "a = 1\njust some text\n");

        assertThat(run("eval", broken.toString())).isEqualTo(CommandLine.ExitCode.SOFTWARE);
    }

    @Test
    void testFormatScript() throws IOException {
        Path template = tempDir.resolve("script.tpl");
        Files.writeString(template, "x = ${b}\n${a}*10  # ten");
        Path evaluated = tempDir.resolve("evaluated.txt");
        Path interpolated = tempDir.resolve("interpolated.txt");

        assertThat(run("format", template.toString(), "-d", definitions.toString(), "--eval",
                "-o", evaluated.toString())).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(run("format", template.toString(), "-d", definitions.toString(),
                "-o", interpolated.toString())).isEqualTo(CommandLine.ExitCode.OK);

        assertThat(Files.readString(evaluated)).isEqualTo("x = 2\n10  # ten");
        assertThat(Files.readString(interpolated)).isEqualTo("x = 2\n1*10  # ten");
    }

    @Test
    void testEvaluateFixtureWithAutoSorting() throws IOException, URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/records/plate.txt").toURI());

        ParameterSet parameters = ParameterSet.autoSorting(new RecordTextCodec().read(fixture));

        assertThat(parameters.value("width")).isEqualTo(1.0);
        assertThat(parameters.value("dx")).isEqualTo(0.2);
        assertThat(parameters.value("area")).isEqualTo(2.0);
        assertThat(parameters.format("${output}mesh_${cells}.dat")).isEqualTo("runs/plate/mesh_10.dat");
        assertThat(parameters).containsExactly("area", "length", "width", "cells", "dx", "output");
    }

    @Test
    void testFormatRequiresDefinitions() throws IOException {
        Path template = tempDir.resolve("script.tpl");
        Files.writeString(template, "${a}");

        assertThat(run("format", template.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
