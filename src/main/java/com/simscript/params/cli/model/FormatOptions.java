package com.simscript.params.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options of the "format" command.
 */
@Getter
public class FormatOptions {

    @Parameters(index = "0", paramLabel = "<template>", description = "Script template containing ${name} markers")
    private Path templateFile;

    @Option(names = {"--definitions", "-d"}, required = true, description = "Parameter definition file (name=value lines)")
    private Path definitionsFile;

    @Option(names = {"--eval", "-e"}, description = "Compute each formatted line when it is an expression")
    private boolean evaluateLines;

    @Option(names = {"--sort", "-s"}, description = "Reorder definitions by dependency before evaluation")
    private boolean sort;

    @Option(names = {"--output", "-o"}, description = "Write the formatted script to this file instead of printing it")
    private Path output;
}
