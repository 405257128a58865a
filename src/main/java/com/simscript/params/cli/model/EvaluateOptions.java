package com.simscript.params.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options of the "eval" command.
 */
@Getter
public class EvaluateOptions {

    @Parameters(index = "0", paramLabel = "<definitions>", description = "Parameter definition file (name=value lines)")
    private Path definitionsFile;

    @Option(names = {"--sort", "-s"}, description = "Reorder definitions by dependency before evaluation")
    private boolean sort;

    @Option(names = {"--strict-order"}, description = "Fail instead of warning when definitions cannot be ordered (requires --sort)")
    private boolean strictOrder;

    @Option(names = {"--strict"}, description = "Report expressions that cannot be computed as errors instead of keeping their text")
    private boolean strict;

    @Option(names = {"--protect"}, description = "Treat bare field names in expressions as text")
    private boolean protection;

    @Option(names = {"--output", "-o"}, description = "Write the evaluated values to this file instead of printing them")
    private Path output;

    @Option(names = {"--fail-on-error"}, description = "Exit with status 1 when any definition could not be evaluated")
    private boolean failOnError;
}
