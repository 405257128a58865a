package com.simscript.params.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command; only dispatches to its sub-commands.
 */
@Command(
        name = "simscript-params",
        mixinStandardHelpOptions = true,
        version = "simscript-params 1.0.0",
        description = "Evaluates parameter definition files and formats script templates against them.",
        subcommands = {EvaluateCommand.class, FormatCommand.class}
)
public class ParamScriptCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return CommandLine.ExitCode.USAGE;
    }
}
