package com.simscript.params;

import com.simscript.params.cli.ParamScriptCommand;
import picocli.CommandLine;

/**
 * Main entry point for the parameter script tool.
 * Evaluates parameter definition files and formats script templates against them.
 */
public class ParamScriptApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParamScriptCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
