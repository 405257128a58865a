package com.simscript.params.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.cli.exception.OptionsValidationException;
import com.simscript.params.cli.model.FormatOptions;
import com.simscript.params.cli.output.SnapshotPrinter;
import com.simscript.params.cli.validation.OptionsValidator;
import com.simscript.params.param.ParameterSet;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.record.RecordTextCodec;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Formats a script template against the evaluated values of a definition file.
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        description = "Substitutes evaluated parameter values into a script template."
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Mixin
    private FormatOptions options = new FormatOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final RecordTextCodec codec = new RecordTextCodec();
    private final SnapshotPrinter printer = new SnapshotPrinter();

    @Override
    public Integer call() {
        try {
            validator.validate(options);
        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return CommandLine.ExitCode.USAGE;
        }

        try {
            OrderedRecord definitions = codec.read(options.getDefinitionsFile());
            ParameterSet parameters = options.isSort()
                    ? ParameterSet.autoSorting(definitions)
                    : new ParameterSet(definitions);
            String template = Files.readString(options.getTemplateFile(), StandardCharsets.UTF_8);

            String script = options.isEvaluateLines()
                    ? parameters.formatEval(template)
                    : parameters.formatInterpolate(template);

            if (options.getOutput() != null) {
                Files.writeString(options.getOutput(), script, StandardCharsets.UTF_8);
                printer.printWritten(options.getOutput(), "Formatted script");
            } else {
                printer.printText(script);
            }
            return CommandLine.ExitCode.OK;

        } catch (IllegalArgumentException e) {
            log.error("Invalid definition file {}: {}", options.getDefinitionsFile(), e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IOException e) {
            log.error("Formatting failed with exception", e);
            return CommandLine.ExitCode.SOFTWARE;
        }
    }
}
