package com.simscript.params.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.cli.exception.OptionsValidationException;
import com.simscript.params.cli.model.EvaluateOptions;
import com.simscript.params.cli.output.SnapshotPrinter;
import com.simscript.params.cli.validation.OptionsValidator;
import com.simscript.params.eval.Evaluator;
import com.simscript.params.eval.EvaluatorConfig;
import com.simscript.params.exception.OrderingFailureException;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.record.RecordTextCodec;
import com.simscript.params.resolve.DependencyResolver;
import com.simscript.params.resolve.ResolutionMode;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Evaluates a definition file and prints (or writes) the resulting values.
 */
@Command(
        name = "eval",
        mixinStandardHelpOptions = true,
        description = "Evaluates the definitions of a parameter file."
)
public class EvaluateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EvaluateCommand.class);

    @Mixin
    private EvaluateOptions options = new EvaluateOptions();

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

        Path source = options.getDefinitionsFile();
        try {
            OrderedRecord definitions = codec.read(source);
            if (options.isSort()) {
                ResolutionMode mode = options.isStrictOrder() ? ResolutionMode.STRICT : ResolutionMode.LENIENT;
                definitions = new DependencyResolver().sort(definitions, mode);
            }

            EvaluatorConfig config = EvaluatorConfig.builder()
                    .strict(options.isStrict())
                    .protection(options.isProtection())
                    .build();
            OrderedRecord snapshot = new Evaluator(config).evaluate(definitions);

            if (options.getOutput() != null) {
                codec.write(snapshot, options.getOutput());
                printer.printWritten(options.getOutput(), "Evaluated values");
            } else {
                printer.printTable(source, definitions, snapshot);
            }
            printer.printErrors(snapshot);

            if (options.isFailOnError() && !SnapshotPrinter.failedFields(snapshot).isEmpty()) {
                return CommandLine.ExitCode.SOFTWARE;
            }
            return CommandLine.ExitCode.OK;

        } catch (OrderingFailureException e) {
            log.error("Definitions cannot be ordered: {}", e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IllegalArgumentException e) {
            log.error("Invalid definition file {}: {}", source, e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IOException e) {
            log.error("Evaluation failed with exception", e);
            return CommandLine.ExitCode.SOFTWARE;
        }
    }
}
