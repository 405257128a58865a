package com.simscript.params.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.simscript.params.cli.exception.OptionsValidationException;
import com.simscript.params.cli.model.EvaluateOptions;
import com.simscript.params.cli.model.FormatOptions;

public class OptionsValidator {

    public void validate(EvaluateOptions o) {
        List<String> errors = new ArrayList<>();

        checkReadableFile(o.getDefinitionsFile(), "Definition file", errors);
        if (o.isStrictOrder() && !o.isSort()) {
            errors.add("--strict-order only applies together with --sort.");
        }
        checkOutput(o.getOutput(), o.getDefinitionsFile(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }

    public void validate(FormatOptions o) {
        List<String> errors = new ArrayList<>();

        checkReadableFile(o.getTemplateFile(), "Template file", errors);
        checkReadableFile(o.getDefinitionsFile(), "Definition file", errors);
        checkOutput(o.getOutput(), o.getTemplateFile(), errors);
        checkOutput(o.getOutput(), o.getDefinitionsFile(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }

    private static void checkReadableFile(Path file, String label, List<String> errors) {
        if (file == null) {
            errors.add(label + " is required.");
        } else if (!Files.isRegularFile(file)) {
            errors.add(label + " does not exist or is not a file: " + file);
        }
    }

    private static void checkOutput(Path output, Path input, List<String> errors) {
        if (output == null) {
            return;
        }
        Path parent = output.toAbsolutePath().normalize().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            errors.add("Output directory does not exist: " + parent);
        }
        if (input != null && output.toAbsolutePath().normalize().equals(input.toAbsolutePath().normalize())) {
            errors.add("Output file must differ from input file: " + output);
        }
    }
}
