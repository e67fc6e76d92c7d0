package com.rockspec.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rockspec.generator.cli.exception.OptionsValidationException;
import com.rockspec.generator.cli.model.GenerateOptions;
import com.rockspec.generator.cli.model.ValidatedGenerateOptions;
import com.rockspec.generator.cli.output.GenerateResultsPrinter;
import com.rockspec.generator.cli.validation.GenerateOptionsValidator;
import com.rockspec.generator.codegen.CMakeGenerator;
import com.rockspec.generator.codegen.GeneratorConfig;
import com.rockspec.generator.codegen.GeneratorResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command generating a CMakeLists.txt from a package build description.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "rockspec-cmake-gen 1.0.0",
        description = "Generates a CMakeLists.txt for a Lua package from its build description."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            GeneratorConfig config = GeneratorConfig.builder()
                    .descriptionFile(validated.getDescriptionFile())
                    .packageNameOverride(options.getPackageName())
                    .outputFile(validated.getOutputFile())
                    .dryRun(options.isStdout())
                    .strict(options.isStrict())
                    .build();

            GeneratorResult result = new CMakeGenerator(config).generate();

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            if (options.isStdout()) {
                printer.printScript(spec.commandLine().getOut(), result);
            }
            printer.printSuccess(validated, result);

            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
