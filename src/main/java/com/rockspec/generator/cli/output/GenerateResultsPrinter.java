package com.rockspec.generator.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rockspec.generator.cli.model.GenerateOptions;
import com.rockspec.generator.cli.model.ValidatedGenerateOptions;
import com.rockspec.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Rockspec CMake Generator");
        log.info("=================================================");
        log.info("Build Description: {}", v.getDescriptionFile());
        log.info("Package Name: {}", o.getPackageName() != null ? o.getPackageName() : "(from description)");
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "standard output");
        log.info("Strict Mode: {}", o.isStrict());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Package: {}", result.getPackageName());
        if (result.getOutputPath() != null) {
            log.info("Output Path: {}", result.getOutputPath());
        }
        log.info("Variables: {}", result.getVariablesCount());
        log.info("Script Modules: {}", result.getScriptModulesCount());
        log.info("Native Modules: {}", result.getNativeModulesCount());
        log.info("Platform Overrides: {}", result.getPlatformOverridesCount());

        if (result.hasFatalErrors()) {
            log.warn("");
            log.warn("The script aborts when CMake runs it, {} FATAL_ERROR directive(s) were emitted:",
                    result.getFatalErrors().size());
            result.getFatalErrors().forEach(error -> log.warn("  - {}", error));
        }

        if (v.getOutputFile() != null) {
            log.info("");
            log.info("=================================================");
            log.info("NEXT STEPS");
            log.info("=================================================");
            log.info("   cmake -S {} -B build", v.getOutputFile().getParent());
            log.info("   cmake --build build");
            log.info("   cmake --install build");
            log.info("=================================================");
        }
    }

    public void printScript(PrintWriter out, GeneratorResult result) {
        out.print(result.getScript());
        out.flush();
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }

    public void printValidationErrors(Iterable<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }
}
