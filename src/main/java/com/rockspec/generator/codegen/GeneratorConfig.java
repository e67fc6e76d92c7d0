package com.rockspec.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the CMake generator.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Build description file to read.
     */
    private Path descriptionFile;

    /**
     * Replaces the package name declared in the description when set.
     */
    private String packageNameOverride;

    /**
     * Where the generated script is written. Ignored in dry runs.
     */
    private Path outputFile;

    /**
     * Render only, nothing is written.
     */
    private boolean dryRun;

    /**
     * Treat recorded fatal errors as a generation failure instead of
     * emitting them into the script.
     */
    private boolean strict;
}
