package com.rockspec.generator;

import com.rockspec.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the rockspec CMake generator.
 * This CLI tool turns a package build description into a CMakeLists.txt
 * that CMake can configure, build and install.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
