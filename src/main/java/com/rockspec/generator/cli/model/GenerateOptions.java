package com.rockspec.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--description", "-d" }, required = true, description = "Package build description file")
	private Path descriptionFile;

	@Option(names = { "--package-name",
			"-n" }, description = "Package name, overrides the 'package' entry of the description")
	private String packageName;

	@Option(names = { "--output",
			"-o" }, description = "Output file (defaults to CMakeLists.txt next to the description)")
	private Path outputFile;

	@Option(names = { "--stdout" }, description = "Print the generated script instead of writing a file")
	private boolean stdout;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = {
			"--strict" }, description = "Fail instead of emitting FATAL_ERROR directives when the description has errors")
	private boolean strict;

}
