package com.rockspec.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.rockspec.generator.cli.exception.OptionsValidationException;
import com.rockspec.generator.cli.model.GenerateOptions;
import com.rockspec.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	static final String DEFAULT_OUTPUT_NAME = "CMakeLists.txt";

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path descriptionFile = null;
		if (o.getDescriptionFile() == null) {
			errors.add("Build description is required (--description / -d).");
		} else {
			descriptionFile = o.getDescriptionFile().toAbsolutePath().normalize();
			if (!Files.isRegularFile(descriptionFile)) {
				errors.add("Build description does not exist or is not a file: " + o.getDescriptionFile());
			}
		}

		if (o.getPackageName() != null && o.getPackageName().isBlank()) {
			errors.add("Package name must not be blank when given (--package-name / -n).");
		}

		if (o.isStdout() && o.getOutputFile() != null) {
			errors.add("--stdout and --output cannot be combined.");
		}

		// Default output lives next to the description
		Path outputFile = null;
		if (!o.isStdout()) {
			if (o.getOutputFile() != null) {
				outputFile = o.getOutputFile().toAbsolutePath().normalize();
			} else if (descriptionFile != null) {
				outputFile = descriptionFile.resolveSibling(DEFAULT_OUTPUT_NAME);
			}

			if (outputFile != null && Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			} else if (outputFile != null && Files.exists(outputFile) && !o.isForce()) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(descriptionFile, outputFile);
	}
}
