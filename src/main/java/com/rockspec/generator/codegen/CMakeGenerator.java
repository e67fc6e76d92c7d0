package com.rockspec.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rockspec.generator.cmake.CMakeConfiguration;
import com.rockspec.generator.cmake.CMakeScriptRenderer;
import com.rockspec.generator.codegen.util.FileWriteUtil;
import com.rockspec.generator.description.BuildDescription;
import com.rockspec.generator.description.BuildDescriptionParser;

/**
 * Generates a CMakeLists.txt from a build description file.
 *
 * Problems found in the description (unknown platforms, malformed lines,
 * declared errors) do not fail generation. They are rendered as
 * {@code message(FATAL_ERROR ...)} directives so CMake reports them when the
 * script is run, unless {@link GeneratorConfig#isStrict()} is set.
 */
public class CMakeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CMakeGenerator.class);

    private final GeneratorConfig config;
    private final BuildDescriptionParser parser;
    private final BuildDescriptionTranslator translator;
    private final CMakeScriptRenderer renderer;

    public CMakeGenerator(GeneratorConfig config) {
        this.config = config;
        this.parser = new BuildDescriptionParser();
        this.translator = new BuildDescriptionTranslator();
        this.renderer = new CMakeScriptRenderer();
    }

    public GeneratorResult generate() {
        try {
            log.info("Starting CMake generation...");

            // Step 1: Parse description
            log.info("Step 1: Parsing build description {}...", config.getDescriptionFile());
            BuildDescription description = parser.parse(config.getDescriptionFile());
            log.info("Parsed {} module declarations", description.countModules());
            if (description.hasErrors()) {
                log.warn("Build description has errors: {}", description.getErrors());
            }

            if (config.getPackageNameOverride() != null && !config.getPackageNameOverride().isBlank()) {
                description.setPackageName(config.getPackageNameOverride());
            }
            if (description.getPackageName() == null || description.getPackageName().isBlank()) {
                return GeneratorResult.failure("No package name in " + config.getDescriptionFile()
                        + ", add a 'package = <name>' line or pass --package-name");
            }

            // Step 2: Populate configuration
            log.info("Step 2: Collecting platforms, variables and targets...");
            CMakeConfiguration cmakeConfig = translator.translate(description);

            if (config.isStrict() && cmakeConfig.hasErrors()) {
                return GeneratorResult.failure("Configuration has fatal errors:" + System.lineSeparator()
                        + String.join(System.lineSeparator(), cmakeConfig.getErrors()));
            }

            // Step 3: Render
            log.info("Step 3: Rendering CMake script...");
            String script = renderer.render(cmakeConfig);

            // Step 4: Write
            Path outputPath = null;
            if (!config.isDryRun()) {
                outputPath = config.getOutputFile();
                log.info("Step 4: Writing {}...", outputPath);
                FileWriteUtil.safeWriteString(outputPath, script);
            }

            log.info("CMake generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .script(script)
                    .packageName(cmakeConfig.getPackageName())
                    .fatalErrors(cmakeConfig.getErrors())
                    .variablesCount(cmakeConfig.getVariables().size())
                    .platformOverridesCount(countPlatformOverrides(cmakeConfig))
                    .scriptModulesCount(cmakeConfig.getScriptTargets().size())
                    .nativeModulesCount(cmakeConfig.getNativeTargets().size())
                    .build();

        } catch (IOException e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private static int countPlatformOverrides(CMakeConfiguration cmakeConfig) {
        return cmakeConfig.getPlatformVariables().values().stream().mapToInt(Map::size).sum()
                + cmakeConfig.getPlatformScriptTargets().values().stream().mapToInt(List::size).sum()
                + cmakeConfig.getPlatformNativeTargets().values().stream().mapToInt(List::size).sum();
    }
}
