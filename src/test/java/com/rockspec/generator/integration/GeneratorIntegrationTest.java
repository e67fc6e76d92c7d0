package com.rockspec.generator.integration;

import com.rockspec.generator.codegen.CMakeGenerator;
import com.rockspec.generator.codegen.GeneratorConfig;
import com.rockspec.generator.codegen.GeneratorResult;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process.
 */
class GeneratorIntegrationTest {

    private static final String CJSON_DESCRIPTION = """
            # lua-cjson 2.1.0
            package = lua-cjson
            supported_platforms = unix, macosx
            unsupported_platforms = windows

            variable LUA_VERSION = 5.1
            variable@macosx CJSON_LDFLAGS = -undefined dynamic_lookup

            module cjson sources = lua_cjson.c strbuf.c fpconv.c
            module cjson libraries = m
            module cjson defines = NDEBUG
            module cjson.util sources = lua/cjson/util.lua
            module@linux cjson.fast sources = fast.c

            install bin = lua/json2lua.lua lua/lua2json.lua
            copy_directories = doc, tests
            """;

    @TempDir
    Path tempDir;

    @Test
    void testGenerateCMakeListsFromDescription() throws IOException {
        Path description = tempDir.resolve("lua-cjson.desc");
        Files.writeString(description, CJSON_DESCRIPTION);
        Path output = tempDir.resolve("build/CMakeLists.txt");

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .outputFile(output)
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPackageName()).isEqualTo("lua-cjson");
        assertThat(result.getOutputPath()).isEqualTo(output);
        assertThat(result.getScriptModulesCount()).isEqualTo(1);
        assertThat(result.getNativeModulesCount()).isEqualTo(1);
        assertThat(result.getPlatformOverridesCount()).isEqualTo(3);
        assertThat(result.hasFatalErrors()).isFalse();

        assertThat(Files.exists(output)).isTrue();
        String script = Files.readString(output);
        assertThat(script).isEqualTo(result.getScript());
        assertThat(script).containsSubsequence(
                "project(lua-cjson C CXX)",
                "if (WIN32)",
                "if (NOT UNIX AND NOT APPLE)",
                "set(LUA_VERSION 5.1)",
                "set(BUILD_COPY_DIRECTORIES doc tests)",
                "set(BUILD_INSTALL_BIN lua/json2lua.lua lua/lua2json.lua)",
                "set(cjson_SOURCES lua_cjson.c strbuf.c fpconv.c)",
                "if (APPLE)\n    set(CJSON_LDFLAGS -undefined dynamic_lookup)\nendif()",
                "if (UNIX)\n    set(cjson.fast_SOURCES fast.c)\nendif()",
                "install(FILES ${BUILD_COPY_DIRECTORIES} DESTINATION ${CMAKE_INSTALL_PREFIX})",
                "install(FILES ${cjson.util_SOURCES} DESTINATION ${INSTALL_LMOD}/cjson/util RENAME util.lua)",
                "add_library(cjson ${cjson_SOURCES})",
                "if (UNIX)\n    add_library(cjson.fast ${cjson.fast_SOURCES})");
    }

    @Test
    void testGenerationIsRepeatable() throws IOException {
        Path description = tempDir.resolve("lua-cjson.desc");
        Files.writeString(description, CJSON_DESCRIPTION);

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .dryRun(true)
                .build();

        GeneratorResult first = new CMakeGenerator(config).generate();
        GeneratorResult second = new CMakeGenerator(config).generate();

        assertThat(first.getScript()).isEqualTo(second.getScript());
    }

    @Test
    void testDryRunWritesNothing() throws IOException {
        Path description = tempDir.resolve("foo.desc");
        Files.writeString(description, "package = foo\nvariable LUA_VERSION = 5.1\n");
        Path output = tempDir.resolve("CMakeLists.txt");

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .outputFile(output)
                .dryRun(true)
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputPath()).isNull();
        assertThat(result.getScript()).contains("project(foo C CXX)", "set(LUA_VERSION 5.1)");
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testErrorsAreEmbeddedInScript() throws IOException {
        Path description = tempDir.resolve("foo.desc");
        Files.writeString(description, """
                package = foo
                supported_platforms = amiga
                not a valid line
                """);

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .dryRun(true)
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFatalErrors()).hasSize(2);
        assertThat(result.getScript()).contains(
                "message(FATAL_ERROR \"line 3: Invalid description format: not a valid line\")",
                "message(FATAL_ERROR \"unsupported platform 'amiga': no build-tool equivalent defined\")");
    }

    @Test
    void testStrictModeFailsOnErrors() throws IOException {
        Path description = tempDir.resolve("foo.desc");
        Files.writeString(description, "package = foo\nunsupported_platforms = amiga\n");
        Path output = tempDir.resolve("CMakeLists.txt");

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .outputFile(output)
                .strict(true)
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("unsupported platform 'amiga'");
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testPackageNameOverride() throws IOException {
        Path description = tempDir.resolve("foo.desc");
        Files.writeString(description, "package = foo\n");

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .packageNameOverride("bar")
                .dryRun(true)
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.getScript()).contains("project(bar C CXX)").doesNotContain("project(foo");
    }

    @Test
    void testFailsWithoutPackageName() throws IOException {
        Path description = tempDir.resolve("anon.desc");
        Files.writeString(description, "variable A = 1\n");

        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(description)
                .dryRun(true)
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("No package name");
    }

    @Test
    void testFailsOnMissingDescription() {
        GeneratorConfig config = GeneratorConfig.builder()
                .descriptionFile(tempDir.resolve("missing.desc"))
                .outputFile(tempDir.resolve("CMakeLists.txt"))
                .build();

        GeneratorResult result = new CMakeGenerator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("missing.desc");
    }
}
