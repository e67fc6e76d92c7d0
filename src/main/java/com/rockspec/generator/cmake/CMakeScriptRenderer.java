package com.rockspec.generator.cmake;

import static com.rockspec.generator.cmake.CMakeTemplates.FATAL_ERROR;
import static com.rockspec.generator.cmake.CMakeTemplates.INDENT;
import static com.rockspec.generator.cmake.CMakeTemplates.INSTALL_COPY;
import static com.rockspec.generator.cmake.CMakeTemplates.INSTALL_SCRIPT_MODULE;
import static com.rockspec.generator.cmake.CMakeTemplates.NATIVE_MODULE;
import static com.rockspec.generator.cmake.CMakeTemplates.PLATFORM_BLOCK;
import static com.rockspec.generator.cmake.CMakeTemplates.PREAMBLE;
import static com.rockspec.generator.cmake.CMakeTemplates.SCRIPT_EXTENSION;
import static com.rockspec.generator.cmake.CMakeTemplates.SET_VARIABLE;
import static com.rockspec.generator.cmake.CMakeTemplates.SUPPORTED_PLATFORM_CHECK;
import static com.rockspec.generator.cmake.CMakeTemplates.UNSUPPORTED_PLATFORM_CHECK;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.rockspec.generator.platform.Platform;

/**
 * Renders a {@link CMakeConfiguration} into a CMakeLists.txt script.
 *
 * The script is the ordered concatenation of the section renderers below.
 * Each section is empty when its part of the configuration is, except the
 * preamble and the install/copy block which are always present. Rendering
 * only reads the configuration, so rendering it twice gives identical text.
 */
public class CMakeScriptRenderer {

    public String render(CMakeConfiguration config) {
        return renderPreamble(config.getPackageName())
                + renderFatalErrors(config.getErrors())
                + renderUnsupportedPlatformGuards(config.getUnsupportedPlatforms())
                + renderSupportedPlatformGuard(config.getSupportedPlatforms())
                + renderVariables(config.getVariables())
                + renderPlatformVariables(config.getPlatformVariables())
                + renderInstallCopyDirectives()
                + renderScriptModules(config.getScriptTargets())
                + renderPlatformScriptModules(config.getPlatformScriptTargets(), config.getScriptTargets())
                + renderNativeModules(config.getNativeTargets())
                + renderPlatformNativeModules(config.getPlatformNativeTargets(), config.getNativeTargets());
    }

    String renderPreamble(String packageName) {
        return String.format(PREAMBLE, packageName);
    }

    String renderFatalErrors(List<String> errors) {
        StringBuilder sb = new StringBuilder();
        for (String error : errors) {
            sb.append(String.format(FATAL_ERROR, escapeQuoted(error)));
        }
        return sb.toString();
    }

    String renderUnsupportedPlatformGuards(Collection<Platform> unsupported) {
        StringBuilder sb = new StringBuilder();
        for (Platform platform : unsupported) {
            sb.append(String.format(UNSUPPORTED_PLATFORM_CHECK, platform.getCmakeToken()));
        }
        return sb.toString();
    }

    /**
     * Aborts unless the build platform matches at least one supported platform.
     */
    String renderSupportedPlatformGuard(Collection<Platform> supported) {
        if (supported.isEmpty()) {
            return "";
        }
        String condition = supported.stream()
                .map(platform -> "NOT " + platform.getCmakeToken())
                .collect(Collectors.joining(" AND "));
        return String.format(SUPPORTED_PLATFORM_CHECK, condition);
    }

    String renderVariables(Map<String, String> variables) {
        return setVariables(variables);
    }

    String renderPlatformVariables(Map<Platform, Map<String, String>> platformVariables) {
        StringBuilder sb = new StringBuilder();
        platformVariables.forEach((platform, variables) ->
                sb.append(platformBlock(platform, setVariables(variables))));
        return sb.toString();
    }

    String renderInstallCopyDirectives() {
        return INSTALL_COPY;
    }

    String renderScriptModules(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            sb.append(installScriptModule(name));
        }
        return sb.toString();
    }

    String renderPlatformScriptModules(Map<Platform, List<String>> platformTargets, List<String> defaults) {
        StringBuilder sb = new StringBuilder();
        platformTargets.forEach((platform, names) -> {
            String body = names.stream()
                    .filter(name -> !defaults.contains(name))
                    .map(this::installScriptModule)
                    .collect(Collectors.joining());
            sb.append(platformBlock(platform, body));
        });
        return sb.toString();
    }

    String renderNativeModules(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            sb.append(String.format(NATIVE_MODULE, name));
        }
        return sb.toString();
    }

    /**
     * Platform native modules are wrapped in their platform block like every other override.
     */
    String renderPlatformNativeModules(Map<Platform, List<String>> platformTargets, List<String> defaults) {
        StringBuilder sb = new StringBuilder();
        platformTargets.forEach((platform, names) -> {
            String body = names.stream()
                    .filter(name -> !defaults.contains(name))
                    .map(name -> String.format(NATIVE_MODULE, name).stripTrailing() + "\n")
                    .collect(Collectors.joining("\n"));
            sb.append(platformBlock(platform, body));
        });
        return sb.toString();
    }

    /**
     * Installs {@code a.b.c} into {@code ${INSTALL_LMOD}/a/b/c}, renamed {@code c.lua}.
     */
    private String installScriptModule(String name) {
        String leaf = name.substring(name.lastIndexOf('.') + 1);
        return String.format(INSTALL_SCRIPT_MODULE, name, name.replace('.', '/'), leaf + "." + SCRIPT_EXTENSION);
    }

    private String setVariables(Map<String, String> variables) {
        StringBuilder sb = new StringBuilder();
        variables.forEach((name, value) -> sb.append(String.format(SET_VARIABLE, name, value)));
        return sb.toString();
    }

    // Empty body renders nothing
    private String platformBlock(Platform platform, String body) {
        if (body.isEmpty()) {
            return "";
        }
        return String.format(PLATFORM_BLOCK, platform.getCmakeToken(), indent(body));
    }

    private static String indent(String text) {
        return text.lines()
                .map(line -> line.isBlank() ? "" : INDENT + line)
                .collect(Collectors.joining("\n", "", "\n"));
    }

    private static String escapeQuoted(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("$", "\\$");
    }
}
