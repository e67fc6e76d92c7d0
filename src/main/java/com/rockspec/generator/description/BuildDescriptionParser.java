package com.rockspec.generator.description;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for package build description files.
 *
 * Format:
 * - Package:    package = lua-cjson
 * - Platforms:  supported_platforms = unix, macosx
 *               unsupported_platforms = windows
 * - Error:      error = message passed through to the script
 * - Variable:   variable LUA_VERSION = 5.1
 * - Module:     module cjson sources = lua_cjson.c strbuf.c
 *               (fields: sources, libraries, defines, incdirs, libdirs, type)
 * - Install:    install lua = lua
 *               (kinds: lua, lib, conf, bin)
 * - Copy:       copy_directories = doc, tests
 * - Platform override: variable@windows, module@linux, install@macosx
 * - Comments:   # comment
 *
 * List values are separated by commas and/or whitespace. Lines that cannot be
 * parsed are recorded as description errors and skipped.
 */
public class BuildDescriptionParser {
    private static final Logger log = LoggerFactory.getLogger(BuildDescriptionParser.class);

    private static final Pattern PROPERTY_PATTERN = Pattern.compile(
            "^([a-z_]+)\\s*=\\s*(.*)$"
    );

    private static final Pattern VARIABLE_PATTERN = Pattern.compile(
            "^variable(?:@(\\S+))?\\s+([A-Za-z_][A-Za-z0-9_.]*)\\s*=\\s*(.*)$"
    );

    private static final Pattern MODULE_PATTERN = Pattern.compile(
            "^module(?:@(\\S+))?\\s+([A-Za-z0-9_.\\-]+)\\s+([a-z]+)\\s*=\\s*(.*)$"
    );

    private static final Pattern INSTALL_PATTERN = Pattern.compile(
            "^install(?:@(\\S+))?\\s+([a-z]+)\\s*=\\s*(.*)$"
    );

    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,\\s]+");

    private static final List<String> MODULE_FIELDS = List.of("sources", "libraries", "defines", "incdirs", "libdirs", "type");

    private static final List<String> INSTALL_KINDS = List.of("lua", "lib", "conf", "bin");

    public BuildDescription parse(Path descriptionFile) throws IOException {
        List<String> lines = Files.readAllLines(descriptionFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public BuildDescription parse(List<String> lines) {
        BuildDescription description = new BuildDescription();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                parseLine(trimmed, description);
            } catch (IllegalArgumentException e) {
                description.addError("line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse description line {}: {}", lineNum, e.getMessage());
            }
        }

        return description;
    }

    private void parseLine(String line, BuildDescription description) {
        Matcher matcher = VARIABLE_PATTERN.matcher(line);
        if (matcher.matches()) {
            description.putVariable(matcher.group(1), matcher.group(2), matcher.group(3).trim());
            log.debug("Parsed variable: {} = {} (platform: {})", matcher.group(2), matcher.group(3), matcher.group(1));
            return;
        }

        matcher = MODULE_PATTERN.matcher(line);
        if (matcher.matches()) {
            String field = matcher.group(3);
            if (!MODULE_FIELDS.contains(field)) {
                throw new IllegalArgumentException("Unknown field '" + field + "' for module " + matcher.group(2));
            }
            parseModuleField(description.module(matcher.group(1), matcher.group(2)), field, matcher.group(4));
            log.debug("Parsed module field: {}.{} (platform: {})", matcher.group(2), matcher.group(3), matcher.group(1));
            return;
        }

        matcher = INSTALL_PATTERN.matcher(line);
        if (matcher.matches()) {
            String kind = matcher.group(2);
            if (!INSTALL_KINDS.contains(kind)) {
                throw new IllegalArgumentException("Unknown install kind '" + kind + "', expected one of " + INSTALL_KINDS);
            }
            description.putInstall(matcher.group(1), kind, splitList(matcher.group(3)));
            return;
        }

        matcher = PROPERTY_PATTERN.matcher(line);
        if (matcher.matches()) {
            parseProperty(matcher.group(1), matcher.group(2).trim(), description);
            return;
        }

        throw new IllegalArgumentException("Invalid description format: " + line);
    }

    private void parseProperty(String key, String value, BuildDescription description) {
        switch (key) {
            case "package" -> description.setPackageName(value);
            case "supported_platforms" -> description.getSupportedPlatforms().addAll(splitList(value));
            case "unsupported_platforms" -> description.getUnsupportedPlatforms().addAll(splitList(value));
            case "copy_directories" -> description.getCopyDirectories().addAll(splitList(value));
            case "error" -> description.addError(value);
            default -> throw new IllegalArgumentException("Unknown property '" + key + "'");
        }
    }

    private void parseModuleField(ModuleDeclaration module, String field, String value) {
        switch (field) {
            case "sources" -> module.getSources().addAll(splitList(value));
            case "libraries" -> module.getLibraries().addAll(splitList(value));
            case "defines" -> module.getDefines().addAll(splitList(value));
            case "incdirs" -> module.getIncdirs().addAll(splitList(value));
            case "libdirs" -> module.getLibdirs().addAll(splitList(value));
            case "type" -> module.setKind(parseKind(value));
            default -> throw new IllegalArgumentException("Unknown field '" + field + "' for module " + module.getName());
        }
    }

    private ModuleKind parseKind(String value) {
        try {
            return ModuleKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown module type '" + value.trim() + "', expected script or native", e);
        }
    }

    private List<String> splitList(String value) {
        if (value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(LIST_SEPARATOR.split(value.trim()))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
