package com.rockspec.generator.description;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * A parsed package build description.
 *
 * Platform scoped entries are keyed by the raw platform identifier as written
 * in the description; they are validated later when the CMake configuration is
 * populated.
 */
@Data
public class BuildDescription {
    private String packageName;
    private final List<String> supportedPlatforms = new ArrayList<>();
    private final List<String> unsupportedPlatforms = new ArrayList<>();
    private final List<String> copyDirectories = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> platformVariables = new LinkedHashMap<>();

    // install kind (lua, lib, conf, bin) -> paths
    private final Map<String, List<String>> installs = new LinkedHashMap<>();
    private final Map<String, Map<String, List<String>>> platformInstalls = new LinkedHashMap<>();

    private final Map<String, ModuleDeclaration> modules = new LinkedHashMap<>();
    private final Map<String, Map<String, ModuleDeclaration>> platformModules = new LinkedHashMap<>();

    /**
     * Returns the module with the given name in the given scope, creating it on first use.
     * A null platform selects the default scope.
     */
    public ModuleDeclaration module(String platform, String name) {
        Map<String, ModuleDeclaration> scope = platform == null
                ? modules
                : platformModules.computeIfAbsent(platform, p -> new LinkedHashMap<>());
        return scope.computeIfAbsent(name, ModuleDeclaration::new);
    }

    public void putVariable(String platform, String name, String value) {
        if (platform == null) {
            variables.put(name, value);
        } else {
            platformVariables.computeIfAbsent(platform, p -> new LinkedHashMap<>()).put(name, value);
        }
    }

    public void putInstall(String platform, String kind, List<String> paths) {
        Map<String, List<String>> scope = platform == null
                ? installs
                : platformInstalls.computeIfAbsent(platform, p -> new LinkedHashMap<>());
        scope.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(paths);
    }

    public int countModules() {
        return modules.size() + platformModules.values().stream().mapToInt(Map::size).sum();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }
}
