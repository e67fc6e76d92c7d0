package com.rockspec.generator.cmake;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rockspec.generator.platform.Platform;

import lombok.Getter;
import lombok.NonNull;

/**
 * Accumulates everything the CMake script for one package is rendered from.
 *
 * State only changes through the setters below. Setters taking a platform
 * identifier validate it first; an unknown identifier appends a single fatal
 * error and leaves the rest of the state untouched. Nothing is thrown, so a
 * script is always produced and the error surfaces when CMake runs it.
 *
 * An instance belongs to a single generation run and is not thread-safe.
 */
public class CMakeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CMakeConfiguration.class);

    @Getter
    private final String packageName;

    private final List<String> errors = new ArrayList<>();
    private final Set<Platform> supportedPlatforms = new LinkedHashSet<>();
    private final Set<Platform> unsupportedPlatforms = new LinkedHashSet<>();

    // Module dependent variables are named <module>_{SOURCES|LIBRARIES|DEFINES|INCDIRS|LIBDIRS},
    // install related ones follow the description hierarchy, e.g. BUILD_INSTALL_LUA
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Map<Platform, Map<String, String>> platformVariables = new LinkedHashMap<>();

    // Target names only. A platform target is platform specific only when it is
    // missing from the matching default list.
    private final List<String> scriptTargets = new ArrayList<>();
    private final Map<Platform, List<String>> platformScriptTargets = new LinkedHashMap<>();
    private final List<String> nativeTargets = new ArrayList<>();
    private final Map<Platform, List<String>> platformNativeTargets = new LinkedHashMap<>();

    public CMakeConfiguration(@NonNull String packageName) {
        this.packageName = packageName;
    }

    public void recordFatalError(String message) {
        errors.add(message);
    }

    public void addSupportedPlatform(String platformId) {
        validPlatform(platformId).ifPresent(platform -> {
            if (unsupportedPlatforms.contains(platform)) {
                log.warn("Platform '{}' is declared both supported and unsupported", platformId);
            }
            supportedPlatforms.add(platform);
        });
    }

    public void addUnsupportedPlatform(String platformId) {
        validPlatform(platformId).ifPresent(platform -> {
            if (supportedPlatforms.contains(platform)) {
                log.warn("Platform '{}' is declared both supported and unsupported", platformId);
            }
            unsupportedPlatforms.add(platform);
        });
    }

    public void setVariable(String name, String value) {
        variables.put(name, value);
    }

    public void setVariable(String name, String value, String platformId) {
        if (platformId == null) {
            setVariable(name, value);
            return;
        }
        validPlatform(platformId).ifPresent(platform ->
                platformVariables.computeIfAbsent(platform, p -> new LinkedHashMap<>()).put(name, value));
    }

    public void addScriptTarget(String name) {
        scriptTargets.add(name);
    }

    public void addScriptTarget(String name, String platformId) {
        if (platformId == null) {
            addScriptTarget(name);
            return;
        }
        validPlatform(platformId).ifPresent(platform ->
                platformScriptTargets.computeIfAbsent(platform, p -> new ArrayList<>()).add(name));
    }

    public void addNativeTarget(String name) {
        nativeTargets.add(name);
    }

    public void addNativeTarget(String name, String platformId) {
        if (platformId == null) {
            addNativeTarget(name);
            return;
        }
        validPlatform(platformId).ifPresent(platform ->
                platformNativeTargets.computeIfAbsent(platform, p -> new ArrayList<>()).add(name));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Set<Platform> getSupportedPlatforms() {
        return Collections.unmodifiableSet(supportedPlatforms);
    }

    public Set<Platform> getUnsupportedPlatforms() {
        return Collections.unmodifiableSet(unsupportedPlatforms);
    }

    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<Platform, Map<String, String>> getPlatformVariables() {
        return readOnly(platformVariables, Collections::unmodifiableMap);
    }

    public List<String> getScriptTargets() {
        return Collections.unmodifiableList(scriptTargets);
    }

    public Map<Platform, List<String>> getPlatformScriptTargets() {
        return readOnly(platformScriptTargets, Collections::unmodifiableList);
    }

    public List<String> getNativeTargets() {
        return Collections.unmodifiableList(nativeTargets);
    }

    public Map<Platform, List<String>> getPlatformNativeTargets() {
        return readOnly(platformNativeTargets, Collections::unmodifiableList);
    }

    // Read-only down to the per-platform collections
    private static <V> Map<Platform, V> readOnly(Map<Platform, V> byPlatform, UnaryOperator<V> wrap) {
        Map<Platform, V> view = new LinkedHashMap<>();
        byPlatform.forEach((platform, values) -> view.put(platform, wrap.apply(values)));
        return Collections.unmodifiableMap(view);
    }

    private Optional<Platform> validPlatform(String platformId) {
        Optional<Platform> platform = Platform.fromId(platformId);
        if (platform.isEmpty()) {
            log.warn("No CMake equivalent for platform '{}', recording fatal error", platformId);
            recordFatalError("unsupported platform '" + platformId + "': no build-tool equivalent defined");
        }
        return platform;
    }
}
