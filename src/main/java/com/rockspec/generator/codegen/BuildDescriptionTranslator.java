package com.rockspec.generator.codegen;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rockspec.generator.cmake.CMakeConfiguration;
import com.rockspec.generator.description.BuildDescription;
import com.rockspec.generator.description.ModuleDeclaration;
import com.rockspec.generator.description.ModuleKind;
import com.rockspec.generator.platform.PlatformTranslationTable;

/**
 * Populates a {@link CMakeConfiguration} from a parsed {@link BuildDescription}.
 *
 * Variables not tied to a module are named after the description hierarchy,
 * e.g. {@code BUILD_INSTALL_LUA}. Module variables are named
 * {@code <module>_SOURCES}, {@code <module>_LIBRARIES}, {@code <module>_DEFINES},
 * {@code <module>_INCDIRS} and {@code <module>_LIBDIRS}, which is what the
 * rendered install and library directives reference.
 */
public class BuildDescriptionTranslator {
    private static final Logger log = LoggerFactory.getLogger(BuildDescriptionTranslator.class);

    public CMakeConfiguration translate(BuildDescription description) {
        CMakeConfiguration config = new CMakeConfiguration(description.getPackageName());

        description.getErrors().forEach(config::recordFatalError);
        description.getSupportedPlatforms().forEach(config::addSupportedPlatform);
        description.getUnsupportedPlatforms().forEach(config::addUnsupportedPlatform);

        description.getVariables().forEach(config::setVariable);
        description.getPlatformVariables().forEach((platform, variables) ->
                variables.forEach((name, value) -> config.setVariable(name, value, platform)));

        if (!description.getCopyDirectories().isEmpty()) {
            config.setVariable("BUILD_COPY_DIRECTORIES", join(description.getCopyDirectories()));
        }
        translateInstalls(config, null, description.getInstalls());
        description.getPlatformInstalls().forEach((platform, installs) ->
                translateInstalls(config, platform, installs));

        Map<String, ModuleDeclaration> defaults = description.getModules();
        defaults.values().forEach(module -> translateModule(config, null, module.resolveKind(), module));
        description.getPlatformModules().forEach((platform, modules) ->
                modules.values().forEach(module ->
                        translateModule(config, platform, overrideKind(module, defaults.get(module.getName())), module)));

        log.debug("Translated package {}: {} script targets, {} native targets, {} errors",
                config.getPackageName(), config.getScriptTargets().size(), config.getNativeTargets().size(),
                config.getErrors().size());
        return config;
    }

    private void translateInstalls(CMakeConfiguration config, String platform, Map<String, List<String>> installs) {
        installs.forEach((kind, paths) -> config.setVariable(
                "BUILD_INSTALL_" + kind.toUpperCase(Locale.ROOT), join(paths), platform));
    }

    /**
     * An override without an explicit type keeps the kind of the default module it extends.
     */
    private ModuleKind overrideKind(ModuleDeclaration override, ModuleDeclaration base) {
        if (override.getKind() != null || base == null) {
            return override.resolveKind();
        }
        return base.resolveKind();
    }

    private void translateModule(CMakeConfiguration config, String platform, ModuleKind kind, ModuleDeclaration module) {
        String name = module.getName();

        // Unknown platform: let the target setter report it once, skip the variables
        if (platform == null || PlatformTranslationTable.isValid(platform)) {
            setModuleVariable(config, platform, name + "_SOURCES", module.getSources());
            setModuleVariable(config, platform, name + "_LIBRARIES", module.getLibraries());
            setModuleVariable(config, platform, name + "_DEFINES", module.getDefines());
            setModuleVariable(config, platform, name + "_INCDIRS", module.getIncdirs());
            setModuleVariable(config, platform, name + "_LIBDIRS", module.getLibdirs());
        }

        if (kind == ModuleKind.SCRIPT) {
            config.addScriptTarget(name, platform);
        } else {
            config.addNativeTarget(name, platform);
        }
    }

    private void setModuleVariable(CMakeConfiguration config, String platform, String name, List<String> values) {
        if (!values.isEmpty()) {
            config.setVariable(name, join(values), platform);
        }
    }

    private static String join(List<String> values) {
        return String.join(" ", values);
    }
}
