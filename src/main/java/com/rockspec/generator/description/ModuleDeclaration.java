package com.rockspec.generator.description;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * A single module entry of a build description.
 */
@Data
public class ModuleDeclaration {
    private final String name;
    private final List<String> sources = new ArrayList<>();
    private final List<String> libraries = new ArrayList<>();
    private final List<String> defines = new ArrayList<>();
    private final List<String> incdirs = new ArrayList<>();
    private final List<String> libdirs = new ArrayList<>();

    /**
     * Explicit kind, null when the description did not declare one.
     */
    private ModuleKind kind;

    /**
     * Returns the declared kind, or infers it: a module made only of .lua files is a script module.
     */
    public ModuleKind resolveKind() {
        if (kind != null) {
            return kind;
        }
        boolean allLua = !sources.isEmpty() && sources.stream().allMatch(s -> s.endsWith(".lua"));
        return allLua ? ModuleKind.SCRIPT : ModuleKind.NATIVE;
    }
}
