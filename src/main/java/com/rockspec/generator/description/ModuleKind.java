package com.rockspec.generator.description;

/**
 * How a module ends up in the installed package.
 */
public enum ModuleKind {
    /**
     * Installed as its Lua source file, nothing is compiled.
     */
    SCRIPT,

    /**
     * Compiled into a library and installed as a binary module.
     */
    NATIVE
}
