package com.rockspec.generator.platform;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Platform identifiers accepted in package build descriptions, each paired with
 * the CMake predicate that is true when building on that platform.
 */
public enum Platform {
    UNIX("unix", "UNIX"),
    WINDOWS("windows", "WIN32"),
    WIN32("win32", "WIN32"),
    CYGWIN("cygwin", "CYGWIN"),
    MACOSX("macosx", "APPLE"),
    // CMake has no dedicated predicates for these, UNIX is the closest match
    LINUX("linux", "UNIX"),
    FREEBSD("freebsd", "UNIX");

    private static final Map<String, Platform> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Platform::getId, Function.identity()));

    private final String id;
    private final String cmakeToken;

    Platform(String id, String cmakeToken) {
        this.id = id;
        this.cmakeToken = cmakeToken;
    }

    public String getId() {
        return id;
    }

    public String getCmakeToken() {
        return cmakeToken;
    }

    /**
     * Looks up a platform by its description identifier. Matching is exact.
     */
    public static Optional<Platform> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ID.get(id));
    }
}
