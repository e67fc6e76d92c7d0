package com.rockspec.generator.platform;

import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Translates description platform identifiers into CMake conditional tokens.
 */
@UtilityClass
public class PlatformTranslationTable {

    /**
     * Returns the CMake token for the identifier, or empty when no equivalent is defined.
     */
    public Optional<String> translate(String platformId) {
        return Platform.fromId(platformId).map(Platform::getCmakeToken);
    }

    public boolean isValid(String platformId) {
        return translate(platformId).isPresent();
    }
}
