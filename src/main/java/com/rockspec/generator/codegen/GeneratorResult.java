package com.rockspec.generator.codegen;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private String script;

    private String packageName;
    private List<String> fatalErrors;
    private int variablesCount;
    private int platformOverridesCount;
    private int scriptModulesCount;
    private int nativeModulesCount;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .fatalErrors(List.of())
                .build();
    }

    public boolean hasFatalErrors() {
        return fatalErrors != null && !fatalErrors.isEmpty();
    }
}
