package com.protorpc.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputDir;

    private int servicesGenerated;
    private int methodsGenerated;

    @Singular("writtenFile")
    private List<Path> writtenFiles;

    private Path moduleIndexPath;
    private boolean moduleIndexWritten;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
