package com.protorpc.generator.cli.model;

import java.nio.file.Path;
import java.util.List;
import java.util.function.BiFunction;

import lombok.Value;

/**
 * Values derived from {@link GenerateOptions} once they passed validation.
 */
@Value
public class ValidatedGenerateOptions {
    Path normalizedOutDir;
    List<Path> descriptorSets;
    /** (package, service) to output base name, built from the file name pattern. */
    BiFunction<String, String, String> fileNameFn;
}
