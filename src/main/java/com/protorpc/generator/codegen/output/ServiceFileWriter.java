package com.protorpc.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protorpc.generator.codegen.GenerationException;
import com.protorpc.generator.codegen.GenerationOptions;
import com.protorpc.generator.codegen.model.Service;
import com.protorpc.generator.codegen.util.FileWriteUtil;
import com.protorpc.generator.codegen.util.NamingUtil;

/**
 * Writes one generated source file per service into the output directory.
 *
 * Writes are unconditional: an existing file is replaced, never merged.
 */
public class ServiceFileWriter {
    private static final Logger log = LoggerFactory.getLogger(ServiceFileWriter.class);

    private final GenerationOptions options;

    public ServiceFileWriter(GenerationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Module name for a service: the configured file name, snake_cased. Calls the file
     * naming function, so callers compute it once per service and pass it on.
     */
    public String moduleName(Service service) {
        String baseName = options.getFileNameFn().apply(service.getPackageName(), service.getName());
        if (baseName == null || baseName.isBlank()) {
            throw new GenerationException("File name function returned no name for service " + service.getFullName());
        }
        return NamingUtil.identifierCase(baseName);
    }

    public Path outputPath(String moduleName) {
        return options.getOutDir().resolve(moduleName + "." + options.getFileExtension());
    }

    /**
     * @param moduleName the name returned by {@link #moduleName(Service)} for this service
     * @return the file written
     * @throws GenerationException if the file cannot be written
     */
    public Path write(Service service, String moduleName, String source) {
        Path file = outputPath(moduleName);
        try {
            FileWriteUtil.safeWriteString(file, source);
        } catch (IOException e) {
            throw new GenerationException("Failed to write " + file + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} for service {}", file, service.getFullName());
        return file;
    }
}
