package com.protorpc.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protorpc.generator.cli.model.GenerateOptions;
import com.protorpc.generator.cli.model.ValidatedGenerateOptions;
import com.protorpc.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("protorpc gRPC bindings generator");
        log.info("=================================================");
        for (Path descriptorSet : v.getDescriptorSets()) {
            log.info("Descriptor Set: {}", descriptorSet.toAbsolutePath());
        }
        log.info("Output Directory: {}", v.getNormalizedOutDir());
        log.info("Proto Path: {}", o.getProtoPath().isEmpty() ? "(proto package)" : o.getProtoPath());
        log.info("Codec: {}", o.getCodecPath());
        log.info("File Name Pattern: {}", o.getFileNamePattern());
        log.info("Target Package: {}", o.getTargetPackage() != null ? o.getTargetPackage() : "(per service)");
        log.info("Client: {}  Server: {}  Transport: {}", !o.isNoClient(), !o.isNoServer(), !o.isNoTransport());
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputDir());
        log.info("Services Generated: {}", result.getServicesGenerated());
        log.info("Methods Generated: {}", result.getMethodsGenerated());
        for (Path file : result.getWrittenFiles()) {
            log.info("  {}", file.getFileName());
        }
        if (result.getModuleIndexPath() != null) {
            log.info("Module Index: {} ({})", result.getModuleIndexPath(),
                    result.isModuleIndexWritten() ? "updated" : "unchanged");
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
