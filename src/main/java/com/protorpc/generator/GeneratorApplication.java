package com.protorpc.generator;

import com.protorpc.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the protobuf gRPC bindings generator.
 * Reads descriptor sets produced by protoc and writes one Java source file per service.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
