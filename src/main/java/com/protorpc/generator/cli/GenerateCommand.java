package com.protorpc.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protorpc.generator.cli.exception.OptionsValidationException;
import com.protorpc.generator.cli.model.GenerateOptions;
import com.protorpc.generator.cli.model.ValidatedGenerateOptions;
import com.protorpc.generator.cli.output.GenerateResultsPrinter;
import com.protorpc.generator.cli.validation.GenerateOptionsValidator;
import com.protorpc.generator.codegen.BindingsGenerator;
import com.protorpc.generator.codegen.GenerationOptions;
import com.protorpc.generator.codegen.GeneratorResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating gRPC client and server bindings from protobuf descriptor sets.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "protorpc-codegen 1.0.0",
        description = "Generates gRPC client and server bindings from protobuf descriptor sets, one Java file per service."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 2;
        }

        printer.printBanner(options, validated);

        GeneratorResult result = new BindingsGenerator(toGenerationOptions(options, validated))
                .generate(validated.getDescriptorSets());

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }

    static GenerationOptions toGenerationOptions(GenerateOptions o, ValidatedGenerateOptions v) {
        return GenerationOptions.builder()
                .protoPath(o.getProtoPath())
                .codecPath(o.getCodecPath())
                .fileNameFn(v.getFileNameFn())
                .buildClient(!o.isNoClient())
                .buildServer(!o.isNoServer())
                .buildTransport(!o.isNoTransport())
                .outDir(v.getNormalizedOutDir())
                .targetPackage(o.getTargetPackage())
                .moduleIndexFile(o.getModuleIndex())
                .build();
    }
}
